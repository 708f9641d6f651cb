package org.threatmodel.github.integration;

import java.nio.file.Path;

/**
 * Analyzes a checked-out repository tree.
 */
public interface RepositoryAnalyzer {

	/**
	 * @param root root of the working tree
	 * @param repositoryUrl URL the tree was cloned from
	 * @return the analysis
	 * @throws AnalysisException if the tree cannot be read
	 */
	RepositoryAnalysis analyzeTree(Path root, String repositoryUrl);

}
