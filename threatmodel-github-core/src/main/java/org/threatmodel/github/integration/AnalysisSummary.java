package org.threatmodel.github.integration;

import java.util.List;

/**
 * Headline numbers of a {@link RepositoryAnalysis}, used in PR comments and stored with
 * the analysis record.
 */
public record AnalysisSummary(int totalFiles, int infrastructureFiles, int codeFiles, int configFiles,
		List<String> dependencyEcosystems) {

	public AnalysisSummary {
		dependencyEcosystems = List.copyOf(dependencyEcosystems);
	}

	public static AnalysisSummary from(RepositoryAnalysis analysis) {
		return new AnalysisSummary(analysis.statistics().totalFiles(), analysis.files().infrastructure().size(),
				analysis.files().code().size(), analysis.files().config().size(),
				analysis.dependencies().keySet().stream().sorted().toList());
	}

}
