package org.threatmodel.github.integration;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Result of walking a cloned repository.
 *
 * @param repositoryUrl the URL that was cloned
 * @param analyzedAt when the analysis finished
 * @param files files grouped by category
 * @param dependencies declared dependencies keyed by ecosystem (npm, python, go, maven)
 * @param statistics totals over all files
 */
public record RepositoryAnalysis(String repositoryUrl, Instant analyzedAt, CategorizedFiles files,
		Map<String, List<String>> dependencies, Statistics statistics) {

	public RepositoryAnalysis {
		dependencies = Map.copyOf(dependencies);
	}

	/**
	 * Files by category. A file appears in {@code all} and in at most one other list.
	 */
	public record CategorizedFiles(List<FileEntry> infrastructure, List<FileEntry> code, List<FileEntry> config,
			List<FileEntry> all) {

		public CategorizedFiles {
			infrastructure = List.copyOf(infrastructure);
			code = List.copyOf(code);
			config = List.copyOf(config);
			all = List.copyOf(all);
		}

	}

	/**
	 * @param totalFiles number of files
	 * @param totalSize sum of file sizes in bytes
	 * @param fileTypes count per extension, {@code no-extension} for files without one
	 */
	public record Statistics(int totalFiles, long totalSize, Map<String, Integer> fileTypes) {

		public Statistics {
			fileTypes = Map.copyOf(fileTypes);
		}

	}

}
