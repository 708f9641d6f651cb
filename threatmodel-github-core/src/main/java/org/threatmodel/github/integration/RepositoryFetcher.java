package org.threatmodel.github.integration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Comparator;
import java.util.UUID;
import java.util.stream.Stream;

/**
 * Clones a repository into a fresh temporary directory, analyzes it and removes the
 * directory again.
 *
 * <p>
 * Every call gets its own directory, so concurrent fetches never share state. The
 * directory is removed on every exit path; a failure to remove it is logged and never
 * replaces the clone or analysis error.
 */
public class RepositoryFetcher {

	private static final Logger logger = LoggerFactory.getLogger(RepositoryFetcher.class);

	// a killed clone may leave a writer running for a few milliseconds
	private static final int CLEANUP_ATTEMPTS = 3;

	private static final Duration CLEANUP_RETRY_DELAY = Duration.ofMillis(200);

	private final RepositoryCloner cloner;

	private final RepositoryAnalyzer analyzer;

	private final Path tempRoot;

	public RepositoryFetcher(RepositoryCloner cloner, RepositoryAnalyzer analyzer) {
		this(cloner, analyzer, defaultTempRoot());
	}

	public RepositoryFetcher(RepositoryCloner cloner, RepositoryAnalyzer analyzer, Path tempRoot) {
		this.cloner = cloner;
		this.analyzer = analyzer;
		this.tempRoot = tempRoot;
	}

	public static Path defaultTempRoot() {
		return Paths.get(System.getProperty("java.io.tmpdir"), "github-repos");
	}

	public Path getTempRoot() {
		return tempRoot;
	}

	public RepositoryAnalysis fetchAndAnalyze(String repositoryUrl) {
		return fetchAndAnalyze(repositoryUrl, FetchOptions.defaults());
	}

	/**
	 * Shallow-clone and analyze a repository.
	 * @param repositoryUrl URL to clone
	 * @param options clone options
	 * @return the analysis
	 * @throws CloneException if the clone fails or times out
	 * @throws AnalysisException if the cloned tree cannot be analyzed
	 */
	public RepositoryAnalysis fetchAndAnalyze(String repositoryUrl, FetchOptions options) {
		Path workDir = tempRoot.resolve("repo-" + UUID.randomUUID());
		try {
			Files.createDirectories(tempRoot);
		}
		catch (IOException e) {
			throw new CloneException("Cannot create clone root " + tempRoot + ": " + e.getMessage(), e);
		}

		try {
			cloner.cloneRepository(repositoryUrl, workDir, options);
			try {
				return analyzer.analyzeTree(workDir, repositoryUrl);
			}
			catch (AnalysisException e) {
				throw e;
			}
			catch (RuntimeException e) {
				throw new AnalysisException("Analysis of " + repositoryUrl + " failed: " + e.getMessage(), e);
			}
		}
		finally {
			cleanup(workDir);
		}
	}

	void cleanup(Path workDir) {
		for (int attempt = 1; Files.exists(workDir); attempt++) {
			try {
				deleteTree(workDir);
				logger.debug("Removed clone directory {}", workDir);
				return;
			}
			catch (IOException | UncheckedIOException e) {
				if (attempt >= CLEANUP_ATTEMPTS) {
					logger.warn("Failed to remove clone directory {}: {}", workDir, e.getMessage());
					return;
				}
				logger.debug("Retrying removal of {} after: {}", workDir, e.getMessage());
				try {
					Thread.sleep(CLEANUP_RETRY_DELAY.toMillis());
				}
				catch (InterruptedException ie) {
					Thread.currentThread().interrupt();
					logger.warn("Interrupted while removing clone directory {}", workDir);
					return;
				}
			}
		}
	}

	private static void deleteTree(Path dir) throws IOException {
		try (Stream<Path> paths = Files.walk(dir)) {
			paths.sorted(Comparator.reverseOrder()).forEach(path -> {
				try {
					Files.deleteIfExists(path);
				}
				catch (IOException e) {
					throw new UncheckedIOException(e);
				}
			});
		}
	}

}
