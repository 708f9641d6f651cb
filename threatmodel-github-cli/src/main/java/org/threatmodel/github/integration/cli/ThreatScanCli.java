package org.threatmodel.github.integration.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.threatmodel.github.integration.BatchOrchestrator;
import org.threatmodel.github.integration.BatchResult;
import org.threatmodel.github.integration.FetchOptions;
import org.threatmodel.github.integration.GitHubIntegrationBuilder;
import org.threatmodel.github.integration.IntegrationProperties;
import org.threatmodel.github.integration.ObjectMapperFactory;
import org.threatmodel.github.integration.RepositoryAnalysis;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Threat Scan CLI Application
 *
 * Plain Java command-line application that shallow-clones and analyzes one or more
 * repositories with bounded concurrency and prints a JSON report. No Spring dependencies,
 * uses GitHubIntegrationBuilder for service wiring.
 *
 * Usage: java -jar threatmodel-github-cli.jar [OPTIONS] [REPO_URL...]
 *
 * Exit codes: 0 when every repository was analyzed, 2 when some failed, 1 on invalid
 * arguments or an unexpected error.
 */
public class ThreatScanCli {

	private static final Logger logger = LoggerFactory.getLogger(ThreatScanCli.class);

	static final int EXIT_OK = 0;

	static final int EXIT_ERROR = 1;

	static final int EXIT_PARTIAL_FAILURE = 2;

	public static void main(String[] args) {
		int exitCode;
		try {
			IntegrationProperties properties = IntegrationProperties.fromEnvironment();
			exitCode = run(args, System.out, properties, GitHubIntegrationBuilder.create().properties(properties));
		}
		catch (Exception e) {
			logger.error("Scan failed: {}", e.getMessage());
			exitCode = EXIT_ERROR;
		}
		if (exitCode != EXIT_OK) {
			System.exit(exitCode);
		}
	}

	static int run(String[] args, PrintStream out, IntegrationProperties properties, GitHubIntegrationBuilder builder)
			throws IOException {
		ArgumentParser argumentParser = new ArgumentParser(properties);

		if (argumentParser.isHelpRequested(args)) {
			out.println(argumentParser.generateHelpText());
			return EXIT_OK;
		}

		ParsedConfiguration config;
		List<String> repositories;
		try {
			config = argumentParser.parseAndValidate(args);
			repositories = argumentParser.resolveRepositories(config);
		}
		catch (IllegalArgumentException e) {
			logger.error("{}", e.getMessage());
			logger.error("Run with --help for usage");
			return EXIT_ERROR;
		}
		if (repositories.isEmpty()) {
			logger.error("No repositories to scan");
			return EXIT_ERROR;
		}

		logConfiguration(config, repositories);

		Duration timeout = config.timeoutSeconds != null ? Duration.ofSeconds(config.timeoutSeconds) : null;
		BatchOrchestrator orchestrator = builder
			.fetchOptions(new FetchOptions(config.branch, config.depth, true, timeout))
			.buildBatchOrchestrator();

		BatchResult result = orchestrator.analyzeMany(repositories, config.concurrency);
		logResults(result, config.verbose);

		ScanReport report = ScanReport.from(result, config.concurrency, Instant.now());
		writeReport(report, config.outputFile, out);

		return result.allSucceeded() ? EXIT_OK : EXIT_PARTIAL_FAILURE;
	}

	private static void writeReport(ScanReport report, @Nullable String outputFile, PrintStream out) throws IOException {
		ObjectMapper objectMapper = ObjectMapperFactory.create();
		String json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(report);
		if (outputFile == null) {
			out.println(json);
			return;
		}
		Path path = Path.of(outputFile).toAbsolutePath();
		if (path.getParent() != null) {
			Files.createDirectories(path.getParent());
		}
		Files.writeString(path, json + System.lineSeparator());
		logger.info("Report written to {}", path);
	}

	private static void logConfiguration(ParsedConfiguration config, List<String> repositories) {
		logger.info("Configuration:");
		logger.info("  Repositories: {}", repositories.size());
		logger.info("  Concurrency: {}", config.concurrency);
		logger.info("  Branch: {}", config.branch != null ? config.branch : "(default)");
		logger.info("  Depth: {}", config.depth);
		logger.info("  Timeout: {}", config.timeoutSeconds != null ? config.timeoutSeconds + "s" : "(default)");
		logger.info("  Output: {}", config.outputFile != null ? config.outputFile : "(stdout)");
	}

	private static void logResults(BatchResult result, boolean verbose) {
		logger.info("Scan completed: {} analyzed, {} failed", result.succeeded().size(), result.failed().size());

		if (verbose) {
			for (Map.Entry<String, RepositoryAnalysis> entry : result.succeeded().entrySet()) {
				RepositoryAnalysis analysis = entry.getValue();
				logger.info("  - {}: {} files, {} bytes, types {}", entry.getKey(),
						analysis.statistics().totalFiles(), analysis.statistics().totalSize(),
						analysis.statistics().fileTypes());
			}
		}
		for (Map.Entry<String, Throwable> entry : result.failed().entrySet()) {
			logger.warn("  FAILED {}: {}", entry.getKey(), entry.getValue().getMessage());
		}
	}

}
