package org.threatmodel.github.integration.cli;

import org.threatmodel.github.integration.IntegrationProperties;
import org.threatmodel.github.integration.RepositoryUrlParser;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Command-line argument parser for the repository scan CLI. Pure Java implementation
 * with no Spring dependencies for maximum testability.
 */
public class ArgumentParser {

	private final IntegrationProperties defaultProperties;

	public ArgumentParser(IntegrationProperties defaultProperties) {
		this.defaultProperties = defaultProperties;
	}

	/**
	 * Parse command-line arguments and return configuration.
	 * @param args Command-line arguments
	 * @return Parsed configuration object
	 * @throws IllegalArgumentException if arguments are invalid
	 */
	public ParsedConfiguration parseAndValidate(String[] args) {
		ParsedConfiguration config = new ParsedConfiguration(defaultProperties);

		for (int i = 0; i < args.length; i++) {
			String arg = args[i];

			switch (arg) {
				case "-r", "--repo":
					config.repositories.add(getRequiredValue(args, i, "repo"));
					i++;
					break;

				case "-f", "--repos-file":
					config.repositoriesFile = getRequiredValue(args, i, "repos-file");
					i++;
					break;

				case "-c", "--concurrency":
					config.concurrency = parsePositive(getRequiredValue(args, i, "concurrency"), "concurrency");
					i++;
					break;

				case "-b", "--branch":
					config.branch = getRequiredValue(args, i, "branch");
					i++;
					break;

				case "--depth":
					config.depth = parsePositive(getRequiredValue(args, i, "depth"), "depth");
					i++;
					break;

				case "-t", "--timeout":
					config.timeoutSeconds = parsePositive(getRequiredValue(args, i, "timeout"), "timeout");
					i++;
					break;

				case "-o", "--output":
					config.outputFile = getRequiredValue(args, i, "output");
					i++;
					break;

				case "-v", "--verbose":
					config.verbose = true;
					break;

				case "-h", "--help":
					config.helpRequested = true;
					break;

				default:
					if (arg.startsWith("-")) {
						throw new IllegalArgumentException("Unknown option: " + arg);
					}
					config.repositories.add(arg);
					break;
			}
		}

		validateConfiguration(config);
		return config;
	}

	/**
	 * Check if help is requested without full parsing.
	 * @param args Command-line arguments
	 * @return true if help is requested
	 */
	public boolean isHelpRequested(String[] args) {
		for (String arg : args) {
			if ("-h".equals(arg) || "--help".equals(arg)) {
				return true;
			}
		}
		return false;
	}

	/**
	 * All repositories to scan: {@code --repo} values first, then the lines of
	 * {@code --repos-file}, duplicates removed. Blank lines and {@code #} comments in the
	 * file are ignored.
	 * @throws IllegalArgumentException if the file cannot be read
	 */
	public List<String> resolveRepositories(ParsedConfiguration config) {
		LinkedHashSet<String> repositories = new LinkedHashSet<>(config.repositories);
		if (config.repositoriesFile != null) {
			Path file = Path.of(config.repositoriesFile);
			try {
				for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
					String trimmed = line.trim();
					if (!trimmed.isEmpty() && !trimmed.startsWith("#")) {
						repositories.add(trimmed);
					}
				}
			}
			catch (IOException e) {
				throw new IllegalArgumentException("Cannot read repositories file '" + file + "': " + e.getMessage(),
						e);
			}
		}
		return new ArrayList<>(repositories);
	}

	/**
	 * Generate help text for command-line usage.
	 * @return Help text string
	 */
	public String generateHelpText() {
		StringBuilder help = new StringBuilder();
		help.append("Usage: java -jar threatmodel-github-cli.jar [OPTIONS] [REPO_URL...]\n");
		help.append("\n");
		help.append("Shallow-clone and analyze GitHub repositories, printing a JSON report.\n");
		help.append("\n");
		help.append("OPTIONS:\n");
		help.append("    -h, --help                Show this help message\n");
		help.append("    -r, --repo URL            Repository URL or owner/repo (repeatable)\n");
		help.append("    -f, --repos-file FILE     File with one repository per line\n");
		help.append("    -c, --concurrency N       Repositories analyzed in parallel (default: ")
			.append(defaultProperties.getDefaultBatchConcurrency())
			.append(")\n");
		help.append("    -b, --branch BRANCH       Branch to clone (default: remote default branch)\n");
		help.append("    --depth N                 Clone depth (default: 1)\n");
		help.append("    -t, --timeout SECONDS     Clone timeout per repository (default: ")
			.append(defaultProperties.getCloneTimeout().toSeconds())
			.append(")\n");
		help.append("    -o, --output FILE         Write the JSON report to FILE instead of stdout\n");
		help.append("    -v, --verbose             Log per-repository statistics\n");
		help.append("\n");
		help.append("ENVIRONMENT VARIABLES:\n");
		help.append("    GIT_CLONE_TIMEOUT_SECONDS Default clone timeout\n");
		help.append("    BATCH_CONCURRENCY         Default concurrency\n");
		help.append("    CLONE_TEMP_ROOT           Directory for temporary clones\n");
		help.append("\n");
		help.append("EXIT CODES:\n");
		help.append("    0  every repository was analyzed\n");
		help.append("    1  invalid arguments or unexpected error\n");
		help.append("    2  at least one repository failed\n");
		help.append("\n");
		help.append("EXAMPLES:\n");
		help.append("    java -jar threatmodel-github-cli.jar --repo octo/infra --repo octo/api\n");
		help.append("    java -jar threatmodel-github-cli.jar --repos-file repos.txt --concurrency 5 -o report.json\n");
		help.append("\n");
		return help.toString();
	}

	private String getRequiredValue(String[] args, int currentIndex, String optionName) {
		if (currentIndex + 1 >= args.length) {
			throw new IllegalArgumentException("Missing value for " + optionName + " option");
		}
		return args[currentIndex + 1];
	}

	private int parsePositive(String value, String optionName) {
		int parsed;
		try {
			parsed = Integer.parseInt(value);
		}
		catch (NumberFormatException e) {
			throw new IllegalArgumentException(
					"Invalid " + optionName + " '" + value + "': must be a positive integer");
		}
		if (parsed <= 0) {
			throw new IllegalArgumentException("Invalid " + optionName + " '" + value + "': must be positive");
		}
		return parsed;
	}

	private void validateConfiguration(ParsedConfiguration config) {
		if (config.helpRequested) {
			return;
		}
		List<String> errors = new ArrayList<>();

		if (config.repositories.isEmpty() && config.repositoriesFile == null) {
			errors.add("At least one --repo or a --repos-file is required");
		}
		for (String repository : config.repositories) {
			if (!RepositoryUrlParser.parse(repository).isValid()) {
				errors.add("Invalid repository '" + repository + "': expected a URL or owner/repo");
			}
		}

		if (!errors.isEmpty()) {
			throw new IllegalArgumentException("Configuration validation failed:\n  - " + String.join("\n  - ", errors));
		}
	}

}
