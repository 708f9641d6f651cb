package org.threatmodel.github.integration;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Files threats as GitHub issues labelled {@code security} and {@code severity:<level>}.
 */
public class ThreatIssueService {

	private static final Logger logger = LoggerFactory.getLogger(ThreatIssueService.class);

	@Nullable
	private final RestService restService;

	public ThreatIssueService(@Nullable RestService restService) {
		this.restService = restService;
	}

	/**
	 * Create an issue for {@code threat}.
	 * @param repositoryFullName {@code owner/repo} or any URL form
	 * @param threat the threat to report
	 * @return the issue URL, or empty if the API call failed
	 * @throws NotConfiguredException if no API client is configured
	 * @throws IllegalArgumentException if the repository name is invalid
	 */
	public Optional<String> createThreatIssue(String repositoryFullName, ThreatFinding threat) {
		if (restService == null) {
			throw new NotConfiguredException("GitHub client not configured");
		}
		ParsedRepositoryUrl repository = RepositoryUrlParser.parse(repositoryFullName);
		if (!repository.isValid()) {
			throw new IllegalArgumentException("Invalid repository: " + repositoryFullName);
		}
		try {
			IssueInfo issue = restService.createIssue(repository.owner(), repository.repo(), title(threat),
					body(threat), List.of("security", "severity:" + threat.severity()));
			return Optional.of(issue.htmlUrl());
		}
		catch (GitHubApiException e) {
			logger.error("Failed to create GitHub issue in {} for threat '{}': {}", repositoryFullName, threat.name(),
					e.getMessage());
			return Optional.empty();
		}
	}

	static String title(ThreatFinding threat) {
		return "[Security] " + threat.name();
	}

	static String body(ThreatFinding threat) {
		return "## Threat Details\n\n" + "**Severity:** " + threat.severity().toUpperCase(Locale.ROOT) + "\n\n"
				+ "### Description\n" + threat.description() + "\n\n" + "### Recommended Mitigation\n"
				+ threat.mitigation() + "\n\n" + "---\n"
				+ "*This issue was automatically created by the Threat Modeling Platform*\n";
	}

}
