package org.threatmodel.github.integration;

import java.util.List;

/**
 * Interface for GitHub REST API operations used by the integration.
 *
 * <p>
 * Returns strongly-typed DTOs instead of raw JSON to encapsulate the GitHub API response
 * structure. All calls go through a {@link GitHubClient} and therefore share its rate limit
 * and retry behavior.
 */
public interface RestService {

	/**
	 * Get current rate limit status from {@code GET /rate_limit}.
	 * @return core rate limit information
	 */
	RateLimitState getRateLimit();

	/**
	 * Get repository metadata.
	 * @param owner repository owner
	 * @param repo repository name
	 * @return repository information
	 */
	RepositoryInfo getRepository(String owner, String repo);

	/**
	 * Create an issue.
	 * @param owner repository owner
	 * @param repo repository name
	 * @param title issue title
	 * @param body markdown body
	 * @param labels labels to apply (may be empty)
	 * @return the created issue
	 */
	IssueInfo createIssue(String owner, String repo, String title, String body, List<String> labels);

	/**
	 * Create a comment on an issue or pull request.
	 * @param owner repository owner
	 * @param repo repository name
	 * @param issueNumber issue or PR number
	 * @param body markdown body
	 */
	void createComment(String owner, String repo, int issueNumber, String body);

	/**
	 * Get a pull request by number.
	 * @param owner repository owner
	 * @param repo repository name
	 * @param prNumber PR number
	 * @return pull request details
	 */
	PullRequestInfo getPullRequest(String owner, String repo, int prNumber);

}
