package org.threatmodel.github.integration;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Service for GitHub REST API operations.
 *
 * <p>
 * Converts GitHub API JSON responses to strongly-typed DTOs at the service boundary. API
 * failures propagate as {@link GitHubApiException}; callers decide whether a failure is
 * fatal.
 */
public class GitHubRestService implements RestService {

	private static final Logger logger = LoggerFactory.getLogger(GitHubRestService.class);

	private final GitHubClient httpClient;

	private final ObjectMapper objectMapper;

	public GitHubRestService(GitHubClient httpClient, ObjectMapper objectMapper) {
		this.httpClient = httpClient;
		this.objectMapper = objectMapper;
	}

	@Override
	public RateLimitState getRateLimit() {
		JsonNode core = readTree(httpClient.get("/rate_limit")).path("resources").path("core");
		return new RateLimitState(core.path("limit").asInt(-1), core.path("remaining").asInt(-1),
				core.path("reset").asLong(-1), core.path("used").asInt(0));
	}

	@Override
	public RepositoryInfo getRepository(String owner, String repo) {
		JsonNode node = readTree(httpClient.get(repoPath(owner, repo)));
		return new RepositoryInfo(node.path("id").asLong(), node.path("name").asText(),
				node.path("full_name").asText(), JsonNodeUtils.getString(node, "description").orElse(null),
				node.path("html_url").asText(), node.path("clone_url").asText(), node.path("private").asBoolean(),
				node.path("default_branch").asText("main"));
	}

	@Override
	public IssueInfo createIssue(String owner, String repo, String title, String body, List<String> labels) {
		Map<String, Object> payload = new LinkedHashMap<>();
		payload.put("title", title);
		payload.put("body", body);
		if (!labels.isEmpty()) {
			payload.put("labels", labels);
		}
		JsonNode node = readTree(httpClient.post(repoPath(owner, repo) + "/issues", writeJson(payload)));
		IssueInfo issue = new IssueInfo(node.path("number").asInt(), node.path("title").asText(),
				node.path("state").asText(), node.path("html_url").asText());
		logger.info("GitHub issue created: {}/{}#{}", owner, repo, issue.number());
		return issue;
	}

	@Override
	public void createComment(String owner, String repo, int issueNumber, String body) {
		httpClient.post(repoPath(owner, repo) + "/issues/" + issueNumber + "/comments", writeJson(Map.of("body", body)));
		logger.info("GitHub comment created: {}/{}#{}", owner, repo, issueNumber);
	}

	@Override
	public PullRequestInfo getPullRequest(String owner, String repo, int prNumber) {
		JsonNode node = readTree(httpClient.get(repoPath(owner, repo) + "/pulls/" + prNumber));
		return new PullRequestInfo(node.path("number").asInt(), node.path("title").asText(),
				node.path("state").asText(), node.path("html_url").asText(), node.path("head").path("ref").asText(),
				node.path("head").path("sha").asText(), node.path("base").path("ref").asText(),
				node.path("base").path("sha").asText());
	}

	private static String repoPath(String owner, String repo) {
		return "/repos/" + owner + "/" + repo;
	}

	private JsonNode readTree(String json) {
		try {
			return objectMapper.readTree(json);
		}
		catch (JsonProcessingException e) {
			throw new IntegrationException("Malformed GitHub API response: " + e.getOriginalMessage(), e);
		}
	}

	private String writeJson(Object payload) {
		try {
			return objectMapper.writeValueAsString(payload);
		}
		catch (JsonProcessingException e) {
			throw new IntegrationException("Failed to serialize request body", e);
		}
	}

}
