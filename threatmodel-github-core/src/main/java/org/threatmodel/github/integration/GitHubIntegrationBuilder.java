package org.threatmodel.github.integration;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Builder for wiring the integration without Spring.
 *
 * <p>
 * Example usage:
 * </p>
 *
 * <pre>
 * {@code
 * // Everything from the environment
 * WebhookEventProcessor processor = GitHubIntegrationBuilder.create()
 *     .properties(IntegrationProperties.fromEnvironment())
 *     .buildWebhookEventProcessor();
 *
 * // Bulk analysis without API access
 * BatchOrchestrator orchestrator = GitHubIntegrationBuilder.create()
 *     .buildBatchOrchestrator();
 * BatchResult result = orchestrator.analyzeMany(urls, 5);
 *
 * // For testing with mock HTTP client
 * GitHubClient mockClient = mock(GitHubClient.class);
 * RestService rest = GitHubIntegrationBuilder.create()
 *     .httpClient(mockClient)
 *     .buildRestService();
 * }
 * </pre>
 */
public class GitHubIntegrationBuilder {

	@Nullable
	private String token;

	private IntegrationProperties properties;

	@Nullable
	private ObjectMapper objectMapper;

	@Nullable
	private GitHubClient httpClient;

	@Nullable
	private AuditSink auditSink;

	@Nullable
	private ThreatModelStore threatModelStore;

	@Nullable
	private RepositoryCloner repositoryCloner;

	@Nullable
	private RepositoryAnalyzer repositoryAnalyzer;

	private FetchOptions fetchOptions = FetchOptions.defaults();

	private final List<PostAnalysisEffect> additionalEffects = new ArrayList<>();

	private GitHubIntegrationBuilder() {
		this.properties = new IntegrationProperties();
	}

	/**
	 * Create a new builder instance.
	 * @return new GitHubIntegrationBuilder
	 */
	public static GitHubIntegrationBuilder create() {
		return new GitHubIntegrationBuilder();
	}

	/**
	 * Set the GitHub token directly. Takes precedence over the properties' token.
	 * @param token GitHub personal access token
	 * @return this builder
	 */
	public GitHubIntegrationBuilder token(String token) {
		this.token = token;
		return this;
	}

	/**
	 * Read the GitHub token from {@code GITHUB_TOKEN} via {@link EnvironmentSupport}.
	 * @return this builder
	 * @throws NotConfiguredException if GITHUB_TOKEN is not set
	 */
	public GitHubIntegrationBuilder tokenFromEnv() {
		this.token = EnvironmentSupport.get("GITHUB_TOKEN");
		if (this.token == null) {
			throw new NotConfiguredException(
					"GITHUB_TOKEN environment variable is required. Please set your GitHub personal access token.");
		}
		return this;
	}

	/**
	 * @param properties configuration properties (null to use defaults)
	 * @return this builder
	 */
	public GitHubIntegrationBuilder properties(@Nullable IntegrationProperties properties) {
		if (properties != null) {
			this.properties = properties;
		}
		return this;
	}

	public GitHubIntegrationBuilder objectMapper(@Nullable ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
		return this;
	}

	/**
	 * Set a custom GitHubClient implementation. Useful for testing with mocks or for
	 * adding decorators. The client is used as given, without an extra retry layer.
	 *
	 * <p>
	 * When a custom client is provided, the token is not required.
	 * @param httpClient custom GitHubClient implementation (null to use default)
	 * @return this builder
	 */
	public GitHubIntegrationBuilder httpClient(@Nullable GitHubClient httpClient) {
		this.httpClient = httpClient;
		return this;
	}

	public GitHubIntegrationBuilder auditSink(@Nullable AuditSink auditSink) {
		this.auditSink = auditSink;
		return this;
	}

	public GitHubIntegrationBuilder threatModelStore(@Nullable ThreatModelStore threatModelStore) {
		this.threatModelStore = threatModelStore;
		return this;
	}

	public GitHubIntegrationBuilder repositoryCloner(@Nullable RepositoryCloner repositoryCloner) {
		this.repositoryCloner = repositoryCloner;
		return this;
	}

	public GitHubIntegrationBuilder repositoryAnalyzer(@Nullable RepositoryAnalyzer repositoryAnalyzer) {
		this.repositoryAnalyzer = repositoryAnalyzer;
		return this;
	}

	/**
	 * Clone options used by {@link #buildBatchOrchestrator()}.
	 */
	public GitHubIntegrationBuilder fetchOptions(FetchOptions fetchOptions) {
		this.fetchOptions = fetchOptions;
		return this;
	}

	/**
	 * Add an effect run after every analysis, after the built-in PR comment.
	 */
	public GitHubIntegrationBuilder effect(PostAnalysisEffect effect) {
		this.additionalEffects.add(effect);
		return this;
	}

	/**
	 * Build the API client: {@link GitHubHttpClient} wrapped in a
	 * {@link RetryingGitHubClient}, or the custom client if one was set.
	 * @return configured GitHubClient
	 * @throws NotConfiguredException if neither a token nor a custom client is available
	 */
	public GitHubClient buildGitHubClient() {
		if (httpClient != null) {
			return httpClient;
		}
		String resolvedToken = resolveToken();
		if (resolvedToken == null) {
			throw new NotConfiguredException("GitHub token is required. Call token() or tokenFromEnv() first.");
		}
		GitHubHttpClient transport = new GitHubHttpClient(resolvedToken, properties.getApiBaseUrl(),
				properties.getRequestTimeout());
		return RetryingGitHubClient.builder().wrapping(transport).maxAttempts(properties.getMaxAttempts()).build();
	}

	/**
	 * @return configured RestService
	 * @throws NotConfiguredException if no API access is configured
	 */
	public RestService buildRestService() {
		return new GitHubRestService(buildGitHubClient(), resolveObjectMapper());
	}

	public RepositoryFetcher buildRepositoryFetcher() {
		RepositoryCloner cloner = repositoryCloner != null ? repositoryCloner
				: new ProcessGitCloner(properties.getCloneTimeout());
		RepositoryAnalyzer analyzer = repositoryAnalyzer != null ? repositoryAnalyzer
				: new FileTreeAnalyzer(resolveObjectMapper());
		return new RepositoryFetcher(cloner, analyzer, properties.getCloneTempRoot());
	}

	public BatchOrchestrator buildBatchOrchestrator() {
		return new BatchOrchestrator(buildRepositoryFetcher(), new FixedBatchStrategy<>(), fetchOptions,
				properties.getDefaultBatchConcurrency());
	}

	/**
	 * Build the webhook processor. API access is optional: without it the PR comment
	 * effect reports itself as skipped.
	 * @return configured WebhookEventProcessor
	 */
	public WebhookEventProcessor buildWebhookEventProcessor() {
		List<PostAnalysisEffect> effects = new ArrayList<>();
		effects.add(new PullRequestCommentEffect(buildOptionalRestService(), properties.getPlatformUrl()));
		effects.addAll(additionalEffects);
		ThreatModelStore store = threatModelStore != null ? threatModelStore : new InMemoryThreatModelStore();
		AuditSink sink = auditSink != null ? auditSink
				: new FileSystemAuditSink(properties.getAuditLogPath(), resolveObjectMapper());
		return new WebhookEventProcessor(new WebhookSignatureVerifier(), store, sink, buildRepositoryFetcher(),
				effects, properties.getSystemActorEmail(), properties.getCloneTimeout(), Clock.systemUTC(),
				properties.getWebhookSecret());
	}

	/**
	 * @return issue service; it throws {@link NotConfiguredException} on use when no API
	 * access is configured
	 */
	public ThreatIssueService buildThreatIssueService() {
		return new ThreatIssueService(buildOptionalRestService());
	}

	@Nullable
	private RestService buildOptionalRestService() {
		if (httpClient == null && resolveToken() == null) {
			return null;
		}
		return buildRestService();
	}

	@Nullable
	private String resolveToken() {
		if (token != null && !token.isBlank()) {
			return token;
		}
		return properties.hasToken() ? properties.getToken() : null;
	}

	private ObjectMapper resolveObjectMapper() {
		if (objectMapper == null) {
			objectMapper = ObjectMapperFactory.create();
		}
		return objectMapper;
	}

}
