package org.threatmodel.github.integration;

import org.jspecify.annotations.Nullable;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.function.Function;

/**
 * Configuration properties for the GitHub integration.
 *
 * <p>
 * Properties can be set directly via setters, resolved from the environment with
 * {@link #fromEnvironment()}, or passed to {@link GitHubIntegrationBuilder}. Defaults are
 * suitable for github.com.
 *
 * <p>
 * Recognized variables:
 * <ul>
 * <li>{@code GITHUB_TOKEN}: API token; without it outbound API calls are disabled</li>
 * <li>{@code GITHUB_ENTERPRISE_URL}: GitHub Enterprise host, API at
 * {@code <url>/api/v3}</li>
 * <li>{@code GITHUB_WEBHOOK_SECRET}: shared webhook secret</li>
 * <li>{@code GIT_CLONE_TIMEOUT_SECONDS}: clone timeout (default 300)</li>
 * <li>{@code BATCH_CONCURRENCY}: default batch concurrency (default 3)</li>
 * <li>{@code CLONE_TEMP_ROOT}: directory for temporary clones</li>
 * <li>{@code PLATFORM_URL}: platform link rendered in PR comments</li>
 * <li>{@code AUDIT_LOG_PATH}: JSON-lines audit file</li>
 * </ul>
 */
public class IntegrationProperties {

	/**
	 * GitHub API token.
	 */
	@Nullable
	private String token;

	/**
	 * GitHub Enterprise base URL, or null for github.com.
	 */
	@Nullable
	private String enterpriseUrl;

	/**
	 * Shared secret for webhook signatures.
	 */
	@Nullable
	private String webhookSecret;

	/**
	 * Hard timeout for a single clone.
	 */
	private Duration cloneTimeout = ProcessGitCloner.DEFAULT_TIMEOUT;

	/**
	 * Per-request timeout for API calls.
	 */
	private Duration requestTimeout = Duration.ofSeconds(30);

	/**
	 * Total attempts for transient API failures.
	 */
	private int maxAttempts = 3;

	/**
	 * Concurrency used by {@link BatchOrchestrator#analyzeMany(java.util.List)}.
	 */
	private int defaultBatchConcurrency = BatchOrchestrator.DEFAULT_CONCURRENCY;

	/**
	 * Root under which per-fetch clone directories are created.
	 */
	private Path cloneTempRoot = RepositoryFetcher.defaultTempRoot();

	/**
	 * Email of the automation actor owning auto-created threat models.
	 */
	private String systemActorEmail = WebhookEventProcessor.DEFAULT_SYSTEM_ACTOR;

	/**
	 * Platform URL linked from PR comments.
	 */
	private String platformUrl = "http://localhost:3000";

	/**
	 * JSON-lines audit log file.
	 */
	private Path auditLogPath = Paths.get("logs", "webhook-audit.jsonl");

	/**
	 * Resolve properties through {@link EnvironmentSupport}.
	 * @return properties populated from {@code .env} files and the environment
	 */
	public static IntegrationProperties fromEnvironment() {
		return from(EnvironmentSupport::get);
	}

	/**
	 * Resolve properties from an arbitrary lookup; absent or blank values keep their
	 * defaults.
	 * @param lookup variable name to value, returning null when absent
	 * @return populated properties
	 * @throws IllegalArgumentException if a numeric variable is malformed
	 */
	public static IntegrationProperties from(Function<String, @Nullable String> lookup) {
		IntegrationProperties properties = new IntegrationProperties();
		properties.setToken(blankToNull(lookup.apply("GITHUB_TOKEN")));
		properties.setEnterpriseUrl(blankToNull(lookup.apply("GITHUB_ENTERPRISE_URL")));
		properties.setWebhookSecret(blankToNull(lookup.apply("GITHUB_WEBHOOK_SECRET")));

		String cloneTimeout = blankToNull(lookup.apply("GIT_CLONE_TIMEOUT_SECONDS"));
		if (cloneTimeout != null) {
			properties.setCloneTimeout(Duration.ofSeconds(parsePositive("GIT_CLONE_TIMEOUT_SECONDS", cloneTimeout)));
		}
		String concurrency = blankToNull(lookup.apply("BATCH_CONCURRENCY"));
		if (concurrency != null) {
			properties.setDefaultBatchConcurrency(parsePositive("BATCH_CONCURRENCY", concurrency));
		}
		String tempRoot = blankToNull(lookup.apply("CLONE_TEMP_ROOT"));
		if (tempRoot != null) {
			properties.setCloneTempRoot(Paths.get(tempRoot));
		}
		String platformUrl = blankToNull(lookup.apply("PLATFORM_URL"));
		if (platformUrl != null) {
			properties.setPlatformUrl(platformUrl);
		}
		String auditLog = blankToNull(lookup.apply("AUDIT_LOG_PATH"));
		if (auditLog != null) {
			properties.setAuditLogPath(Paths.get(auditLog));
		}
		return properties;
	}

	@Nullable
	private static String blankToNull(@Nullable String value) {
		return value == null || value.isBlank() ? null : value.trim();
	}

	private static int parsePositive(String name, String value) {
		try {
			int parsed = Integer.parseInt(value);
			if (parsed < 1) {
				throw new IllegalArgumentException(name + " must be positive, got " + value);
			}
			return parsed;
		}
		catch (NumberFormatException e) {
			throw new IllegalArgumentException(name + " must be an integer, got '" + value + "'", e);
		}
	}

	/**
	 * @return the API base URL derived from {@link #getEnterpriseUrl()}
	 */
	public String getApiBaseUrl() {
		return GitHubHttpClient.apiBaseUrl(enterpriseUrl);
	}

	public boolean hasToken() {
		return token != null && !token.isBlank();
	}

	@Nullable
	public String getToken() {
		return token;
	}

	public void setToken(@Nullable String token) {
		this.token = token;
	}

	@Nullable
	public String getEnterpriseUrl() {
		return enterpriseUrl;
	}

	public void setEnterpriseUrl(@Nullable String enterpriseUrl) {
		this.enterpriseUrl = enterpriseUrl;
	}

	@Nullable
	public String getWebhookSecret() {
		return webhookSecret;
	}

	public void setWebhookSecret(@Nullable String webhookSecret) {
		this.webhookSecret = webhookSecret;
	}

	public Duration getCloneTimeout() {
		return cloneTimeout;
	}

	public void setCloneTimeout(Duration cloneTimeout) {
		this.cloneTimeout = cloneTimeout;
	}

	public Duration getRequestTimeout() {
		return requestTimeout;
	}

	public void setRequestTimeout(Duration requestTimeout) {
		this.requestTimeout = requestTimeout;
	}

	public int getMaxAttempts() {
		return maxAttempts;
	}

	public void setMaxAttempts(int maxAttempts) {
		this.maxAttempts = maxAttempts;
	}

	public int getDefaultBatchConcurrency() {
		return defaultBatchConcurrency;
	}

	public void setDefaultBatchConcurrency(int defaultBatchConcurrency) {
		this.defaultBatchConcurrency = defaultBatchConcurrency;
	}

	public Path getCloneTempRoot() {
		return cloneTempRoot;
	}

	public void setCloneTempRoot(Path cloneTempRoot) {
		this.cloneTempRoot = cloneTempRoot;
	}

	public String getSystemActorEmail() {
		return systemActorEmail;
	}

	public void setSystemActorEmail(String systemActorEmail) {
		this.systemActorEmail = systemActorEmail;
	}

	public String getPlatformUrl() {
		return platformUrl;
	}

	public void setPlatformUrl(String platformUrl) {
		this.platformUrl = platformUrl;
	}

	public Path getAuditLogPath() {
		return auditLogPath;
	}

	public void setAuditLogPath(Path auditLogPath) {
		this.auditLogPath = auditLogPath;
	}

}
