package org.threatmodel.github.integration;

import org.jspecify.annotations.Nullable;

/**
 * Exception thrown when GitHub API calls fail.
 *
 * <p>
 * Carries the HTTP status and rate limit information when available, enabling smart retry
 * logic in {@link RetryingGitHubClient}. Concrete failures are either
 * {@link TransientApiException} (worth retrying) or {@link PermanentApiException}.
 */
public abstract class GitHubApiException extends IntegrationException {

	private final int statusCode;

	@Nullable
	private final String responseBody;

	private final int rateLimitRemaining;

	private final long resetEpochSeconds;

	protected GitHubApiException(String message, int statusCode, @Nullable String responseBody,
			int rateLimitRemaining, long resetEpochSeconds) {
		super(message);
		this.statusCode = statusCode;
		this.responseBody = responseBody;
		this.rateLimitRemaining = rateLimitRemaining;
		this.resetEpochSeconds = resetEpochSeconds;
	}

	protected GitHubApiException(String message, Throwable cause) {
		super(message, cause);
		this.statusCode = -1;
		this.responseBody = null;
		this.rateLimitRemaining = -1;
		this.resetEpochSeconds = -1;
	}

	/**
	 * HTTP status code, or -1 when the request never produced a response.
	 */
	public int getStatusCode() {
		return statusCode;
	}

	@Nullable
	public String getResponseBody() {
		return responseBody;
	}

	public int getRateLimitRemaining() {
		return rateLimitRemaining;
	}

	/**
	 * Epoch second at which the rate limit window resets, or -1 if unknown.
	 */
	public long getResetEpochSeconds() {
		return resetEpochSeconds;
	}

	/**
	 * Returns true if a retry of the same request may succeed.
	 */
	public abstract boolean isTransient();

}
