package org.threatmodel.github.integration;

import org.jspecify.annotations.Nullable;

/**
 * Retryable API failure: network errors, timeouts, 408, 429 and 5xx responses.
 */
public class TransientApiException extends GitHubApiException {

	public TransientApiException(String message, int statusCode, @Nullable String responseBody,
			int rateLimitRemaining, long resetEpochSeconds) {
		super(message, statusCode, responseBody, rateLimitRemaining, resetEpochSeconds);
	}

	public TransientApiException(String message, int statusCode, @Nullable String responseBody) {
		this(message, statusCode, responseBody, -1, -1);
	}

	public TransientApiException(String message, Throwable cause) {
		super(message, cause);
	}

	/**
	 * Returns true if this failure is a rate limit rejection (429, or 403 with no
	 * remaining quota).
	 */
	public boolean isRateLimited() {
		return getStatusCode() == 429 || (getStatusCode() == 403 && getRateLimitRemaining() == 0);
	}

	@Override
	public boolean isTransient() {
		return true;
	}

}
