package org.threatmodel.github.integration;

import org.jspecify.annotations.Nullable;

/**
 * Non-retryable API failure: any 4xx response other than 408 and 429.
 */
public class PermanentApiException extends GitHubApiException {

	public PermanentApiException(String message, int statusCode, @Nullable String responseBody) {
		super(message, statusCode, responseBody, -1, -1);
	}

	@Override
	public boolean isTransient() {
		return false;
	}

}
