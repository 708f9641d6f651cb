package org.threatmodel.github.integration;

import org.jspecify.annotations.Nullable;

/**
 * Interface for GitHub REST API HTTP operations.
 *
 * <p>
 * Provides abstraction over the transport, enabling testability and decorator
 * implementations such as {@link RetryingGitHubClient}.
 */
public interface GitHubClient {

	/**
	 * Execute a request against the GitHub REST API.
	 * @param method HTTP method (GET, POST, PATCH, ...)
	 * @param path API path (e.g., "/repos/owner/repo") or full URL
	 * @param body JSON request body, or null for none
	 * @return the successful response
	 * @throws TransientApiException on network errors, 408, 429 and 5xx responses
	 * @throws PermanentApiException on any other 4xx response
	 */
	ApiResponse request(String method, String path, @Nullable String body);

	/**
	 * Execute a GET request and return the response body.
	 * @param path API path or full URL
	 * @return response body
	 */
	default String get(String path) {
		return request("GET", path, null).body();
	}

	/**
	 * Execute a POST request with a JSON body and return the response body.
	 * @param path API path or full URL
	 * @param body JSON request body
	 * @return response body
	 */
	default String post(String path, String body) {
		return request("POST", path, body).body();
	}

	/**
	 * Rate limit state observed on the most recent response that carried rate limit
	 * headers.
	 * @return last observed state, {@link RateLimitState#unknown()} if none yet
	 */
	default RateLimitState getRateLimitState() {
		return RateLimitState.unknown();
	}

}
