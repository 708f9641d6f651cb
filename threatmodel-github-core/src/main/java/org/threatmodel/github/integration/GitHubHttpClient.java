package org.threatmodel.github.integration;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

/**
 * HTTP client for the GitHub REST API using the Java 11+ HttpClient.
 *
 * <p>
 * Authenticates with a bearer token, extracts rate limit headers from every response into
 * a {@link RateLimitState} owned by this instance, and classifies failures into
 * {@link TransientApiException} and {@link PermanentApiException}. Retrying is left to
 * {@link RetryingGitHubClient}.
 */
public class GitHubHttpClient implements GitHubClient {

	private static final Logger logger = LoggerFactory.getLogger(GitHubHttpClient.class);

	public static final String GITHUB_API_BASE = "https://api.github.com";

	static final int LOW_REMAINING_THRESHOLD = 10;

	private final HttpClient httpClient;

	private final String baseUrl;

	private final String token;

	private final Duration requestTimeout;

	private final AtomicReference<RateLimitState> rateLimitState = new AtomicReference<>(RateLimitState.unknown());

	public GitHubHttpClient(String token) {
		this(token, GITHUB_API_BASE, Duration.ofSeconds(30));
	}

	public GitHubHttpClient(String token, String baseUrl, Duration requestTimeout) {
		this.token = token;
		this.baseUrl = stripTrailingSlash(baseUrl);
		this.requestTimeout = requestTimeout;
		this.httpClient = HttpClient.newBuilder()
			.connectTimeout(Duration.ofSeconds(30))
			.followRedirects(HttpClient.Redirect.NORMAL)
			.build();
	}

	/**
	 * Resolve the REST API base URL: github.com by default, {@code <host>/api/v3} for a
	 * GitHub Enterprise server.
	 * @param enterpriseUrl enterprise server URL, or null/blank for github.com
	 * @return API base URL without trailing slash
	 */
	public static String apiBaseUrl(@Nullable String enterpriseUrl) {
		if (enterpriseUrl == null || enterpriseUrl.isBlank()) {
			return GITHUB_API_BASE;
		}
		String base = stripTrailingSlash(enterpriseUrl.trim());
		return base.endsWith("/api/v3") ? base : base + "/api/v3";
	}

	public String getBaseUrl() {
		return baseUrl;
	}

	@Override
	public RateLimitState getRateLimitState() {
		return rateLimitState.get();
	}

	@Override
	public ApiResponse request(String method, String path, @Nullable String body) {
		String url = path.startsWith("http") ? path : baseUrl + path;
		logger.debug("{} {}", method, url);
		long start = System.currentTimeMillis();

		HttpRequest.Builder builder = HttpRequest.newBuilder()
			.uri(URI.create(url))
			.timeout(requestTimeout)
			.header("Authorization", "Bearer " + token)
			.header("Accept", "application/vnd.github.v3+json")
			.header("User-Agent", "threatmodel-github-integration");
		if (body != null) {
			builder.header("Content-Type", "application/json")
				.method(method, HttpRequest.BodyPublishers.ofString(body));
		}
		else {
			builder.method(method, HttpRequest.BodyPublishers.noBody());
		}

		try {
			ApiResponse response = executeRequest(builder.build());
			logger.debug("{} {} completed in {}ms ({} bytes)", method, url, System.currentTimeMillis() - start,
					response.body().length());
			return response;
		}
		catch (GitHubApiException e) {
			logger.debug("{} {} failed after {}ms: {}", method, url, System.currentTimeMillis() - start,
					e.getMessage());
			throw e;
		}
	}

	private ApiResponse executeRequest(HttpRequest request) {
		try {
			HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

			int remaining = parseIntHeader(response, "x-ratelimit-remaining", -1);
			long reset = parseLongHeader(response, "x-ratelimit-reset", -1);
			updateRateLimitState(response, remaining, reset);

			int statusCode = response.statusCode();
			String responseBody = response.body() != null ? response.body() : "";
			if (statusCode >= 200 && statusCode < 300) {
				return new ApiResponse(statusCode, responseBody, response.headers().map());
			}
			throw classify(request, statusCode, responseBody, remaining, reset);
		}
		catch (IOException e) {
			logger.warn("HTTP request to {} failed: {}", request.uri(), e.getMessage());
			throw new TransientApiException("HTTP request failed: " + e.getMessage(), e);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new IntegrationException("HTTP request interrupted", e);
		}
	}

	private void updateRateLimitState(HttpResponse<?> response, int remaining, long reset) {
		if (remaining < 0) {
			return;
		}
		int limit = parseIntHeader(response, "x-ratelimit-limit", -1);
		int used = parseIntHeader(response, "x-ratelimit-used", 0);
		RateLimitState state = new RateLimitState(limit, remaining, reset, used);
		rateLimitState.set(state);

		if (remaining < LOW_REMAINING_THRESHOLD) {
			logger.warn("GitHub API rate limit running low: {}/{} remaining, resets at epoch {}", remaining, limit,
					reset);
		}
		else {
			logger.debug("Rate limit: {}/{} remaining, resets at epoch {}", remaining, limit, reset);
		}
	}

	private static GitHubApiException classify(HttpRequest request, int statusCode, String body, int remaining,
			long reset) {
		if (statusCode == 429) {
			return new TransientApiException("Too Many Requests (429). Resets at epoch: " + reset, statusCode, body,
					remaining, reset);
		}
		if (statusCode == 403 && remaining == 0) {
			return new TransientApiException("Rate limit exceeded. Resets at epoch: " + reset, statusCode, body,
					remaining, reset);
		}
		if (statusCode == 408) {
			return new TransientApiException("Request Timeout (408): " + request.uri(), statusCode, body, remaining,
					reset);
		}
		if (statusCode >= 500) {
			return new TransientApiException("GitHub API error: " + statusCode, statusCode, body, remaining, reset);
		}
		return switch (statusCode) {
			case 401 -> new PermanentApiException("Unauthorized: Bad credentials. Check your GITHUB_TOKEN.",
					statusCode, body);
			case 403 -> new PermanentApiException("Forbidden: " + body, statusCode, body);
			case 404 -> new PermanentApiException("Not found: " + request.uri(), statusCode, body);
			case 422 -> new PermanentApiException("Validation failed: " + body, statusCode, body);
			default -> new PermanentApiException("GitHub API error: " + statusCode, statusCode, body);
		};
	}

	private static int parseIntHeader(HttpResponse<?> response, String headerName, int defaultValue) {
		return response.headers().firstValue(headerName).map(v -> {
			try {
				return Integer.parseInt(v.trim());
			}
			catch (NumberFormatException e) {
				return defaultValue;
			}
		}).orElse(defaultValue);
	}

	private static long parseLongHeader(HttpResponse<?> response, String headerName, long defaultValue) {
		return response.headers().firstValue(headerName).map(v -> {
			try {
				return Long.parseLong(v.trim());
			}
			catch (NumberFormatException e) {
				return defaultValue;
			}
		}).orElse(defaultValue);
	}

	private static String stripTrailingSlash(String url) {
		return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
	}

}
