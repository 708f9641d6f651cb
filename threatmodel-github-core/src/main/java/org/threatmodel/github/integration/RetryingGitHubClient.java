package org.threatmodel.github.integration;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;

/**
 * Decorator that adds rate limit handling and bounded retry to a {@link GitHubClient}.
 *
 * <p>
 * Features:
 * <ul>
 * <li>Exponential backoff for transient errors (5xx, 408, network): at most
 * {@code maxAttempts} attempts, waiting 1s, 2s, 4s... between them</li>
 * <li>Reset-aware wait for 429: sleeps until {@code x-ratelimit-reset} (60s when the
 * header is absent) and retries once without consuming the retry budget</li>
 * <li>Pre-emptive wait: when the last observed state shows no remaining quota, sleeps until
 * the window resets before sending</li>
 * <li>Permanent (4xx) errors and any other exception are rethrown immediately</li>
 * </ul>
 *
 * <p>
 * Example usage:
 *
 * <pre>
 * {@code
 * GitHubClient client = RetryingGitHubClient.builder()
 *     .wrapping(new GitHubHttpClient(token))
 *     .maxAttempts(3)
 *     .initialDelay(Duration.ofSeconds(1))
 *     .build();
 * }
 * </pre>
 */
public final class RetryingGitHubClient implements GitHubClient {

	private static final Logger logger = LoggerFactory.getLogger(RetryingGitHubClient.class);

	/**
	 * Longest wait honoured for a rate limit reset (1 hour).
	 */
	static final long MAX_RESET_WAIT_SECONDS = 3600;

	/**
	 * Wait applied to a 429 response that carries no reset header.
	 */
	static final long DEFAULT_RATE_LIMIT_WAIT_SECONDS = 60;

	private final GitHubClient delegate;

	private final int maxAttempts;

	private final long initialDelayMs;

	private final Sleeper sleeper;

	private final Clock clock;

	private RetryingGitHubClient(Builder builder) {
		this.delegate = builder.delegate;
		this.maxAttempts = builder.maxAttempts;
		this.initialDelayMs = builder.initialDelayMs;
		this.sleeper = builder.sleeper;
		this.clock = builder.clock;
	}

	/**
	 * Create a new builder for RetryingGitHubClient.
	 * @return new Builder instance
	 */
	public static Builder builder() {
		return new Builder();
	}

	@Override
	public ApiResponse request(String method, String path, @Nullable String body) {
		return executeWithRetry(() -> delegate.request(method, path, body), method + " " + path);
	}

	@Override
	public RateLimitState getRateLimitState() {
		return delegate.getRateLimitState();
	}

	private ApiResponse executeWithRetry(RequestSupplier supplier, String description) {
		awaitQuotaIfExhausted(description);

		boolean rateLimitRetryUsed = false;
		int attempt = 0;
		long delay = initialDelayMs;

		while (true) {
			try {
				return supplier.get();
			}
			catch (TransientApiException e) {
				if (e.isRateLimited() && !rateLimitRetryUsed) {
					rateLimitRetryUsed = true;
					long waitMs = computeRateLimitWait(e);
					logger.warn("{} rate limited: {}. Waiting {}ms before retrying", description, e.getMessage(),
							waitMs);
					sleep(waitMs);
					continue;
				}
				attempt++;
				if (attempt >= maxAttempts || Thread.currentThread().isInterrupted()) {
					logger.error("{} failed after {} attempts", description, attempt);
					throw e;
				}
				long waitMs = e.isRateLimited() ? computeRateLimitWait(e) : delay;
				logger.warn("{} failed (attempt {}/{}): {}. Waiting {}ms...", description, attempt, maxAttempts,
						e.getMessage(), waitMs);
				sleep(waitMs);
				delay *= 2;
			}
		}
	}

	/**
	 * Wait until the reported reset, never negative, capped at one hour; 60 seconds when
	 * the response did not say when the window resets.
	 */
	long computeRateLimitWait(GitHubApiException e) {
		if (e.getResetEpochSeconds() <= 0) {
			return DEFAULT_RATE_LIMIT_WAIT_SECONDS * 1000;
		}
		long waitSeconds = Math.max(0, e.getResetEpochSeconds() - clock.instant().getEpochSecond());
		if (waitSeconds > MAX_RESET_WAIT_SECONDS) {
			logger.warn("Rate limit reset is {} seconds away (> 1hr), capping wait", waitSeconds);
			waitSeconds = MAX_RESET_WAIT_SECONDS;
		}
		return waitSeconds * 1000;
	}

	private void awaitQuotaIfExhausted(String description) {
		RateLimitState state = delegate.getRateLimitState();
		if (!state.isExhausted() || state.resetAt() <= 0) {
			return;
		}
		long waitSeconds = state.resetAt() - clock.instant().getEpochSecond();
		if (waitSeconds > 0 && waitSeconds <= MAX_RESET_WAIT_SECONDS) {
			logger.info("Rate limit exhausted ({}/{}). Waiting {} seconds before {}", state.remaining(), state.limit(),
					waitSeconds, description);
			sleep(waitSeconds * 1000);
		}
	}

	private void sleep(long ms) {
		if (ms <= 0) {
			return;
		}
		try {
			sleeper.sleep(ms);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new IntegrationException("Retry interrupted", e);
		}
	}

	@FunctionalInterface
	private interface RequestSupplier {

		ApiResponse get();

	}

	/**
	 * Pause strategy used between attempts. Replaceable for tests.
	 */
	@FunctionalInterface
	public interface Sleeper {

		void sleep(long millis) throws InterruptedException;

	}

	/**
	 * Builder for {@link RetryingGitHubClient}.
	 *
	 * <p>
	 * Defaults:
	 * <ul>
	 * <li>maxAttempts: 3</li>
	 * <li>initialDelay: 1 second (doubled after each failed attempt)</li>
	 * </ul>
	 */
	public static class Builder {

		private GitHubClient delegate;

		private int maxAttempts = 3;

		private long initialDelayMs = 1000;

		private Sleeper sleeper = Thread::sleep;

		private Clock clock = Clock.systemUTC();

		private Builder() {
		}

		/**
		 * Set the client to wrap with retry logic.
		 * @param client the GitHubClient to wrap (required)
		 * @return this builder
		 */
		public Builder wrapping(GitHubClient client) {
			this.delegate = client;
			return this;
		}

		/**
		 * Set the total number of attempts for transient failures.
		 * @param maxAttempts attempts including the first one (default: 3)
		 * @return this builder
		 */
		public Builder maxAttempts(int maxAttempts) {
			this.maxAttempts = maxAttempts;
			return this;
		}

		/**
		 * Set the delay before the first retry.
		 * @param delay initial delay (doubles on each retry, default: 1 second)
		 * @return this builder
		 */
		public Builder initialDelay(Duration delay) {
			this.initialDelayMs = delay.toMillis();
			return this;
		}

		/**
		 * Set the delay before the first retry in milliseconds.
		 * @param delayMs initial delay in milliseconds (default: 1000)
		 * @return this builder
		 */
		public Builder initialDelayMs(long delayMs) {
			this.initialDelayMs = delayMs;
			return this;
		}

		public Builder sleeper(Sleeper sleeper) {
			this.sleeper = sleeper;
			return this;
		}

		public Builder clock(Clock clock) {
			this.clock = clock;
			return this;
		}

		/**
		 * Build the RetryingGitHubClient.
		 * @return configured RetryingGitHubClient
		 * @throws IllegalStateException if required parameters are missing or invalid
		 */
		public RetryingGitHubClient build() {
			if (delegate == null) {
				throw new IllegalStateException("A GitHubClient to wrap is required. Call wrapping() first.");
			}
			if (maxAttempts < 1) {
				throw new IllegalStateException("maxAttempts must be at least 1");
			}
			if (initialDelayMs <= 0) {
				throw new IllegalStateException("initialDelay must be positive");
			}
			return new RetryingGitHubClient(this);
		}

	}

}
