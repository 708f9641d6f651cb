package org.threatmodel.github.integration;

import java.time.Instant;

/**
 * Rate limit status reported by the GitHub API in {@code x-ratelimit-*} response headers.
 *
 * <p>
 * Instances are immutable; a client replaces its current state wholesale after each
 * response. The state is advisory: concurrent callers may act on a stale value and rely on
 * 429 handling as the backstop.
 *
 * @param limit the maximum number of requests allowed in the window, or -1 if unknown
 * @param remaining the number of requests remaining in the window, or -1 if unknown
 * @param resetAt the time when the window resets (epoch seconds), or -1 if unknown
 * @param used the number of requests used in the window
 */
public record RateLimitState(int limit, int remaining, long resetAt, int used) {

	private static final RateLimitState UNKNOWN = new RateLimitState(-1, -1, -1, 0);

	/**
	 * State of a client that has not seen any rate limit headers yet.
	 */
	public static RateLimitState unknown() {
		return UNKNOWN;
	}

	public boolean isKnown() {
		return remaining >= 0;
	}

	public Instant getResetTime() {
		return Instant.ofEpochSecond(resetAt);
	}

	/**
	 * Returns true if the window is known to be used up.
	 */
	public boolean isExhausted() {
		return isKnown() && remaining == 0;
	}

}
