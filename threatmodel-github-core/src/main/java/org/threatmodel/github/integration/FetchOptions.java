package org.threatmodel.github.integration;

import org.jspecify.annotations.Nullable;

import java.time.Duration;

/**
 * Options for a shallow clone.
 *
 * @param branch branch to check out, or null for the remote default
 * @param depth history depth (default 1)
 * @param singleBranch whether to fetch only the selected branch (default true)
 * @param timeout clone timeout, or null for the cloner's default
 */
public record FetchOptions(@Nullable String branch, int depth, boolean singleBranch, @Nullable Duration timeout) {

	public static final int DEFAULT_DEPTH = 1;

	public FetchOptions {
		if (depth < 1) {
			throw new IllegalArgumentException("depth must be at least 1, got " + depth);
		}
		if (timeout != null && (timeout.isNegative() || timeout.isZero())) {
			throw new IllegalArgumentException("timeout must be positive");
		}
	}

	public static FetchOptions defaults() {
		return new FetchOptions(null, DEFAULT_DEPTH, true, null);
	}

	public static FetchOptions forBranch(@Nullable String branch) {
		return new FetchOptions(branch, DEFAULT_DEPTH, true, null);
	}

	public FetchOptions withTimeout(@Nullable Duration timeout) {
		return new FetchOptions(branch, depth, singleBranch, timeout);
	}

}
