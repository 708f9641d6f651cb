package org.threatmodel.github.integration;

import org.jspecify.annotations.Nullable;

/**
 * Result of one {@link PostAnalysisEffect}.
 */
public record EffectOutcome(String name, Status status, @Nullable String message) {

	public static EffectOutcome succeeded(String name) {
		return new EffectOutcome(name, Status.SUCCEEDED, null);
	}

	public static EffectOutcome failed(String name, String message) {
		return new EffectOutcome(name, Status.FAILED, message);
	}

	public static EffectOutcome skipped(String name, String message) {
		return new EffectOutcome(name, Status.SKIPPED, message);
	}

	public enum Status {

		SUCCEEDED, FAILED, SKIPPED

	}

}
