package org.threatmodel.github.integration;

/**
 * Lifecycle of a webhook delivery: {@code RECEIVED -> PROCESSING -> PROCESSED | FAILED}.
 */
public enum WebhookStatus {

	RECEIVED, PROCESSING, PROCESSED, FAILED;

	public boolean isTerminal() {
		return this == PROCESSED || this == FAILED;
	}

	public boolean canTransitionTo(WebhookStatus next) {
		return switch (this) {
			case RECEIVED -> next == PROCESSING || next == FAILED;
			case PROCESSING -> next == PROCESSED || next == FAILED;
			case PROCESSED, FAILED -> false;
		};
	}

}
