package org.threatmodel.github.integration;

/**
 * How a webhook was handled once it reached a terminal state without error.
 */
public enum WebhookDisposition {

	/** The repository was cloned, analyzed and recorded. */
	ANALYZED,

	/** The event type is handled but this delivery did not qualify (branch, PR action). */
	SKIPPED,

	PING,

	/** Event type the engine does not act on. */
	UNHANDLED

}
