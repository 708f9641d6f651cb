package org.threatmodel.github.integration;

import com.fasterxml.jackson.databind.JsonNode;
import org.jspecify.annotations.Nullable;

import java.time.Instant;
import java.util.UUID;

/**
 * Append-only audit record for a webhook delivery.
 *
 * @param webhookId id of the {@link WebhookEvent}
 * @param action what happened
 * @param resourceType always {@value #RESOURCE_TYPE}
 * @param eventType GitHub event name
 * @param deliveryId GitHub delivery id
 * @param details human readable details or error message
 * @param payload webhook payload, recorded with {@link Action#WEBHOOK_RECEIVED} only
 * @param timestamp when the record was written
 */
public record AuditEvent(UUID webhookId, Action action, String resourceType, String eventType, String deliveryId,
		String details, @Nullable JsonNode payload, Instant timestamp) {

	public static final String RESOURCE_TYPE = "github_webhook";

	public static AuditEvent of(WebhookEvent event, Action action, String details, @Nullable JsonNode payload,
			Instant timestamp) {
		return new AuditEvent(event.getId(), action, RESOURCE_TYPE, event.getEventType(), event.getDeliveryId(),
				details, payload, timestamp);
	}

	public enum Action {

		WEBHOOK_RECEIVED, WEBHOOK_PROCESSING, WEBHOOK_PROCESSED, WEBHOOK_FAILED

	}

}
