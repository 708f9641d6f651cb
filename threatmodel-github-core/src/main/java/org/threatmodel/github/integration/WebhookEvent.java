package org.threatmodel.github.integration;

import com.fasterxml.jackson.databind.JsonNode;
import org.jspecify.annotations.Nullable;

import java.time.Instant;
import java.util.UUID;

/**
 * A single webhook delivery as it moves through processing.
 *
 * <p>
 * Status only moves forward; once {@link WebhookStatus#isTerminal() terminal} any further
 * transition throws {@link IllegalStateException}. Redeliveries with the same
 * {@code deliveryId} are separate events.
 */
public final class WebhookEvent {

	private final UUID id;

	private final String eventType;

	private final JsonNode payload;

	@Nullable
	private final String signature;

	private final String deliveryId;

	private final Instant receivedAt;

	private WebhookStatus status = WebhookStatus.RECEIVED;

	@Nullable
	private String note;

	@Nullable
	private String error;

	public WebhookEvent(UUID id, String eventType, JsonNode payload, @Nullable String signature, String deliveryId,
			Instant receivedAt) {
		this.id = id;
		this.eventType = eventType;
		this.payload = payload;
		this.signature = signature;
		this.deliveryId = deliveryId;
		this.receivedAt = receivedAt;
	}

	public static WebhookEvent received(String eventType, JsonNode payload, @Nullable String signature,
			String deliveryId, Instant receivedAt) {
		return new WebhookEvent(UUID.randomUUID(), eventType, payload, signature, deliveryId, receivedAt);
	}

	public synchronized void markProcessing() {
		transition(WebhookStatus.PROCESSING);
	}

	public synchronized void markProcessed(String note) {
		transition(WebhookStatus.PROCESSED);
		this.note = note;
	}

	public synchronized void markFailed(String error) {
		transition(WebhookStatus.FAILED);
		this.error = error;
	}

	private void transition(WebhookStatus next) {
		if (!status.canTransitionTo(next)) {
			throw new IllegalStateException("Webhook " + id + " cannot move from " + status + " to " + next);
		}
		status = next;
	}

	public UUID getId() {
		return id;
	}

	public String getEventType() {
		return eventType;
	}

	public JsonNode getPayload() {
		return payload;
	}

	@Nullable
	public String getSignature() {
		return signature;
	}

	public String getDeliveryId() {
		return deliveryId;
	}

	public Instant getReceivedAt() {
		return receivedAt;
	}

	public synchronized WebhookStatus getStatus() {
		return status;
	}

	@Nullable
	public synchronized String getNote() {
		return note;
	}

	@Nullable
	public synchronized String getError() {
		return error;
	}

	@Override
	public String toString() {
		return "WebhookEvent[id=" + id + ", eventType=" + eventType + ", deliveryId=" + deliveryId + ", status="
				+ getStatus() + "]";
	}

}
