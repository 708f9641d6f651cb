package org.threatmodel.github.integration;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.time.Instant;

import static org.assertj.core.api.Assertions.*;

@DisplayName("WebhookEvent Lifecycle Tests")
class WebhookEventTest {

	private static WebhookEvent newEvent() {
		return WebhookEvent.received("push", JsonNodeFactory.instance.objectNode(), null, "d-1",
				Instant.parse("2024-05-01T12:00:00Z"));
	}

	@Test
	@DisplayName("Should start as received")
	void shouldStartReceived() {
		WebhookEvent event = newEvent();

		assertThat(event.getStatus()).isEqualTo(WebhookStatus.RECEIVED);
		assertThat(event.getId()).isNotNull();
		assertThat(event.getNote()).isNull();
	}

	@Test
	@DisplayName("Should move through processing to processed")
	void shouldCompleteSuccessfully() {
		WebhookEvent event = newEvent();

		event.markProcessing();
		event.markProcessed("analyzed octo/app@main");

		assertThat(event.getStatus()).isEqualTo(WebhookStatus.PROCESSED);
		assertThat(event.getNote()).isEqualTo("analyzed octo/app@main");
		assertThat(event.getError()).isNull();
	}

	@Test
	@DisplayName("Should record the error when failed")
	void shouldRecordFailure() {
		WebhookEvent event = newEvent();

		event.markProcessing();
		event.markFailed("Clone failed with code 128");

		assertThat(event.getStatus()).isEqualTo(WebhookStatus.FAILED);
		assertThat(event.getError()).isEqualTo("Clone failed with code 128");
	}

	@Test
	@DisplayName("Should not leave a terminal state")
	void shouldRejectTransitionFromTerminal() {
		WebhookEvent event = newEvent();
		event.markProcessing();
		event.markProcessed("done");

		assertThatThrownBy(() -> event.markFailed("late")).isInstanceOf(IllegalStateException.class);
		assertThatThrownBy(event::markProcessing).isInstanceOf(IllegalStateException.class);
	}

	@Test
	@DisplayName("Should not skip processing on the way to processed")
	void shouldRejectSkippingProcessing() {
		assertThatThrownBy(() -> newEvent().markProcessed("x")).isInstanceOf(IllegalStateException.class);
	}

	@ParameterizedTest
	@EnumSource(value = WebhookStatus.class, names = { "PROCESSED", "FAILED" })
	@DisplayName("Terminal states allow no transitions")
	void terminalStatesAreFinal(WebhookStatus status) {
		assertThat(status.isTerminal()).isTrue();
		for (WebhookStatus next : WebhookStatus.values()) {
			assertThat(status.canTransitionTo(next)).isFalse();
		}
	}

}
