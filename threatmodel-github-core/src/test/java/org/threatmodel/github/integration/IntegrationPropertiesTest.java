package org.threatmodel.github.integration;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@DisplayName("IntegrationProperties Tests")
class IntegrationPropertiesTest {

	@Nested
	@DisplayName("Defaults")
	class DefaultsTest {

		@Test
		@DisplayName("Should use documented defaults when nothing is set")
		void shouldUseDefaults() {
			IntegrationProperties properties = IntegrationProperties.from(Map.<String, String>of()::get);

			assertThat(properties.hasToken()).isFalse();
			assertThat(properties.getWebhookSecret()).isNull();
			assertThat(properties.getCloneTimeout()).isEqualTo(Duration.ofMinutes(5));
			assertThat(properties.getRequestTimeout()).isEqualTo(Duration.ofSeconds(30));
			assertThat(properties.getMaxAttempts()).isEqualTo(3);
			assertThat(properties.getDefaultBatchConcurrency()).isEqualTo(3);
			assertThat(properties.getPlatformUrl()).isEqualTo("http://localhost:3000");
			assertThat(properties.getSystemActorEmail()).isEqualTo("system@threatmodel.local");
			assertThat(properties.getAuditLogPath()).isEqualTo(Path.of("logs", "webhook-audit.jsonl"));
			assertThat(properties.getApiBaseUrl()).isEqualTo("https://api.github.com");
		}

		@Test
		@DisplayName("Should treat blank values as unset")
		void shouldIgnoreBlankValues() {
			IntegrationProperties properties = IntegrationProperties
				.from(Map.of("GITHUB_TOKEN", "  ", "BATCH_CONCURRENCY", "")::get);

			assertThat(properties.hasToken()).isFalse();
			assertThat(properties.getDefaultBatchConcurrency()).isEqualTo(3);
		}

	}

	@Nested
	@DisplayName("Overrides")
	class OverridesTest {

		@Test
		@DisplayName("Should read every supported variable")
		void shouldReadVariables() {
			Map<String, String> env = Map.of("GITHUB_TOKEN", "ghp_test", "GITHUB_ENTERPRISE_URL",
					"https://ghe.example.com/", "GITHUB_WEBHOOK_SECRET", "s3cret", "GIT_CLONE_TIMEOUT_SECONDS", "120",
					"BATCH_CONCURRENCY", "8", "CLONE_TEMP_ROOT", "/var/tmp/clones", "PLATFORM_URL",
					"https://tm.example.com", "AUDIT_LOG_PATH", "/var/log/tm/audit.jsonl");

			IntegrationProperties properties = IntegrationProperties.from(env::get);

			assertThat(properties.getToken()).isEqualTo("ghp_test");
			assertThat(properties.getApiBaseUrl()).isEqualTo("https://ghe.example.com/api/v3");
			assertThat(properties.getWebhookSecret()).isEqualTo("s3cret");
			assertThat(properties.getCloneTimeout()).isEqualTo(Duration.ofSeconds(120));
			assertThat(properties.getDefaultBatchConcurrency()).isEqualTo(8);
			assertThat(properties.getCloneTempRoot()).isEqualTo(Path.of("/var/tmp/clones"));
			assertThat(properties.getPlatformUrl()).isEqualTo("https://tm.example.com");
			assertThat(properties.getAuditLogPath()).isEqualTo(Path.of("/var/log/tm/audit.jsonl"));
		}

		@ParameterizedTest
		@ValueSource(strings = { "0", "-4", "three", "1.5" })
		@DisplayName("Should reject malformed or non-positive numbers")
		void shouldRejectBadNumbers(String value) {
			assertThatThrownBy(() -> IntegrationProperties.from(Map.of("BATCH_CONCURRENCY", value)::get))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("BATCH_CONCURRENCY");
		}

	}

}
