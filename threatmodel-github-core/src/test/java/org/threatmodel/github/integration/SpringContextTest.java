package org.threatmodel.github.integration;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.junit.jupiter.SpringJUnitConfig;

import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

/**
 * Spring context tests for {@link GitHubIntegrationConfig}.
 *
 * <p>
 * Uses {@code @SpringJUnitConfig} with a plain configuration class; nothing clones or
 * calls GitHub while the context starts.
 */
@SpringJUnitConfig(GitHubIntegrationConfig.class)
@TestPropertySource(properties = { "GITHUB_TOKEN=test-token-for-context-testing", "GIT_CLONE_TIMEOUT_SECONDS=45",
		"BATCH_CONCURRENCY=4", "CLONE_TEMP_ROOT=target/context-test/clones",
		"AUDIT_LOG_PATH=target/context-test/audit.jsonl", "PLATFORM_URL=https://tm.example.com" })
@DisplayName("GitHub Integration - Spring Context Tests")
class SpringContextTest {

	@Autowired
	private IntegrationProperties properties;

	@Autowired
	private RepositoryFetcher repositoryFetcher;

	@Autowired
	private BatchOrchestrator batchOrchestrator;

	@Autowired
	private WebhookEventProcessor webhookEventProcessor;

	@Autowired
	private ThreatIssueService threatIssueService;

	@Autowired
	private ThreatModelStore threatModelStore;

	@Autowired
	private AuditSink auditSink;

	@Nested
	@DisplayName("Bean Wiring")
	class BeanWiringTest {

		@Test
		@DisplayName("Should wire every service")
		void shouldWireServices() {
			assertThat(repositoryFetcher).isNotNull();
			assertThat(batchOrchestrator).isNotNull();
			assertThat(webhookEventProcessor).isNotNull();
			assertThat(threatIssueService).isNotNull();
		}

		@Test
		@DisplayName("Should default to in-memory store and file audit log")
		void shouldUseDefaultPersistence() {
			assertThat(threatModelStore).isInstanceOf(InMemoryThreatModelStore.class);
			assertThat(auditSink).isInstanceOf(FileSystemAuditSink.class);
			assertThat(((FileSystemAuditSink) auditSink).getAuditFile())
				.isEqualTo(Path.of("target/context-test/audit.jsonl"));
		}

	}

	@Nested
	@DisplayName("Configuration Injection")
	class ConfigurationInjectionTest {

		@Test
		@DisplayName("Should bind properties from the Spring environment")
		void shouldBindProperties() {
			assertThat(properties.getToken()).isEqualTo("test-token-for-context-testing");
			assertThat(properties.getCloneTimeout()).isEqualTo(Duration.ofSeconds(45));
			assertThat(properties.getDefaultBatchConcurrency()).isEqualTo(4);
			assertThat(properties.getPlatformUrl()).isEqualTo("https://tm.example.com");
		}

		@Test
		@DisplayName("Should place clones under the configured root")
		void shouldUseConfiguredCloneRoot() {
			assertThat(repositoryFetcher.getTempRoot()).isEqualTo(Path.of("target/context-test/clones"));
		}

	}

}
