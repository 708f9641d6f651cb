package org.threatmodel.github.integration;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

/**
 * Spring configuration exposing the integration components as beans.
 *
 * <p>
 * Properties are read from the Spring {@link Environment} using the same variable names
 * as {@link IntegrationProperties#fromEnvironment()}. Hosts may replace the
 * {@link ThreatModelStore} and {@link AuditSink} beans with database-backed ones.
 */
@Configuration
public class GitHubIntegrationConfig {

	@Bean
	public IntegrationProperties integrationProperties(Environment environment) {
		return IntegrationProperties.from(environment::getProperty);
	}

	@Bean
	public ObjectMapper objectMapper() {
		return ObjectMapperFactory.create();
	}

	@Bean
	public ThreatModelStore threatModelStore() {
		return new InMemoryThreatModelStore();
	}

	@Bean
	public AuditSink auditSink(IntegrationProperties properties, ObjectMapper objectMapper) {
		return new FileSystemAuditSink(properties.getAuditLogPath(), objectMapper);
	}

	@Bean
	public GitHubIntegrationBuilder gitHubIntegrationBuilder(IntegrationProperties properties,
			ObjectMapper objectMapper, ThreatModelStore threatModelStore, AuditSink auditSink) {
		return GitHubIntegrationBuilder.create()
			.properties(properties)
			.objectMapper(objectMapper)
			.threatModelStore(threatModelStore)
			.auditSink(auditSink);
	}

	@Bean
	public RepositoryFetcher repositoryFetcher(GitHubIntegrationBuilder builder) {
		return builder.buildRepositoryFetcher();
	}

	@Bean
	public BatchOrchestrator batchOrchestrator(GitHubIntegrationBuilder builder) {
		return builder.buildBatchOrchestrator();
	}

	@Bean
	public WebhookEventProcessor webhookEventProcessor(GitHubIntegrationBuilder builder) {
		return builder.buildWebhookEventProcessor();
	}

	@Bean
	public ThreatIssueService threatIssueService(GitHubIntegrationBuilder builder) {
		return builder.buildThreatIssueService();
	}

}
