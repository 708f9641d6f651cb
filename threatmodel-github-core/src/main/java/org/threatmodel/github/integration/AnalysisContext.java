package org.threatmodel.github.integration;

import org.jspecify.annotations.Nullable;

/**
 * Everything a {@link PostAnalysisEffect} may need about a finished analysis.
 *
 * @param eventType GitHub event name
 * @param repository analyzed repository
 * @param branch analyzed branch
 * @param pullRequestNumber PR number for {@code pull_request} events, otherwise null
 * @param threatModel owning threat model
 * @param record persisted analysis record
 * @param analysis the full analysis
 */
public record AnalysisContext(String eventType, RemoteRepositoryRef repository, String branch,
		@Nullable Integer pullRequestNumber, ThreatModelRef threatModel, AnalysisRecord record,
		RepositoryAnalysis analysis) {

}
