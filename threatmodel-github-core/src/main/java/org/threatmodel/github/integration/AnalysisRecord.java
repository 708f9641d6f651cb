package org.threatmodel.github.integration;

import java.time.Instant;
import java.util.UUID;

/**
 * Persisted result of an automated repository analysis.
 *
 * @param id record id
 * @param threatModelId owning threat model
 * @param status {@value #STATUS_COMPLETED} once stored
 * @param analysisType {@value #TYPE_AUTOMATED} for webhook-triggered analyses
 * @param repositoryUrl the URL that was cloned
 * @param branch the analyzed branch
 * @param summary headline numbers
 * @param startedAt creation time
 */
public record AnalysisRecord(UUID id, UUID threatModelId, String status, String analysisType, String repositoryUrl,
		String branch, AnalysisSummary summary, Instant startedAt) {

	public static final String STATUS_COMPLETED = "completed";

	public static final String TYPE_AUTOMATED = "automated";

}
