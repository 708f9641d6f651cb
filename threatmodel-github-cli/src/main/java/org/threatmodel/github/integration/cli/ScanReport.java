package org.threatmodel.github.integration.cli;

import org.threatmodel.github.integration.AnalysisSummary;
import org.threatmodel.github.integration.BatchResult;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * JSON report written by {@link ThreatScanCli}.
 */
public record ScanReport(Instant generatedAt, int concurrency, int total, List<Success> succeeded,
		List<Failure> failed) {

	public static ScanReport from(BatchResult result, int concurrency, Instant generatedAt) {
		List<Success> succeeded = new ArrayList<>();
		result.succeeded().forEach((url, analysis) -> succeeded
			.add(new Success(url, AnalysisSummary.from(analysis), analysis.statistics().totalSize())));
		List<Failure> failed = new ArrayList<>();
		result.failed()
			.forEach((url, error) -> failed.add(new Failure(url, error.getClass().getSimpleName(),
					String.valueOf(error.getMessage()))));
		return new ScanReport(generatedAt, concurrency, result.total(), succeeded, failed);
	}

	public record Success(String repositoryUrl, AnalysisSummary summary, long totalSize) {
	}

	public record Failure(String repositoryUrl, String errorType, String message) {
	}

}
