package org.threatmodel.github.integration;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Analyzes many repositories with bounded concurrency.
 *
 * <p>
 * URLs are processed in sequential batches of {@code concurrency}; the fetches within a
 * batch run in parallel and the whole batch completes before the next one starts. Each
 * fetch is recorded on its own, so one failing repository never affects the others.
 */
public class BatchOrchestrator {

	private static final Logger logger = LoggerFactory.getLogger(BatchOrchestrator.class);

	public static final int DEFAULT_CONCURRENCY = 3;

	private final RepositoryFetcher fetcher;

	private final BatchStrategy<String> batchStrategy;

	private final FetchOptions fetchOptions;

	private final int defaultConcurrency;

	public BatchOrchestrator(RepositoryFetcher fetcher) {
		this(fetcher, new FixedBatchStrategy<>(), FetchOptions.defaults(), DEFAULT_CONCURRENCY);
	}

	public BatchOrchestrator(RepositoryFetcher fetcher, BatchStrategy<String> batchStrategy, FetchOptions fetchOptions,
			int defaultConcurrency) {
		if (defaultConcurrency < 1) {
			throw new IllegalArgumentException("concurrency must be at least 1, got " + defaultConcurrency);
		}
		this.fetcher = fetcher;
		this.batchStrategy = batchStrategy;
		this.fetchOptions = fetchOptions;
		this.defaultConcurrency = defaultConcurrency;
	}

	public BatchResult analyzeMany(List<String> repositoryUrls) {
		return analyzeMany(repositoryUrls, defaultConcurrency);
	}

	/**
	 * Fetch and analyze every distinct URL.
	 * @param repositoryUrls URLs to analyze; duplicates are analyzed once
	 * @param concurrency maximum number of fetches in flight
	 * @return successes and failures, together covering every distinct URL
	 * @throws IllegalArgumentException if {@code concurrency < 1}
	 */
	public BatchResult analyzeMany(List<String> repositoryUrls, int concurrency) {
		if (concurrency < 1) {
			throw new IllegalArgumentException("concurrency must be at least 1, got " + concurrency);
		}
		List<String> pending = new ArrayList<>(new LinkedHashSet<>(repositoryUrls));
		if (pending.size() < repositoryUrls.size()) {
			logger.info("Ignoring {} duplicate repository URLs", repositoryUrls.size() - pending.size());
		}
		int totalBatches = (pending.size() + concurrency - 1) / concurrency;
		logger.info("Analyzing {} repositories in {} batches (concurrency {})", pending.size(), totalBatches,
				concurrency);

		Map<String, RepositoryAnalysis> succeeded = new LinkedHashMap<>();
		Map<String, Throwable> failed = new LinkedHashMap<>();
		AtomicInteger processed = new AtomicInteger();

		ExecutorService executor = Executors.newFixedThreadPool(concurrency, namedThreads());
		try {
			int batchIndex = 0;
			while (!pending.isEmpty()) {
				List<String> batch = batchStrategy.createBatch(pending, concurrency);
				batchIndex++;
				Map<String, CompletableFuture<Outcome>> futures = new LinkedHashMap<>();
				for (String url : batch) {
					futures.put(url, CompletableFuture
						.supplyAsync(() -> fetcher.fetchAndAnalyze(url, fetchOptions), executor)
						.handle((analysis, error) -> new Outcome(analysis, unwrap(error))));
				}
				CompletableFuture.allOf(futures.values().toArray(new CompletableFuture[0])).join();

				for (Map.Entry<String, CompletableFuture<Outcome>> entry : futures.entrySet()) {
					Outcome outcome = entry.getValue().join();
					processed.incrementAndGet();
					if (outcome.error() == null) {
						succeeded.put(entry.getKey(), outcome.analysis());
					}
					else {
						logger.warn("Analysis of {} failed: {}", entry.getKey(), outcome.error().getMessage());
						failed.put(entry.getKey(), outcome.error());
					}
				}
				logger.info("Batch {}/{} complete: {} processed, {} succeeded, {} failed", batchIndex, totalBatches,
						processed.get(), succeeded.size(), failed.size());
			}
		}
		finally {
			executor.shutdownNow();
		}
		return new BatchResult(succeeded, failed);
	}

	@Nullable
	private static Throwable unwrap(@Nullable Throwable error) {
		if (error instanceof CompletionException && error.getCause() != null) {
			return error.getCause();
		}
		return error;
	}

	private static ThreadFactory namedThreads() {
		AtomicInteger counter = new AtomicInteger();
		return runnable -> {
			Thread thread = new Thread(runnable, "repo-fetch-" + counter.incrementAndGet());
			thread.setDaemon(true);
			return thread;
		};
	}

	private record Outcome(@Nullable RepositoryAnalysis analysis, @Nullable Throwable error) {
	}

}
