package org.threatmodel.github.integration;

import java.util.ArrayList;
import java.util.List;

/**
 * Fixed-size batch strategy: every batch holds {@code maxBatchSize} items except
 * possibly the last.
 *
 * @param <T> item type
 */
public class FixedBatchStrategy<T> implements BatchStrategy<T> {

	@Override
	public List<T> createBatch(List<T> pendingItems, int maxBatchSize) {
		if (maxBatchSize < 1) {
			throw new IllegalArgumentException("maxBatchSize must be at least 1");
		}
		if (pendingItems.isEmpty()) {
			return new ArrayList<>();
		}

		int batchSize = Math.min(maxBatchSize, pendingItems.size());
		List<T> batch = new ArrayList<>(pendingItems.subList(0, batchSize));
		pendingItems.subList(0, batchSize).clear();
		return batch;
	}

}
