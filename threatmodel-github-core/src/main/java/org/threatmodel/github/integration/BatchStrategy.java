package org.threatmodel.github.integration;

import java.util.List;

/**
 * Strategy interface for carving batches out of pending work items.
 *
 * @param <T> item type
 */
public interface BatchStrategy<T> {

	/**
	 * Create a batch from pending items. Items included in the batch are removed from
	 * {@code pendingItems}.
	 * @param pendingItems mutable list of pending items (will be modified)
	 * @param maxBatchSize maximum number of items to include in the batch
	 * @return list of items for the current batch
	 */
	List<T> createBatch(List<T> pendingItems, int maxBatchSize);

}
