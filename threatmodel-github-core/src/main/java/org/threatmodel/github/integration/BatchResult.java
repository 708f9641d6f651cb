package org.threatmodel.github.integration;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of a multi-repository analysis. Both maps keep input order and never share a
 * key.
 *
 * @param succeeded analyses by repository URL
 * @param failed failure cause by repository URL
 */
public record BatchResult(Map<String, RepositoryAnalysis> succeeded, Map<String, Throwable> failed) {

	public BatchResult {
		succeeded = Collections.unmodifiableMap(new LinkedHashMap<>(succeeded));
		failed = Collections.unmodifiableMap(new LinkedHashMap<>(failed));
	}

	public int total() {
		return succeeded.size() + failed.size();
	}

	public boolean allSucceeded() {
		return failed.isEmpty();
	}

}
