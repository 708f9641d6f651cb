package org.threatmodel.github.integration;

/**
 * Signals a unique-key violation in a {@link ThreatModelStore}. Callers performing
 * insert-or-get treat it as proof that the record already exists.
 */
public class DuplicateRecordException extends IntegrationException {

	private final String key;

	public DuplicateRecordException(String key) {
		super("Record already exists: " + key);
		this.key = key;
	}

	public String getKey() {
		return key;
	}

}
