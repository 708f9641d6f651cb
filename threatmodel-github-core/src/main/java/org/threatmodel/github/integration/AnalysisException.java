package org.threatmodel.github.integration;

/**
 * Raised when a cloned working tree cannot be walked or analyzed.
 */
public class AnalysisException extends IntegrationException {

	public AnalysisException(String message) {
		super(message);
	}

	public AnalysisException(String message, Throwable cause) {
		super(message, cause);
	}

}
