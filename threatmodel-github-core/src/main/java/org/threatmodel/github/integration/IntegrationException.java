package org.threatmodel.github.integration;

/**
 * Root of the unchecked exception hierarchy raised by the GitHub integration.
 */
public class IntegrationException extends RuntimeException {

	public IntegrationException(String message) {
		super(message);
	}

	public IntegrationException(String message, Throwable cause) {
		super(message, cause);
	}

}
