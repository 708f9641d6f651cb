package org.threatmodel.github.integration;

/**
 * Raised when a repository cannot be cloned: network or authentication failure, a non-zero
 * git exit code, or the clone timeout elapsing.
 */
public class CloneException extends IntegrationException {

	public CloneException(String message) {
		super(message);
	}

	public CloneException(String message, Throwable cause) {
		super(message, cause);
	}

}
