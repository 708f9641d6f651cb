package org.threatmodel.github.integration;

/**
 * Raised when an optional integration is used without the credentials it needs.
 */
public class NotConfiguredException extends IntegrationException {

	public NotConfiguredException(String message) {
		super(message);
	}

}
