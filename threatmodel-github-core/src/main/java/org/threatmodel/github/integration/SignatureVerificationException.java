package org.threatmodel.github.integration;

/**
 * Definitive rejection of an inbound webhook whose signature is missing or does not match.
 * Never retried.
 */
public class SignatureVerificationException extends IntegrationException {

	public SignatureVerificationException(String message) {
		super(message);
	}

}
