package org.threatmodel.github.integration;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.*;

@DisplayName("WebhookSignatureVerifier Tests")
class WebhookSignatureVerifierTest {

	private static final String SECRET = "It's a Secret to Everybody";

	private static final byte[] PAYLOAD = "Hello, World!".getBytes(StandardCharsets.UTF_8);

	private final WebhookSignatureVerifier verifier = new WebhookSignatureVerifier();

	@Test
	@DisplayName("Should match the published GitHub example signature")
	void shouldMatchKnownVector() {
		String expected = "sha256=757107ea0eb2509fc211221cce984b8a37570b6d7586c22c46f4379c8b043e17";

		assertThat(WebhookSignatureVerifier.sign(PAYLOAD, SECRET)).isEqualTo(expected);
		assertThat(verifier.verify(PAYLOAD, expected, SECRET)).isTrue();
	}

	@Test
	@DisplayName("Should reject tampered payload")
	void shouldRejectTamperedPayload() {
		String signature = WebhookSignatureVerifier.sign(PAYLOAD, SECRET);

		assertThat(verifier.verify("Hello, World?".getBytes(StandardCharsets.UTF_8), signature, SECRET)).isFalse();
	}

	@ParameterizedTest
	@ValueSource(ints = { 7, 38, 70 })
	@DisplayName("Should reject a signature with one altered hex digit")
	void shouldRejectAlteredSignature(int position) {
		String signature = WebhookSignatureVerifier.sign(PAYLOAD, SECRET);
		char original = signature.charAt(position);
		char replacement = original == '0' ? '1' : '0';
		String altered = signature.substring(0, position) + replacement + signature.substring(position + 1);

		assertThat(altered).hasSameSizeAs(signature).isNotEqualTo(signature);
		assertThat(verifier.verify(PAYLOAD, altered, SECRET)).isFalse();
	}

	@Test
	@DisplayName("Should reject wrong secret")
	void shouldRejectWrongSecret() {
		String signature = WebhookSignatureVerifier.sign(PAYLOAD, SECRET);

		assertThat(verifier.verify(PAYLOAD, signature, "other")).isFalse();
	}

	@ParameterizedTest
	@NullAndEmptySource
	@ValueSource(strings = { "sha1=abc", "757107ea0eb2509fc211221cce984b8a37570b6d7586c22c46f4379c8b043e17",
			"sha256=", "sha256=zz" })
	@DisplayName("Should reject malformed headers")
	void shouldRejectMalformedHeader(String header) {
		assertThat(verifier.verify(PAYLOAD, header, SECRET)).isFalse();
	}

	@ParameterizedTest
	@NullAndEmptySource
	@ValueSource(strings = { "  " })
	@DisplayName("Should reject when secret is not configured")
	void shouldRejectMissingSecret(String secret) {
		assertThat(verifier.verify(PAYLOAD, "sha256=757107ea0eb2509fc211221cce984b8a37570b6d7586c22c46f4379c8b043e17",
				secret))
			.isFalse();
	}

}
