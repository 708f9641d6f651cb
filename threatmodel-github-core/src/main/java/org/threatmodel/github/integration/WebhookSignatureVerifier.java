package org.threatmodel.github.integration;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.HexFormat;

/**
 * Verifies the {@code X-Hub-Signature-256} header GitHub attaches to webhook deliveries.
 *
 * <p>
 * The expected value is {@code sha256=} followed by the lowercase hex HMAC-SHA256 of the
 * raw request body keyed with the shared secret. Comparison is constant time.
 */
public class WebhookSignatureVerifier {

	private static final Logger logger = LoggerFactory.getLogger(WebhookSignatureVerifier.class);

	static final String PREFIX = "sha256=";

	private static final String ALGORITHM = "HmacSHA256";

	/**
	 * @param rawPayload request body exactly as received
	 * @param signatureHeader value of {@code X-Hub-Signature-256}
	 * @param secret shared webhook secret
	 * @return true only if the signature matches; never throws
	 */
	public boolean verify(byte[] rawPayload, @Nullable String signatureHeader, @Nullable String secret) {
		if (signatureHeader == null || !signatureHeader.startsWith(PREFIX)) {
			logger.warn("Invalid webhook signature format");
			return false;
		}
		if (secret == null || secret.isBlank()) {
			logger.warn("Webhook secret is not configured, rejecting delivery");
			return false;
		}
		try {
			String expected = sign(rawPayload, secret);
			return MessageDigest.isEqual(signatureHeader.getBytes(StandardCharsets.UTF_8),
					expected.getBytes(StandardCharsets.UTF_8));
		}
		catch (Exception e) {
			logger.error("Signature verification failed: {}", e.getMessage());
			return false;
		}
	}

	/**
	 * Compute the header value GitHub would send for {@code rawPayload}.
	 */
	public static String sign(byte[] rawPayload, String secret) {
		try {
			Mac mac = Mac.getInstance(ALGORITHM);
			mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), ALGORITHM));
			return PREFIX + HexFormat.of().formatHex(mac.doFinal(rawPayload));
		}
		catch (java.security.GeneralSecurityException e) {
			throw new IllegalStateException("HmacSHA256 unavailable", e);
		}
	}

}
