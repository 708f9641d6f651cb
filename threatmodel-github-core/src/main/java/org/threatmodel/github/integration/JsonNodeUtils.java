package org.threatmodel.github.integration;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Optional;

/**
 * Null-safe navigation over webhook payloads and API responses.
 */
public final class JsonNodeUtils {

	private JsonNodeUtils() {
	}

	/**
	 * Text value at the given path, empty when any segment is missing, null or blank.
	 */
	public static Optional<String> getString(JsonNode node, String... path) {
		JsonNode target = navigate(node, path);
		if (target.isMissingNode() || target.isNull()) {
			return Optional.empty();
		}
		String text = target.asText();
		return text.isBlank() ? Optional.empty() : Optional.of(text);
	}

	/**
	 * Integer value at the given path, empty when missing or not numeric.
	 */
	public static Optional<Integer> getInt(JsonNode node, String... path) {
		JsonNode target = navigate(node, path);
		if (target.isInt() || (target.isTextual() && target.asText().matches("-?\\d+"))) {
			return Optional.of(target.asInt());
		}
		return Optional.empty();
	}

	public static boolean has(JsonNode node, String... path) {
		JsonNode target = navigate(node, path);
		return !target.isMissingNode() && !target.isNull();
	}

	private static JsonNode navigate(JsonNode node, String... path) {
		JsonNode target = node;
		for (String p : path) {
			target = target.path(p);
		}
		return target;
	}

}
