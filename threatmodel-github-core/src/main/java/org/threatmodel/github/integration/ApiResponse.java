package org.threatmodel.github.integration;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Successful (2xx) response from the GitHub REST API.
 *
 * @param statusCode HTTP status code
 * @param body response body, empty for 204 responses
 * @param headers response headers
 */
public record ApiResponse(int statusCode, String body, Map<String, List<String>> headers) {

	public Optional<String> header(String name) {
		return headers.entrySet()
			.stream()
			.filter(e -> e.getKey().equalsIgnoreCase(name))
			.flatMap(e -> e.getValue().stream())
			.findFirst();
	}

}
