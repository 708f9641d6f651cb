package org.threatmodel.github.integration;

import org.jspecify.annotations.Nullable;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts owner and repository name from the URL forms GitHub hands out.
 *
 * <p>
 * Supported inputs:
 * <ul>
 * <li>{@code https://github.com/owner/repo} and {@code https://github.com/owner/repo.git}</li>
 * <li>{@code git@github.com:owner/repo.git}</li>
 * <li>{@code owner/repo}</li>
 * <li>any URL whose last two path segments are owner and repo (GitHub Enterprise)</li>
 * </ul>
 */
public final class RepositoryUrlParser {

	private static final Pattern GITHUB_COM = Pattern.compile("github\\.com[:/]([^/]+)/([^/]+)");

	private RepositoryUrlParser() {
	}

	public static ParsedRepositoryUrl parse(@Nullable String url) {
		if (url == null || url.isBlank()) {
			return ParsedRepositoryUrl.invalid();
		}
		String cleaned = url.trim();
		while (cleaned.endsWith("/")) {
			cleaned = cleaned.substring(0, cleaned.length() - 1);
		}
		if (cleaned.endsWith(".git")) {
			cleaned = cleaned.substring(0, cleaned.length() - 4);
		}

		Matcher matcher = GITHUB_COM.matcher(cleaned);
		if (matcher.find()) {
			return of(matcher.group(1), matcher.group(2));
		}
		if (cleaned.contains("github.com")) {
			return ParsedRepositoryUrl.invalid();
		}

		// scp-like ssh form: git@host:owner/repo
		int at = cleaned.indexOf('@');
		int colon = cleaned.indexOf(':');
		if (at >= 0 && colon > at && !cleaned.contains("://")) {
			cleaned = cleaned.substring(colon + 1);
		}

		String[] segments = cleaned.split("/");
		if (segments.length < 2) {
			return ParsedRepositoryUrl.invalid();
		}
		return of(segments[segments.length - 2], segments[segments.length - 1]);
	}

	private static ParsedRepositoryUrl of(String owner, String repo) {
		String name = repo.endsWith(".git") ? repo.substring(0, repo.length() - 4) : repo;
		if (owner.isEmpty() || name.isEmpty() || owner.endsWith(":")) {
			return ParsedRepositoryUrl.invalid();
		}
		return new ParsedRepositoryUrl(owner, name, true);
	}

}
