package org.threatmodel.github.integration;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Identifies an external repository to clone and analyze.
 *
 * @param owner repository owner
 * @param name repository name
 * @param cloneUrl URL passed to git
 * @param defaultBranch default branch name
 */
public record RemoteRepositoryRef(String owner, String name, String cloneUrl, String defaultBranch) {

	public RemoteRepositoryRef {
		if (owner == null || owner.isBlank() || name == null || name.isBlank()) {
			throw new IllegalArgumentException("Repository owner and name are required");
		}
		if (cloneUrl == null || cloneUrl.isBlank()) {
			cloneUrl = "https://github.com/" + owner + "/" + name + ".git";
		}
		if (defaultBranch == null || defaultBranch.isBlank()) {
			defaultBranch = "main";
		}
	}

	public String fullName() {
		return owner + "/" + name;
	}

	/**
	 * Build a reference from any URL form accepted by {@link RepositoryUrlParser}.
	 * @throws IllegalArgumentException if owner and repo cannot be extracted
	 */
	public static RemoteRepositoryRef fromUrl(String url) {
		ParsedRepositoryUrl parsed = RepositoryUrlParser.parse(url);
		if (!parsed.isValid()) {
			throw new IllegalArgumentException("Invalid repository URL: " + url);
		}
		String cloneUrl = url.contains("://") || url.contains("@") ? url.trim()
				: "https://github.com/" + parsed.fullName() + ".git";
		return new RemoteRepositoryRef(parsed.owner(), parsed.repo(), cloneUrl, "main");
	}

	/**
	 * Build a reference from the {@code repository} object of a webhook payload.
	 * @throws IllegalArgumentException if the payload lacks owner or name
	 */
	public static RemoteRepositoryRef fromWebhookRepository(JsonNode repository) {
		String owner = JsonNodeUtils.getString(repository, "owner", "login")
			.or(() -> JsonNodeUtils.getString(repository, "owner", "name"))
			.orElse("");
		String name = JsonNodeUtils.getString(repository, "name").orElse("");
		if (owner.isEmpty() || name.isEmpty()) {
			String fullName = JsonNodeUtils.getString(repository, "full_name").orElse("");
			ParsedRepositoryUrl parsed = RepositoryUrlParser.parse(fullName);
			if (parsed.isValid()) {
				owner = parsed.owner();
				name = parsed.repo();
			}
		}
		return new RemoteRepositoryRef(owner, name, JsonNodeUtils.getString(repository, "clone_url").orElse(""),
				JsonNodeUtils.getString(repository, "default_branch").orElse("main"));
	}

}
