package org.threatmodel.github.integration;

/**
 * Owner and repository name extracted from a repository URL.
 *
 * @param owner repository owner (empty when not valid)
 * @param repo repository name (empty when not valid)
 * @param isValid whether both parts were found
 */
public record ParsedRepositoryUrl(String owner, String repo, boolean isValid) {

	private static final ParsedRepositoryUrl INVALID = new ParsedRepositoryUrl("", "", false);

	public static ParsedRepositoryUrl invalid() {
		return INVALID;
	}

	public String fullName() {
		return owner + "/" + repo;
	}

}
