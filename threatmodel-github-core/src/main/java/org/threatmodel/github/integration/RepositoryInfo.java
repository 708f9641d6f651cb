package org.threatmodel.github.integration;

import org.jspecify.annotations.Nullable;

/**
 * Basic repository information from the GitHub API.
 *
 * @param id the unique repository ID
 * @param name the repository name (without owner)
 * @param fullName the full repository name in "owner/repo" format
 * @param description the repository description (may be null)
 * @param htmlUrl the web URL for the repository
 * @param cloneUrl the HTTPS clone URL
 * @param isPrivate whether the repository is private
 * @param defaultBranch the default branch name
 */
public record RepositoryInfo(long id, String name, String fullName, @Nullable String description, String htmlUrl,
		String cloneUrl, boolean isPrivate, String defaultBranch) {

}
