package org.threatmodel.github.integration;

import java.nio.file.Path;

/**
 * Clones a remote repository into a local directory.
 */
public interface RepositoryCloner {

	/**
	 * Clone {@code repositoryUrl} into {@code targetDir}.
	 * @param repositoryUrl URL to clone
	 * @param targetDir destination, which must not yet contain a repository
	 * @param options clone options
	 * @throws CloneException if the clone fails or times out
	 */
	void cloneRepository(String repositoryUrl, Path targetDir, FetchOptions options);

}
