package org.threatmodel.github.integration.cli;

import org.jspecify.annotations.Nullable;
import org.threatmodel.github.integration.IntegrationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Parsed configuration result from command-line arguments.
 */
public class ParsedConfiguration {

	// Repositories to scan
	public List<String> repositories = new ArrayList<>();

	@Nullable
	public String repositoriesFile = null;

	// Clone settings
	public int concurrency;

	@Nullable
	public String branch = null;

	public int depth = 1;

	@Nullable
	public Integer timeoutSeconds = null; // null = configured default

	// Output
	@Nullable
	public String outputFile = null; // null = stdout

	public boolean verbose = false;

	public boolean helpRequested = false;

	public ParsedConfiguration(IntegrationProperties defaults) {
		this.concurrency = defaults.getDefaultBatchConcurrency();
	}

}
