package org.threatmodel.github.integration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * {@link RepositoryCloner} that runs the {@code git} executable.
 *
 * <p>
 * The process gets a hard timeout; when it expires the process tree is killed and a
 * {@link CloneException} is raised. Credential prompts are disabled so a private
 * repository fails fast instead of hanging on stdin.
 */
public class ProcessGitCloner implements RepositoryCloner {

	private static final Logger logger = LoggerFactory.getLogger(ProcessGitCloner.class);

	public static final Duration DEFAULT_TIMEOUT = Duration.ofMinutes(5);

	private static final Duration KILL_WAIT = Duration.ofSeconds(5);

	private static final Duration OUTPUT_WAIT = Duration.ofSeconds(5);

	private final List<String> command;

	private final Duration defaultTimeout;

	public ProcessGitCloner() {
		this(DEFAULT_TIMEOUT);
	}

	public ProcessGitCloner(Duration defaultTimeout) {
		this(List.of("git"), defaultTimeout);
	}

	/**
	 * @param command executable and leading arguments; clone arguments are appended
	 * @param defaultTimeout timeout when {@link FetchOptions#timeout()} is not set
	 */
	public ProcessGitCloner(List<String> command, Duration defaultTimeout) {
		if (command.isEmpty()) {
			throw new IllegalArgumentException("command must not be empty");
		}
		this.command = List.copyOf(command);
		this.defaultTimeout = defaultTimeout;
	}

	List<String> buildCommand(String repositoryUrl, Path targetDir, FetchOptions options) {
		List<String> args = new ArrayList<>(command);
		args.add("clone");
		args.add("--depth");
		args.add(String.valueOf(options.depth()));
		if (options.branch() != null) {
			args.add("--branch");
			args.add(options.branch());
		}
		if (options.singleBranch()) {
			args.add("--single-branch");
		}
		args.add(repositoryUrl);
		args.add(targetDir.toString());
		return args;
	}

	@Override
	public void cloneRepository(String repositoryUrl, Path targetDir, FetchOptions options) {
		Duration timeout = options.timeout() != null ? options.timeout() : defaultTimeout;
		List<String> args = buildCommand(repositoryUrl, targetDir, options);
		logger.info("Cloning {} into {} (depth {}, branch {})", repositoryUrl, targetDir, options.depth(),
				options.branch() != null ? options.branch() : "default");

		ProcessBuilder builder = new ProcessBuilder(args).redirectErrorStream(true);
		builder.environment().put("GIT_TERMINAL_PROMPT", "0");

		Process process;
		try {
			process = builder.start();
		}
		catch (IOException e) {
			throw new CloneException("Failed to start git: " + e.getMessage(), e);
		}
		ByteArrayOutputStream output = new ByteArrayOutputStream();
		Thread reader = new Thread(() -> {
			try (InputStream in = process.getInputStream()) {
				in.transferTo(output);
			}
			catch (IOException e) {
				logger.debug("Failed to read git output: {}", e.getMessage());
			}
		}, "git-clone-output");
		reader.setDaemon(true);
		reader.start();

		try {
			if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
				terminate(process);
				logger.error("Clone of {} timed out after {}", repositoryUrl, timeout);
				throw new CloneException(
						"Clone operation timed out after " + timeout.toMillis() + "ms: " + repositoryUrl);
			}
			reader.join(OUTPUT_WAIT.toMillis());
		}
		catch (InterruptedException e) {
			terminate(process);
			Thread.currentThread().interrupt();
			throw new CloneException("Clone interrupted: " + repositoryUrl, e);
		}

		int exitCode = process.exitValue();
		if (exitCode != 0) {
			String text = output.toString(StandardCharsets.UTF_8).trim();
			logger.error("git clone of {} exited with {}: {}", repositoryUrl, exitCode, text);
			throw new CloneException("Clone failed with code " + exitCode + ": " + text);
		}
		logger.info("Repository cloned: {}", repositoryUrl);
	}

	/**
	 * Kill the process and every process it spawned, then wait for all of them to exit.
	 * Descendants are captured before the kill; once the parent dies they are reparented
	 * and no longer reachable from it.
	 */
	static void terminate(Process process) {
		List<ProcessHandle> tree = new ArrayList<>();
		process.descendants().forEach(tree::add);
		tree.forEach(ProcessHandle::destroyForcibly);
		process.destroyForcibly();
		tree.add(process.toHandle());
		long deadline = System.nanoTime() + KILL_WAIT.toNanos();
		for (ProcessHandle handle : tree) {
			long remaining = deadline - System.nanoTime();
			try {
				handle.onExit().get(Math.max(remaining, 0), TimeUnit.NANOSECONDS);
			}
			catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				return;
			}
			catch (ExecutionException | TimeoutException e) {
				logger.warn("Process {} did not exit after kill: {}", handle.pid(), e.toString());
			}
		}
	}

}
