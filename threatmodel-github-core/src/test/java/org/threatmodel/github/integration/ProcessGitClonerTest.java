package org.threatmodel.github.integration;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("ProcessGitCloner Tests")
class ProcessGitClonerTest {

	@TempDir
	Path tempDir;

	@Nested
	@DisplayName("Command Line")
	class CommandLineTest {

		private final ProcessGitCloner cloner = new ProcessGitCloner();

		@Test
		@DisplayName("Should build shallow single-branch clone")
		void shouldBuildDefaultCommand() {
			Path target = Path.of("/tmp/repo-1");

			List<String> command = cloner.buildCommand("https://github.com/octo/app.git", target,
					FetchOptions.defaults());

			assertThat(command).containsExactly("git", "clone", "--depth", "1", "--single-branch",
					"https://github.com/octo/app.git", target.toString());
		}

		@Test
		@DisplayName("Should include branch and depth when given")
		void shouldIncludeBranch() {
			Path target = Path.of("/tmp/repo-2");

			List<String> command = cloner.buildCommand("octo/app", target, new FetchOptions("develop", 5, false, null));

			assertThat(command).containsExactly("git", "clone", "--depth", "5", "--branch", "develop", "octo/app",
					target.toString());
		}

		@Test
		@DisplayName("Should reject empty command")
		void shouldRejectEmptyCommand() {
			assertThatThrownBy(() -> new ProcessGitCloner(List.of(), Duration.ofSeconds(1)))
				.isInstanceOf(IllegalArgumentException.class);
		}

	}

	@Nested
	@EnabledOnOs({ OS.LINUX, OS.MAC })
	@DisplayName("Process Execution")
	class ExecutionTest {

		@Test
		@DisplayName("Should succeed when the process exits with 0")
		void shouldSucceed() {
			ProcessGitCloner cloner = new ProcessGitCloner(
					List.of("sh", "-c", "for last; do :; done; mkdir -p \"$last\"; echo x > \"$last/main.tf\"", "sh"),
					Duration.ofSeconds(30));
			Path target = tempDir.resolve("repo");

			cloner.cloneRepository("octo/app", target, FetchOptions.defaults());

			assertThat(target.resolve("main.tf")).exists();
		}

		@Test
		@DisplayName("Should report exit code and output on failure")
		void shouldReportExitCode() {
			ProcessGitCloner cloner = new ProcessGitCloner(List.of("sh", "-c", "echo 'repository not found'; exit 3"),
					Duration.ofSeconds(30));

			assertThatThrownBy(() -> cloner.cloneRepository("octo/missing", tempDir.resolve("repo"),
					FetchOptions.defaults()))
				.isInstanceOf(CloneException.class)
				.hasMessage("Clone failed with code 3: repository not found");
		}

		@Test
		@DisplayName("Should kill the process when the timeout elapses")
		void shouldTimeOut() {
			ProcessGitCloner cloner = new ProcessGitCloner(List.of("sh", "-c", "sleep 5"), Duration.ofMinutes(1));
			FetchOptions options = FetchOptions.defaults().withTimeout(Duration.ofMillis(300));

			long start = System.nanoTime();
			assertThatThrownBy(() -> cloner.cloneRepository("octo/slow", tempDir.resolve("repo"), options))
				.isInstanceOf(CloneException.class)
				.hasMessage("Clone operation timed out after 300ms: octo/slow");
			assertThat(Duration.ofNanos(System.nanoTime() - start)).isLessThan(Duration.ofSeconds(4));
		}

		@Test
		@DisplayName("Should kill processes spawned by the clone on timeout")
		void shouldKillDescendantsOnTimeout() throws Exception {
			Path pidFile = tempDir.resolve("child.pid");
			String script = "sleep 30 & echo $! > \"" + pidFile + "\"; wait";
			ProcessGitCloner cloner = new ProcessGitCloner(List.of("sh", "-c", script), Duration.ofMinutes(1));
			FetchOptions options = FetchOptions.defaults().withTimeout(Duration.ofMillis(500));

			assertThatThrownBy(() -> cloner.cloneRepository("octo/slow", tempDir.resolve("repo"), options))
				.isInstanceOf(CloneException.class);

			long pid = Long.parseLong(Files.readString(pidFile).trim());
			assertThat(exitedWithin(pid, Duration.ofSeconds(5))).isTrue();
		}

		@Test
		@DisplayName("Should fail when the executable cannot be started")
		void shouldFailToStart() {
			ProcessGitCloner cloner = new ProcessGitCloner(List.of("/nonexistent/git-binary"), Duration.ofSeconds(5));

			assertThatThrownBy(() -> cloner.cloneRepository("octo/app", tempDir.resolve("repo"),
					FetchOptions.defaults()))
				.isInstanceOf(CloneException.class)
				.hasMessageStartingWith("Failed to start git");
		}

	}

	private static boolean exitedWithin(long pid, Duration limit) throws InterruptedException {
		long deadline = System.nanoTime() + limit.toNanos();
		while (System.nanoTime() < deadline) {
			if (ProcessHandle.of(pid).map(handle -> !handle.isAlive()).orElse(true)) {
				return true;
			}
			Thread.sleep(50);
		}
		return false;
	}

}
