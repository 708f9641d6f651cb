package org.threatmodel.github.integration;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.*;

@DisplayName("FileTreeAnalyzer Tests")
class FileTreeAnalyzerTest {

	private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

	@TempDir
	Path root;

	private FileTreeAnalyzer analyzer;

	@BeforeEach
	void setUp() {
		analyzer = new FileTreeAnalyzer(new DependencyManifestReader(new ObjectMapper()),
				Clock.fixed(NOW, ZoneOffset.UTC));
	}

	private void write(String relativePath, String content) throws IOException {
		Path file = root.resolve(relativePath);
		Files.createDirectories(file.getParent());
		Files.writeString(file, content, StandardCharsets.UTF_8);
	}

	@Nested
	@DisplayName("Categorization")
	class CategorizationTest {

		@Test
		@DisplayName("Should split files into infrastructure, code and config")
		void shouldCategorize() throws IOException {
			write("infra/main.tf", "resource {}");
			write("deploy.yaml", "kind: Deployment");
			write("src/app.py", "print('hi')");
			write("src/Main.java", "class Main {}");
			write("settings.toml", "a = 1");
			write(".env", "KEY=value");
			write("README", "readme");

			RepositoryAnalysis analysis = analyzer.analyzeTree(root, "https://github.com/octo/app");

			assertThat(analysis.files().infrastructure()).extracting(FileEntry::relativePath)
				.containsExactly("deploy.yaml", "infra/main.tf");
			assertThat(analysis.files().code()).extracting(FileEntry::relativePath)
				.containsExactly("src/Main.java", "src/app.py");
			assertThat(analysis.files().config()).extracting(FileEntry::relativePath)
				.containsExactly(".env", "settings.toml");
			assertThat(analysis.files().all()).hasSize(7);
			assertThat(analysis.analyzedAt()).isEqualTo(NOW);
			assertThat(analysis.repositoryUrl()).isEqualTo("https://github.com/octo/app");
		}

		@Test
		@DisplayName("Should count statistics over all files")
		void shouldComputeStatistics() throws IOException {
			write("a.tf", "12345");
			write("b.tf", "123");
			write("Makefile", "all:");

			RepositoryAnalysis.Statistics statistics = analyzer.analyzeTree(root, "url").statistics();

			assertThat(statistics.totalFiles()).isEqualTo(3);
			assertThat(statistics.totalSize()).isEqualTo(12);
			assertThat(statistics.fileTypes()).containsEntry(".tf", 2)
				.containsEntry(FileTreeAnalyzer.NO_EXTENSION, 1)
				.hasSize(2);
		}

		@Test
		@DisplayName("Should not descend into .git or node_modules")
		void shouldSkipVendorDirectories() throws IOException {
			write(".git/config", "[core]");
			write("node_modules/lib/index.js", "module.exports = {}");
			write("index.js", "require('lib')");

			RepositoryAnalysis analysis = analyzer.analyzeTree(root, "url");

			assertThat(analysis.files().all()).extracting(FileEntry::relativePath).containsExactly("index.js");
		}

		@Test
		@DisplayName("Should handle an empty tree")
		void shouldHandleEmptyTree() {
			RepositoryAnalysis analysis = analyzer.analyzeTree(root, "url");

			assertThat(analysis.files().all()).isEmpty();
			assertThat(analysis.statistics().totalSize()).isZero();
			assertThat(analysis.dependencies()).isEmpty();
		}

		@Test
		@DisplayName("Should fail with AnalysisException for a missing root")
		void shouldFailForMissingRoot() {
			assertThatThrownBy(() -> analyzer.analyzeTree(root.resolve("missing"), "url"))
				.isInstanceOf(AnalysisException.class);
		}

	}

	@Nested
	@DisplayName("File Entries")
	class FileEntryTest {

		@Test
		@DisplayName("Should record size and SHA-256 checksum")
		void shouldChecksum() throws IOException {
			write("hello.txt", "hello");

			FileEntry entry = analyzer.analyzeTree(root, "url").files().all().get(0);

			assertThat(entry.size()).isEqualTo(5);
			assertThat(entry.extension()).isEqualTo(".txt");
			assertThat(entry.checksum())
				.isEqualTo("2cf24dba5fb0a30e26e83b2ac5b9e29e1b161e5c1fa7425e73043362938b9824");
			assertThat(entry.modifiedAt()).isNotNull();
		}

		@ParameterizedTest
		@CsvSource({ "main.tf, .tf", "values.YAML, .yaml", ".env, .env", "archive.tar.gz, .gz", "Makefile, ''",
				"trailing., ''" })
		@DisplayName("Should derive lower-cased extension")
		void shouldDeriveExtension(String fileName, String extension) {
			assertThat(FileTreeAnalyzer.extensionOf(fileName)).isEqualTo(extension);
		}

	}

}
