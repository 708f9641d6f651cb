package org.threatmodel.github.integration;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@DisplayName("DependencyManifestReader Tests")
class DependencyManifestReaderTest {

	@TempDir
	Path root;

	private final DependencyManifestReader reader = new DependencyManifestReader(new ObjectMapper());

	private void write(String name, String content) throws IOException {
		Files.writeString(root.resolve(name), content, StandardCharsets.UTF_8);
	}

	@Test
	@DisplayName("Should read npm dependencies and devDependencies")
	void shouldReadPackageJson() throws IOException {
		write("package.json", """
				{"name": "app",
				 "dependencies": {"express": "^4.18.0"},
				 "devDependencies": {"jest": "29.0.0"}}
				""");

		assertThat(reader.read(root)).containsEntry("npm", List.of("express@^4.18.0", "jest@29.0.0"));
	}

	@Test
	@DisplayName("Should read python requirements skipping comments and blanks")
	void shouldReadRequirements() throws IOException {
		write("requirements.txt", "# web\nflask==2.0.1\n\n  requests>=2.0  \n");

		assertThat(reader.read(root)).containsEntry("python", List.of("flask==2.0.1", "requests>=2.0"));
	}

	@Test
	@DisplayName("Should read go require lines and blocks")
	void shouldReadGoMod() throws IOException {
		write("go.mod", """
				module example.com/app

				go 1.21

				require github.com/pkg/errors v0.9.1

				require (
					golang.org/x/net v0.17.0
					// indirect below
					golang.org/x/text v0.13.0 // indirect
				)
				""");

		assertThat(reader.read(root)).containsEntry("go", List.of("github.com/pkg/errors v0.9.1",
				"golang.org/x/net v0.17.0", "golang.org/x/text v0.13.0 // indirect"));
	}

	@Test
	@DisplayName("Should read maven coordinates")
	void shouldReadPom() throws IOException {
		write("pom.xml", """
				<project>
				  <dependencies>
				    <dependency>
				      <groupId>org.slf4j</groupId>
				      <artifactId>slf4j-api</artifactId>
				      <version>2.0.13</version>
				    </dependency>
				    <dependency>
				      <groupId>org.junit.jupiter</groupId>
				      <artifactId>junit-jupiter</artifactId>
				    </dependency>
				  </dependencies>
				</project>
				""");

		assertThat(reader.read(root)).containsEntry("maven",
				List.of("org.slf4j:slf4j-api:2.0.13", "org.junit.jupiter:junit-jupiter"));
	}

	@Test
	@DisplayName("Should skip a malformed manifest without failing")
	void shouldSkipMalformedManifest() throws IOException {
		write("package.json", "{not json");
		write("requirements.txt", "flask");

		Map<String, List<String>> dependencies = reader.read(root);

		assertThat(dependencies).doesNotContainKey("npm").containsEntry("python", List.of("flask"));
	}

	@Test
	@DisplayName("Should refuse pom with a DOCTYPE declaration")
	void shouldRejectDoctype() throws IOException {
		write("pom.xml", """
				<?xml version="1.0"?>
				<!DOCTYPE project [<!ENTITY x SYSTEM "file:///etc/passwd">]>
				<project><dependencies><dependency><groupId>&x;</groupId><artifactId>a</artifactId></dependency></dependencies></project>
				""");

		assertThat(reader.read(root)).doesNotContainKey("maven");
	}

	@Test
	@DisabledOnOs(OS.WINDOWS)
	@DisplayName("Should not follow manifests that link outside the repository")
	void shouldIgnoreSymlinkedManifests(@TempDir Path outside) throws IOException {
		Path secret = Files.writeString(outside.resolve("environ"), "GITHUB_TOKEN=ghp_hostsecret\n");
		Files.createSymbolicLink(root.resolve("requirements.txt"), secret);
		Files.createSymbolicLink(root.resolve("package.json"), secret);
		write("go.mod", "module example.com/app\n\nrequire github.com/pkg/errors v0.9.1\n");

		Map<String, List<String>> dependencies = reader.read(root);

		assertThat(dependencies).containsOnlyKeys("go");
		assertThat(dependencies.toString()).doesNotContain("ghp_hostsecret");
	}

	@Test
	@DisplayName("Should report only ecosystems whose manifest exists")
	void shouldOmitMissingManifests() {
		assertThat(reader.read(root)).isEmpty();
	}

}
