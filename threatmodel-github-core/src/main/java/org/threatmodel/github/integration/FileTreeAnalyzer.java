package org.threatmodel.github.integration;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Walks a working tree once, categorizing files by extension and checksumming each one.
 *
 * <p>
 * {@code .git} and {@code node_modules} directories are not descended into. Symbolic
 * links are not followed.
 */
public class FileTreeAnalyzer implements RepositoryAnalyzer {

	private static final Logger logger = LoggerFactory.getLogger(FileTreeAnalyzer.class);

	static final Set<String> INFRASTRUCTURE_EXTENSIONS = Set.of(".tf", ".tfvars", ".yaml", ".yml", ".json");

	static final Set<String> CODE_EXTENSIONS = Set.of(".py", ".go", ".ts", ".js", ".java", ".rb", ".php", ".cs");

	static final Set<String> CONFIG_EXTENSIONS = Set.of(".env", ".config", ".conf", ".ini", ".toml");

	private static final Set<String> SKIPPED_DIRECTORIES = Set.of(".git", "node_modules");

	static final String NO_EXTENSION = "no-extension";

	private final DependencyManifestReader manifestReader;

	private final Clock clock;

	public FileTreeAnalyzer(ObjectMapper objectMapper) {
		this(new DependencyManifestReader(objectMapper), Clock.systemUTC());
	}

	public FileTreeAnalyzer(DependencyManifestReader manifestReader, Clock clock) {
		this.manifestReader = manifestReader;
		this.clock = clock;
	}

	@Override
	public RepositoryAnalysis analyzeTree(Path root, String repositoryUrl) {
		logger.info("Analyzing repository tree {}", root);
		List<FileEntry> all = walk(root);

		List<FileEntry> infrastructure = new ArrayList<>();
		List<FileEntry> code = new ArrayList<>();
		List<FileEntry> config = new ArrayList<>();
		Map<String, Integer> fileTypes = new TreeMap<>();
		long totalSize = 0;
		for (FileEntry entry : all) {
			String ext = entry.extension();
			if (INFRASTRUCTURE_EXTENSIONS.contains(ext)) {
				infrastructure.add(entry);
			}
			else if (CODE_EXTENSIONS.contains(ext)) {
				code.add(entry);
			}
			else if (CONFIG_EXTENSIONS.contains(ext)) {
				config.add(entry);
			}
			fileTypes.merge(ext.isEmpty() ? NO_EXTENSION : ext, 1, Integer::sum);
			totalSize += entry.size();
		}

		Map<String, List<String>> dependencies = manifestReader.read(root);

		RepositoryAnalysis analysis = new RepositoryAnalysis(repositoryUrl, clock.instant(),
				new RepositoryAnalysis.CategorizedFiles(infrastructure, code, config, all), dependencies,
				new RepositoryAnalysis.Statistics(all.size(), totalSize, fileTypes));
		logger.info("Analyzed {}: {} files ({} infrastructure, {} code, {} config), {} bytes", repositoryUrl,
				all.size(), infrastructure.size(), code.size(), config.size(), totalSize);
		return analysis;
	}

	private List<FileEntry> walk(Path root) {
		List<FileEntry> files = new ArrayList<>();
		try {
			Files.walkFileTree(root, new SimpleFileVisitor<>() {

				@Override
				public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
					if (!dir.equals(root) && SKIPPED_DIRECTORIES.contains(dir.getFileName().toString())) {
						return FileVisitResult.SKIP_SUBTREE;
					}
					return FileVisitResult.CONTINUE;
				}

				@Override
				public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
					if (attrs.isRegularFile()) {
						files.add(toEntry(root, file, attrs));
					}
					return FileVisitResult.CONTINUE;
				}

			});
		}
		catch (IOException e) {
			throw new AnalysisException("Failed to walk repository tree " + root + ": " + e.getMessage(), e);
		}
		files.sort((a, b) -> a.relativePath().compareTo(b.relativePath()));
		return files;
	}

	private static FileEntry toEntry(Path root, Path file, BasicFileAttributes attrs) throws IOException {
		String relativePath = root.relativize(file).toString().replace('\\', '/');
		return new FileEntry(relativePath, extensionOf(file.getFileName().toString()), attrs.size(), sha256(file),
				attrs.lastModifiedTime().toInstant());
	}

	/**
	 * Lower-cased extension including the dot. A dotfile such as {@code .env} is its own
	 * extension.
	 */
	static String extensionOf(String fileName) {
		int dot = fileName.lastIndexOf('.');
		if (dot < 0 || dot == fileName.length() - 1) {
			return "";
		}
		return fileName.substring(dot).toLowerCase(Locale.ROOT);
	}

	static String sha256(Path file) throws IOException {
		MessageDigest digest;
		try {
			digest = MessageDigest.getInstance("SHA-256");
		}
		catch (NoSuchAlgorithmException e) {
			throw new IllegalStateException("SHA-256 not available", e);
		}
		byte[] buffer = new byte[8192];
		try (InputStream in = Files.newInputStream(file)) {
			int read;
			while ((read = in.read(buffer)) != -1) {
				digest.update(buffer, 0, read);
			}
		}
		return HexFormat.of().formatHex(digest.digest());
	}

}
