package org.threatmodel.github.integration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads dependency declarations from manifests at the root of a repository.
 *
 * <p>
 * Recognized manifests: {@code package.json} (npm), {@code requirements.txt} (python),
 * {@code go.mod} (go) and {@code pom.xml} (maven). A manifest that cannot be read or
 * parsed is logged and skipped; it never fails the analysis. Manifests that are symbolic
 * links are ignored so a repository cannot point the reader at files outside its tree.
 */
public class DependencyManifestReader {

	private static final Logger logger = LoggerFactory.getLogger(DependencyManifestReader.class);

	private final ObjectMapper objectMapper;

	public DependencyManifestReader(ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
	}

	/**
	 * @param root repository root
	 * @return dependencies keyed by ecosystem, only ecosystems whose manifest was present
	 */
	public Map<String, List<String>> read(Path root) {
		Map<String, List<String>> dependencies = new LinkedHashMap<>();
		readManifest(root.resolve("package.json"), "npm", this::readPackageJson, dependencies);
		readManifest(root.resolve("requirements.txt"), "python", DependencyManifestReader::readRequirements,
				dependencies);
		readManifest(root.resolve("go.mod"), "go", DependencyManifestReader::readGoMod, dependencies);
		readManifest(root.resolve("pom.xml"), "maven", DependencyManifestReader::readPom, dependencies);
		return dependencies;
	}

	private void readManifest(Path manifest, String ecosystem, ManifestParser parser,
			Map<String, List<String>> dependencies) {
		if (!Files.isRegularFile(manifest, LinkOption.NOFOLLOW_LINKS)) {
			if (Files.isSymbolicLink(manifest)) {
				logger.warn("Ignoring {} manifest {}: symbolic links are not followed", ecosystem,
						manifest.getFileName());
			}
			return;
		}
		try {
			dependencies.put(ecosystem, parser.parse(manifest));
		}
		catch (Exception e) {
			logger.warn("Skipping unreadable {} manifest {}: {}", ecosystem, manifest.getFileName(), e.getMessage());
		}
	}

	List<String> readPackageJson(Path manifest) throws Exception {
		JsonNode root = objectMapper.readTree(manifest.toFile());
		List<String> result = new ArrayList<>();
		for (String section : List.of("dependencies", "devDependencies")) {
			Iterator<Map.Entry<String, JsonNode>> fields = root.path(section).fields();
			while (fields.hasNext()) {
				Map.Entry<String, JsonNode> field = fields.next();
				result.add(field.getKey() + "@" + field.getValue().asText());
			}
		}
		return result;
	}

	static List<String> readRequirements(Path manifest) throws Exception {
		List<String> result = new ArrayList<>();
		for (String line : Files.readAllLines(manifest, StandardCharsets.UTF_8)) {
			String trimmed = line.trim();
			if (!trimmed.isEmpty() && !trimmed.startsWith("#")) {
				result.add(trimmed);
			}
		}
		return result;
	}

	static List<String> readGoMod(Path manifest) throws Exception {
		List<String> result = new ArrayList<>();
		boolean inBlock = false;
		for (String line : Files.readAllLines(manifest, StandardCharsets.UTF_8)) {
			String trimmed = line.trim();
			if (inBlock) {
				if (trimmed.startsWith(")")) {
					inBlock = false;
				}
				else if (!trimmed.isEmpty() && !trimmed.startsWith("//")) {
					result.add(trimmed);
				}
			}
			else if (trimmed.startsWith("require (")) {
				inBlock = true;
			}
			else if (trimmed.startsWith("require ")) {
				result.add(trimmed.substring("require ".length()).trim());
			}
		}
		return result;
	}

	static List<String> readPom(Path manifest) throws Exception {
		DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
		factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
		factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
		factory.setExpandEntityReferences(false);
		DocumentBuilder builder = factory.newDocumentBuilder();
		Document document = builder.parse(manifest.toFile());

		List<String> result = new ArrayList<>();
		NodeList nodes = document.getElementsByTagName("dependency");
		for (int i = 0; i < nodes.getLength(); i++) {
			Element dependency = (Element) nodes.item(i);
			String groupId = childText(dependency, "groupId");
			String artifactId = childText(dependency, "artifactId");
			if (groupId.isEmpty() || artifactId.isEmpty()) {
				continue;
			}
			String version = childText(dependency, "version");
			result.add(version.isEmpty() ? groupId + ":" + artifactId : groupId + ":" + artifactId + ":" + version);
		}
		return result;
	}

	private static String childText(Element parent, String name) {
		NodeList children = parent.getChildNodes();
		for (int i = 0; i < children.getLength(); i++) {
			Node child = children.item(i);
			if (child.getNodeType() == Node.ELEMENT_NODE && name.equals(child.getNodeName())) {
				return child.getTextContent().trim();
			}
		}
		return "";
	}

	@FunctionalInterface
	private interface ManifestParser {

		List<String> parse(Path manifest) throws Exception;

	}

}
