package org.threatmodel.github.integration;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * File system implementation of {@link AuditSink}.
 *
 * <p>
 * Appends one JSON object per line to a single file. The parent directory is created on
 * first write.
 */
public class FileSystemAuditSink implements AuditSink {

	private static final Logger logger = LoggerFactory.getLogger(FileSystemAuditSink.class);

	private final Path auditFile;

	private final ObjectMapper objectMapper;

	public FileSystemAuditSink(Path auditFile, ObjectMapper objectMapper) {
		this.auditFile = auditFile;
		this.objectMapper = objectMapper;
	}

	public Path getAuditFile() {
		return auditFile;
	}

	@Override
	public synchronized void appendAuditEvent(AuditEvent event) {
		String line;
		try {
			line = objectMapper.writeValueAsString(event) + System.lineSeparator();
		}
		catch (JsonProcessingException e) {
			throw new IntegrationException("Failed to serialize audit event " + event.action(), e);
		}

		try {
			Path parent = auditFile.toAbsolutePath().getParent();
			if (parent != null) {
				Files.createDirectories(parent);
			}
			Files.writeString(auditFile, line, StandardCharsets.UTF_8, StandardOpenOption.CREATE,
					StandardOpenOption.APPEND);
			logger.debug("Audit {} for webhook {}", event.action(), event.webhookId());
		}
		catch (IOException e) {
			throw new IntegrationException("Failed to write audit log " + auditFile, e);
		}
	}

}
