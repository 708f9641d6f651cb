package org.threatmodel.github.integration;

import java.time.Instant;

/**
 * A regular file found in an analyzed repository.
 *
 * @param relativePath path relative to the repository root, '/' separated
 * @param extension lower-cased extension including the dot, empty if none
 * @param size size in bytes
 * @param checksum SHA-256 of the content, lowercase hex
 * @param modifiedAt last modification time
 */
public record FileEntry(String relativePath, String extension, long size, String checksum, Instant modifiedAt) {

}
