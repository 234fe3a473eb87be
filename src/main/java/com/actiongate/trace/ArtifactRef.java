package com.actiongate.trace;

/**
 * Pointer from a trace event to an artifact file.
 *
 * @param path   path relative to the state directory
 * @param sha256 hex digest of the file bytes
 * @param bytes  file size
 */
public record ArtifactRef(String name, String path, String sha256, long bytes) {
}
