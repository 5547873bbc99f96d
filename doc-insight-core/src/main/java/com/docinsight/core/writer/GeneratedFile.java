package com.docinsight.core.writer;

import java.nio.file.Path;
import java.util.Objects;

/**
 * A file to be written to the output directory.
 *
 * <p>Either {@code content} (text files) or {@code sourcePath} (files produced elsewhere,
 * such as rendered images) is set, never both.
 *
 * @param relativePath path relative to the output directory (e.g., "diagrams/order-service-class.puml")
 * @param content file content, or null when copied from {@code sourcePath}
 * @param sourcePath file to copy, or null when {@code content} is given
 * @param contentType content type
 */
public record GeneratedFile(
    String relativePath,
    String content,
    Path sourcePath,
    String contentType
) {
    /**
     * Compact constructor with validation.
     */
    public GeneratedFile {
        Objects.requireNonNull(relativePath, "relativePath must not be null");
        if ((content == null) == (sourcePath == null)) {
            throw new IllegalArgumentException("Exactly one of content and sourcePath must be set for " + relativePath);
        }
    }

    public static GeneratedFile text(String relativePath, String content, String contentType) {
        return new GeneratedFile(relativePath, content, null, contentType);
    }

    public static GeneratedFile copyOf(String relativePath, Path sourcePath, String contentType) {
        return new GeneratedFile(relativePath, null, sourcePath, contentType);
    }
}
