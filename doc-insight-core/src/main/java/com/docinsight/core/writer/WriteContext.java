package com.docinsight.core.writer;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Context provided to writers.
 *
 * @param outputDirectory target output directory
 */
public record WriteContext(Path outputDirectory) {

    /**
     * Compact constructor with validation.
     */
    public WriteContext {
        Objects.requireNonNull(outputDirectory, "outputDirectory must not be null");
    }

    public static WriteContext of(Path outputDirectory) {
        return new WriteContext(outputDirectory);
    }
}
