package com.docinsight.core.writer;

import java.nio.file.Path;
import java.util.List;

/**
 * Thrown when the narrative could not be written. Diagram files already written for the
 * job have been removed by the time this is thrown.
 */
public class WriteFailedException extends RuntimeException {

    private final List<Path> rolledBack;

    public WriteFailedException(String message, Throwable cause, List<Path> rolledBack) {
        super(message, cause);
        this.rolledBack = rolledBack == null ? List.of() : List.copyOf(rolledBack);
    }

    /**
     * Returns the files deleted during rollback.
     *
     * @return deleted files
     */
    public List<Path> rolledBack() {
        return rolledBack;
    }
}
