package com.docinsight.core.model;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Reported result of one diagram type within a job.
 *
 * @param type diagram type
 * @param status final artifact status ({@code VALID} or {@code FAILED})
 * @param sourceFile written source file, or null when not persisted
 * @param imageFile written image file, or null when not rendered or not persisted
 * @param repairAttempts number of provider repair calls made
 * @param failureReason why the artifact failed or was omitted, or null
 */
public record DiagramOutcome(
    DiagramType type,
    ArtifactStatus status,
    Path sourceFile,
    Path imageFile,
    int repairAttempts,
    String failureReason
) {
    /**
     * Compact constructor with validation.
     */
    public DiagramOutcome {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(status, "status must not be null");
    }

    /**
     * Returns whether the diagram is valid and was persisted.
     *
     * @return true for a successful diagram
     */
    public boolean successful() {
        return status == ArtifactStatus.VALID && sourceFile != null;
    }

    /**
     * Returns whether the diagram is valid but has no rendered image.
     *
     * @return true if validated but not rendered
     */
    public boolean validatedButNotRendered() {
        return successful() && imageFile == null;
    }
}
