package com.docinsight.core.model;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Terminal outcome of a generation job.
 *
 * <p>This value is the only place a job's final state survives; nothing about the job is
 * persisted besides the written files.
 *
 * @param entityName entity the job was for
 * @param status terminal job status
 * @param failure job-level failure kind, or null
 * @param failureMessage human-readable failure detail, or null
 * @param narrativeFile written narrative file, or null
 * @param diagrams per-type diagram outcomes
 * @param diagnostics significance gating diagnostics
 * @param processingTime wall-clock duration of the job
 */
public record GenerationResult(
    String entityName,
    JobStatus status,
    JobFailure failure,
    String failureMessage,
    Path narrativeFile,
    List<DiagramOutcome> diagrams,
    SignificanceDiagnostics diagnostics,
    Duration processingTime
) {
    /**
     * Compact constructor with validation.
     */
    public GenerationResult {
        Objects.requireNonNull(entityName, "entityName must not be null");
        Objects.requireNonNull(status, "status must not be null");
        Objects.requireNonNull(diagnostics, "diagnostics must not be null");
        diagrams = diagrams == null ? List.of() : List.copyOf(diagrams);
        if (processingTime == null) {
            processingTime = Duration.ZERO;
        }
    }

    public int patternsAnalyzed() {
        return diagnostics.patternsAnalyzed();
    }

    public int significantPatterns() {
        return diagnostics.significantPatterns();
    }

    public int documentsGenerated() {
        return narrativeFile != null && status == JobStatus.WRITTEN ? 1 : 0;
    }

    public int diagramsAttempted() {
        return diagrams.size();
    }

    public int successfulDiagrams() {
        return (int) diagrams.stream().filter(DiagramOutcome::successful).count();
    }

    public int failedDiagrams() {
        return diagramsAttempted() - successfulDiagrams();
    }

    /**
     * Returns whether the job ended without a job-level failure.
     *
     * @return true for written or skipped jobs
     */
    public boolean succeeded() {
        return status == JobStatus.WRITTEN || status == JobStatus.SKIPPED;
    }
}
