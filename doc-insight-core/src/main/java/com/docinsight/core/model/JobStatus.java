package com.docinsight.core.model;

/**
 * Lifecycle of a generation job.
 */
public enum JobStatus {
    IDLE,
    CONTENT_DRAFT,
    DIAGRAMS_IN_FLIGHT,
    CONTENT_FINAL,
    WRITTEN,
    ROLLED_BACK,
    SKIPPED,
    /** Narrative draft failed; nothing was started or written */
    FAILED
}
