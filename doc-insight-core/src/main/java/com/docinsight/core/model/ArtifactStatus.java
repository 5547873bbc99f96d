package com.docinsight.core.model;

/**
 * Lifecycle of a diagram artifact inside the repair loop.
 */
public enum ArtifactStatus {
    DRAFT,
    SYNTAX_CHECKED,
    REPAIRING,
    VALID,
    FAILED
}
