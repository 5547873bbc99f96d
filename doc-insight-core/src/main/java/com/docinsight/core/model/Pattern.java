package com.docinsight.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A pattern extracted upstream from commit history, sessions or code analysis.
 *
 * <p>Only the significance score is interpreted by the generation pipeline; the other
 * fields are passed through to prompts as context.
 *
 * @param name pattern name
 * @param category pattern category (e.g. "architecture", "workflow")
 * @param significance importance score, conventionally 0-10
 * @param evidence supporting evidence lines
 */
public record Pattern(
    String name,
    String category,
    int significance,
    List<String> evidence
) {
    /**
     * Compact constructor with validation.
     */
    public Pattern {
        Objects.requireNonNull(name, "name must not be null");
        if (category == null) {
            category = "general";
        }
        evidence = evidence == null ? List.of() : List.copyOf(evidence);
    }
}
