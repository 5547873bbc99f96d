package com.docinsight.core.model;

import java.util.Objects;

/**
 * Directed relation between two knowledge entities.
 *
 * @param from source entity name
 * @param to target entity name
 * @param relationType relation label (e.g. "uses", "implements")
 */
public record Relation(
    String from,
    String to,
    String relationType
) {
    /**
     * Compact constructor with validation.
     */
    public Relation {
        Objects.requireNonNull(from, "from must not be null");
        Objects.requireNonNull(to, "to must not be null");
        if (relationType == null) {
            relationType = "related_to";
        }
    }
}
