package com.docinsight.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Input of one generation job.
 *
 * @param entity entity to document
 * @param patterns extracted patterns with significance scores
 * @param relations relations of the entity to other entities
 */
public record GenerationRequest(
    EntityInfo entity,
    List<Pattern> patterns,
    List<Relation> relations
) {
    /**
     * Compact constructor with validation.
     */
    public GenerationRequest {
        Objects.requireNonNull(entity, "entity must not be null");
        patterns = patterns == null ? List.of() : List.copyOf(patterns);
        relations = relations == null ? List.of() : List.copyOf(relations);
    }
}
