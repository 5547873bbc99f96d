package com.docinsight.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Knowledge entity the insight document is written for.
 *
 * @param name entity name, used as-is for the narrative file name
 * @param type entity type (defaults to "Pattern")
 * @param observations free-text observations about the entity
 */
public record EntityInfo(
    String name,
    String type,
    List<String> observations
) {
    /**
     * Compact constructor with validation.
     */
    public EntityInfo {
        Objects.requireNonNull(name, "name must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        if (type == null || type.isBlank()) {
            type = "Pattern";
        }
        observations = observations == null ? List.of() : List.copyOf(observations);
    }
}
