package com.docinsight.core.model;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Explains the outcome of significance gating.
 *
 * @param threshold minimum significance a pattern needs to qualify
 * @param patternsAnalyzed number of patterns inspected
 * @param significantPatterns number of patterns at or above the threshold
 * @param distribution pattern count per significance score, highest score first
 * @param topPatterns up to ten pattern summaries ("[score] name (category)"), highest first
 */
public record SignificanceDiagnostics(
    int threshold,
    int patternsAnalyzed,
    int significantPatterns,
    Map<Integer, Integer> distribution,
    List<String> topPatterns
) {
    /**
     * Compact constructor with validation.
     */
    public SignificanceDiagnostics {
        Objects.requireNonNull(distribution, "distribution must not be null");
        topPatterns = topPatterns == null ? List.of() : List.copyOf(topPatterns);
    }

    /**
     * Returns whether at least one pattern qualified.
     *
     * @return true if generation should proceed
     */
    public boolean qualifies() {
        return significantPatterns > 0;
    }
}
