package com.docinsight.core.writer;

import com.docinsight.core.model.DiagramType;

import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;

/**
 * Everything one job writes: the narrative and the files of each valid diagram.
 *
 * @param slug kebab-case entity name the diagram files are named after
 * @param narrative narrative document
 * @param diagrams diagram file bundles
 * @param narrativeFor recomposes the narrative text for the diagram types actually written;
 *                     used when some diagrams had to be omitted
 */
public record GeneratedOutput(
    String slug,
    GeneratedFile narrative,
    List<DiagramFiles> diagrams,
    Function<Set<DiagramType>, String> narrativeFor
) {
    /**
     * Compact constructor with validation.
     */
    public GeneratedOutput {
        Objects.requireNonNull(slug, "slug must not be null");
        Objects.requireNonNull(narrative, "narrative must not be null");
        if (narrative.content() == null) {
            throw new IllegalArgumentException("narrative must be a text file");
        }
        diagrams = diagrams == null ? List.of() : List.copyOf(diagrams);
        if (narrativeFor == null) {
            String fixed = narrative.content();
            narrativeFor = written -> fixed;
        }
    }

    /**
     * Creates output whose narrative does not depend on which diagrams get written.
     *
     * @param slug kebab-case entity name
     * @param narrative narrative document
     * @param diagrams diagram file bundles
     */
    public GeneratedOutput(String slug, GeneratedFile narrative, List<DiagramFiles> diagrams) {
        this(slug, narrative, diagrams, null);
    }

    /**
     * Source and optional image of one diagram.
     *
     * @param type diagram type
     * @param source diagram source file
     * @param image rendered image, or null
     */
    public record DiagramFiles(DiagramType type, GeneratedFile source, GeneratedFile image) {
        public DiagramFiles {
            Objects.requireNonNull(type, "type must not be null");
            Objects.requireNonNull(source, "source must not be null");
        }
    }
}
