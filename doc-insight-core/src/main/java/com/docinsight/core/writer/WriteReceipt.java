package com.docinsight.core.writer;

import com.docinsight.core.model.DiagramType;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * What a successful write produced.
 *
 * @param narrativeFile written narrative
 * @param diagrams diagrams written in full
 * @param omitted diagrams that could not be written, with the reason
 */
public record WriteReceipt(
    Path narrativeFile,
    List<WrittenDiagram> diagrams,
    Map<DiagramType, String> omitted
) {
    public WriteReceipt {
        Objects.requireNonNull(narrativeFile, "narrativeFile must not be null");
        diagrams = diagrams == null ? List.of() : List.copyOf(diagrams);
        omitted = omitted == null ? Map.of() : Map.copyOf(omitted);
    }

    public Optional<WrittenDiagram> diagram(DiagramType type) {
        return diagrams.stream().filter(d -> d.type() == type).findFirst();
    }

    /**
     * Files written for one diagram.
     *
     * @param type diagram type
     * @param sourceFile written source
     * @param imageFile written image, or null
     */
    public record WrittenDiagram(DiagramType type, Path sourceFile, Path imageFile) {
        public WrittenDiagram {
            Objects.requireNonNull(type, "type must not be null");
            Objects.requireNonNull(sourceFile, "sourceFile must not be null");
        }
    }
}
