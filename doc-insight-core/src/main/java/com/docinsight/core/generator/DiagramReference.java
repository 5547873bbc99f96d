package com.docinsight.core.generator;

import com.docinsight.core.model.DiagramType;

import java.util.Objects;

/**
 * A valid diagram the narrative links to.
 *
 * @param type diagram type
 * @param name file base name, e.g. "order-service-sequence"
 * @param rendered true if a PNG image exists for the diagram
 */
public record DiagramReference(DiagramType type, String name, boolean rendered) {

    public DiagramReference {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(name, "name must not be null");
    }

    /**
     * Returns the path the narrative links to, relative to the narrative file.
     *
     * @return "images/&lt;name&gt;.png" when rendered, otherwise "diagrams/&lt;name&gt;.puml"
     */
    public String linkTarget() {
        return rendered ? "images/" + name + ".png" : "diagrams/" + name + ".puml";
    }
}
