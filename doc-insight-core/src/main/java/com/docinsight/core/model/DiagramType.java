package com.docinsight.core.model;

import java.util.Locale;

/**
 * Diagram types produced for every insight document.
 *
 * <p>Declaration order is the order diagrams appear in the narrative.
 */
public enum DiagramType {
    /** Component view of the entity's building blocks */
    ARCHITECTURE("architecture", "Architecture", false),

    /** Interaction between participants */
    SEQUENCE("sequence", "Sequence", false),

    /** Classes, interfaces and their structural relationships */
    CLASS("class", "Class", true),

    /** Actors and the use cases they take part in */
    USE_CASES("use-cases", "Use Cases", false);

    private final String slug;
    private final String title;
    private final boolean structural;

    DiagramType(String slug, String title, boolean structural) {
        this.slug = slug;
        this.title = title;
        this.structural = structural;
    }

    /**
     * Returns the file name suffix for this type (e.g. "use-cases").
     *
     * @return lowercase slug
     */
    public String slug() {
        return slug;
    }

    /**
     * Returns the human-readable title used in headings.
     *
     * @return title
     */
    public String title() {
        return title;
    }

    /**
     * Returns whether composition and inheritance operators are legal in this type.
     *
     * @return true for structural (class) diagrams
     */
    public boolean structural() {
        return structural;
    }

    /**
     * Resolves a type from its slug or enum name, case-insensitively.
     *
     * @param value slug ("use-cases") or name ("USE_CASES")
     * @return matching diagram type
     * @throws IllegalArgumentException if nothing matches
     */
    public static DiagramType fromValue(String value) {
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        for (DiagramType type : values()) {
            if (type.slug.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown diagram type: " + value);
    }
}
