package com.docinsight.core.generator;

import com.docinsight.core.model.EntityInfo;
import com.docinsight.core.model.Relation;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Assembles the markdown narrative document.
 *
 * <p>Layout: title, entity type, one-paragraph overview, the provider-written insight body,
 * related entities, a diagrams section and a footer. The diagrams section lists only the
 * references it is given, in diagram type order (architecture, sequence, class, use cases).
 */
public class NarrativeComposer {

    private static final int OVERVIEW_MAX_LENGTH = 200;
    private static final int MAX_RELATIONS_PER_DIRECTION = 10;

    /**
     * Composes the final narrative.
     *
     * @param entity documented entity
     * @param relations relations of the entity
     * @param insight cleaned insight body
     * @param diagrams valid diagrams to reference
     * @return markdown document
     */
    public String compose(EntityInfo entity, List<Relation> relations, String insight, List<DiagramReference> diagrams) {
        StringBuilder doc = new StringBuilder();
        doc.append("# ").append(entity.name()).append("\n\n");
        doc.append("**Type:** ").append(entity.type()).append("\n\n");
        doc.append(overview(entity)).append("\n\n");

        if (insight != null && !insight.isBlank()) {
            doc.append(insight.trim()).append("\n\n");
        }

        appendRelations(doc, entity.name(), relations);
        appendDiagrams(doc, entity.name(), diagrams);

        doc.append("---\n\n");
        doc.append("*Generated from ").append(entity.observations().size()).append(" observations*\n");
        return doc.toString();
    }

    /**
     * Strips markdown code fences a provider may wrap around its answer.
     *
     * @param response raw provider response
     * @return cleaned insight text, possibly empty
     */
    public String cleanInsight(String response) {
        if (response == null) {
            return "";
        }
        String content = response.trim();
        if (content.startsWith("```markdown")) {
            content = content.substring("```markdown".length());
        } else if (content.startsWith("```")) {
            content = content.substring(3);
        }
        if (content.endsWith("```")) {
            content = content.substring(0, content.length() - 3);
        }
        return content.trim();
    }

    /**
     * Picks the most descriptive observation as overview, skipping rule-like ones.
     *
     * @param entity documented entity
     * @return overview paragraph
     */
    String overview(EntityInfo entity) {
        return entity.observations().stream()
            .filter(obs -> {
                String lower = obs.toLowerCase(Locale.ROOT);
                return !lower.startsWith("use ") && !lower.startsWith("never ");
            })
            .max(Comparator.comparingInt(String::length))
            .map(obs -> obs.length() > OVERVIEW_MAX_LENGTH ? obs.substring(0, OVERVIEW_MAX_LENGTH) + "..." : obs)
            .orElse("Technical documentation for " + entity.name() + ".");
    }

    private static void appendRelations(StringBuilder doc, String entityName, List<Relation> relations) {
        List<Relation> outgoing = relations.stream().filter(r -> r.from().equals(entityName)).collect(Collectors.toList());
        List<Relation> incoming = relations.stream().filter(r -> r.to().equals(entityName)).collect(Collectors.toList());
        if (outgoing.isEmpty() && incoming.isEmpty()) {
            return;
        }

        doc.append("## Related Entities\n\n");
        if (!outgoing.isEmpty()) {
            doc.append("### Dependencies\n\n");
            outgoing.stream().limit(MAX_RELATIONS_PER_DIRECTION)
                .forEach(r -> doc.append("- **").append(r.to()).append("** (").append(r.relationType()).append(")\n"));
            doc.append('\n');
        }
        if (!incoming.isEmpty()) {
            doc.append("### Used By\n\n");
            incoming.stream().limit(MAX_RELATIONS_PER_DIRECTION)
                .forEach(r -> doc.append("- **").append(r.from()).append("** (").append(r.relationType()).append(")\n"));
            doc.append('\n');
        }
    }

    private static void appendDiagrams(StringBuilder doc, String entityName, List<DiagramReference> diagrams) {
        if (diagrams.isEmpty()) {
            return;
        }

        doc.append("## Diagrams\n\n");
        diagrams.stream()
            .sorted(Comparator.comparing(DiagramReference::type))
            .forEach(diagram -> {
                String title = diagram.type().title();
                doc.append("### ").append(title).append("\n\n");
                if (diagram.rendered()) {
                    doc.append("![").append(entityName).append(' ').append(title).append("](")
                        .append(diagram.linkTarget()).append(")\n\n");
                } else {
                    doc.append("[").append(entityName).append(' ').append(title).append(" (PlantUML source)](")
                        .append(diagram.linkTarget()).append(")\n\n");
                }
            });
    }
}
