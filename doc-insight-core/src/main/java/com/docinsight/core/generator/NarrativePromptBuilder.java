package com.docinsight.core.generator;

import com.docinsight.core.model.EntityInfo;
import com.docinsight.core.model.GenerationRequest;
import com.docinsight.core.model.Pattern;
import com.docinsight.core.model.Relation;

import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Builds the prompt for the narrative's analytical body.
 */
public class NarrativePromptBuilder {

    private static final int MAX_PATTERNS = 10;

    /**
     * Builds the deep-insight prompt.
     *
     * @param request generation request
     * @return prompt text
     */
    public String build(GenerationRequest request) {
        EntityInfo entity = request.entity();
        String observations = IntStream.range(0, entity.observations().size())
            .mapToObj(i -> (i + 1) + ". " + entity.observations().get(i))
            .collect(Collectors.joining("\n"));

        return """
            You are analyzing a knowledge entity called "%s" (type: %s) to generate a deep, insightful technical document.

            **Observations gathered about this entity:**
            %s
            %s%s
            **Your task:**
            Generate a comprehensive technical insight document that goes BEYOND just restating the observations. Instead:

            1. **Synthesize Understanding**: What is this entity really about? What problem does it solve? What is its core purpose?

            2. **Architecture & Design**: What architectural decisions are evident? What patterns are being used? What are the trade-offs?

            3. **Implementation Details**: How is this implemented? What technologies and approaches are used? What are the key components?

            4. **Integration Points**: How does this integrate with other parts of the system? What are the dependencies and interfaces?

            5. **Best Practices & Guidelines**: What are the important rules or conventions for using this correctly?

            **Format your response as markdown sections (## headers) with meaningful prose paragraphs, not just bullet point lists.
            Write in a technical documentation style - clear, precise, and informative.
            DO NOT just repeat the observations - ANALYZE and SYNTHESIZE them into coherent understanding.**"""
            .formatted(entity.name(), entity.type(), observations.isEmpty() ? "(none)" : observations,
                relationsSection(request.relations()), patternsSection(request.patterns()));
    }

    private static String relationsSection(List<Relation> relations) {
        if (relations.isEmpty()) {
            return "";
        }
        return "\n**Related Entities:**\n" + relations.stream()
            .map(r -> "- " + r.from() + " " + r.relationType() + " " + r.to())
            .collect(Collectors.joining("\n")) + "\n";
    }

    private static String patternsSection(List<Pattern> patterns) {
        if (patterns.isEmpty()) {
            return "";
        }
        return "\n**Detected Patterns (significance 1-10):**\n" + patterns.stream()
            .sorted(Comparator.comparingInt(Pattern::significance).reversed())
            .limit(MAX_PATTERNS)
            .map(p -> "- [" + p.significance() + "] " + p.name() + " (" + p.category() + ")")
            .collect(Collectors.joining("\n")) + "\n";
    }
}
