package com.docinsight.core.generator;

import com.docinsight.core.model.DiagramType;
import com.docinsight.core.model.EntityInfo;
import com.docinsight.core.model.GenerationRequest;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Builds the prompt that asks a provider for one PlantUML diagram.
 *
 * <p>Entity observations are the preferred context. Without observations the extracted
 * patterns are passed as JSON. When a style include is configured the provider is told to
 * put it on the second line and to leave styling to it.
 */
public class DiagramPromptBuilder {

    private static final Logger log = LoggerFactory.getLogger(DiagramPromptBuilder.class);

    private static final ObjectMapper JSON = new ObjectMapper();

    private final String styleInclude;

    /**
     * Creates a builder.
     *
     * @param styleInclude style sheet to {@code !include}, or null for none
     */
    public DiagramPromptBuilder(String styleInclude) {
        if (styleInclude == null || styleInclude.isBlank()) {
            this.styleInclude = null;
        } else {
            String trimmed = styleInclude.trim();
            this.styleInclude = trimmed.startsWith("!include") ? trimmed : "!include " + trimmed;
        }
    }

    /**
     * Builds the prompt for one diagram type.
     *
     * @param type diagram type
     * @param request generation request
     * @return prompt text
     */
    public String build(DiagramType type, GenerationRequest request) {
        EntityInfo entity = request.entity();
        boolean hasObservations = !entity.observations().isEmpty();

        StringBuilder prompt = new StringBuilder();
        prompt.append("Generate a professional PlantUML ").append(type.slug())
            .append(" diagram based on the following:\n\n");
        prompt.append(hasObservations ? observationContext(entity) : patternContext(request)).append("\n\n");
        prompt.append(requirements());
        prompt.append(specifics(type, request, hasObservations));
        prompt.append("\n\n**Output Format:** Valid PlantUML code only, starting with @startuml and ending with ")
            .append("@enduml. No explanatory text outside the diagram.");
        if (styleInclude != null) {
            prompt.append(" The SECOND LINE must be the !include directive.");
        }
        return prompt.toString();
    }

    private static String observationContext(EntityInfo entity) {
        String observations = IntStream.range(0, entity.observations().size())
            .mapToObj(i -> (i + 1) + ". " + entity.observations().get(i))
            .collect(Collectors.joining("\n"));
        return "**Entity:** " + entity.name() + "\n"
            + "**Type:** " + entity.type() + "\n\n"
            + "**Observations (use these to understand the architecture):**\n"
            + observations;
    }

    private static String patternContext(GenerationRequest request) {
        String data;
        try {
            data = JSON.writerWithDefaultPrettyPrinter().writeValueAsString(request.patterns());
        } catch (JsonProcessingException e) {
            log.debug("Could not serialize patterns for prompt: {}", e.getMessage());
            data = request.patterns().toString();
        }
        return "**Entity:** " + request.entity().name() + "\n\n**Analysis Data:**\n" + data;
    }

    private String requirements() {
        StringBuilder sb = new StringBuilder("**CRITICAL REQUIREMENTS (MUST FOLLOW EXACTLY):**\n");
        int n = 1;
        sb.append(n++).append(". Start with @startuml on the first line\n");
        if (styleInclude != null) {
            sb.append(n++).append(". IMMEDIATELY after @startuml (on the SECOND line), include this EXACT line:\n")
                .append("   ").append(styleInclude).append('\n');
            sb.append(n++).append(". Do NOT define any skinparam settings - the style sheet handles all styling\n");
        }
        sb.append(n++).append(". Use proper PlantUML syntax for the diagram type\n");
        sb.append(n++).append(". Make the diagram visually clear and informative\n");
        sb.append(n++).append(". Include meaningful relationships and annotations\n");
        sb.append(n).append(". End with @enduml on the last line");
        return sb.toString();
    }

    private static String specifics(DiagramType type, GenerationRequest request, boolean hasObservations) {
        return switch (type) {
            case ARCHITECTURE -> hasObservations
                ? """


                **Architecture Diagram Specifics for "%s":**
                - Extract ACTUAL components mentioned in the observations
                - Show these real components as PlantUML components with appropriate stereotypes
                - Use stereotypes like <<storage>> for databases, <<api>> for interfaces, <<core>> for main logic
                - Show relationships between components based on what the observations describe
                - Group related components into meaningful packages
                - Include a brief summary note about the entity's purpose
                - PREFER vertical layout (top-to-bottom) over horizontal to avoid excessive width
                - DO NOT use generic placeholder names - use the actual names from the observations"""
                .formatted(request.entity().name())
                : """


                **Architecture Diagram Specifics:**
                - Show %d identified patterns as components
                - Group related patterns into packages by category
                - Use stereotypes like <<api>>, <<core>>, <<storage>> for different component types
                - Show relationships between related components
                - Include a summary note with key metrics
                - PREFER vertical layout (top-to-bottom) over horizontal to avoid excessive width"""
                .formatted(request.patterns().size());
            case CLASS -> """


                **Class Diagram Specifics:**
                - Create classes representing the main architectural patterns
                - Show inheritance and composition relationships
                - Include key methods and properties where relevant
                - Group related classes into packages
                - Show dependencies and associations between classes

                **VALID class diagram elements ONLY:**
                - class, interface, enum, abstract class - with { ... } member bodies
                - package "Name" { ... } - for grouping
                - <<stereotype>> - for stereotypes like <<service>>
                - Relationships: --|>, ..|>, --*, --o, -->, ..>

                **DO NOT USE these elements (they are for OTHER diagram types):**
                - folder, artifact, node, component, database, cloud, queue, storage, rectangle

                **Syntax rules:**
                - Property/field names must NOT contain spaces (use camelCase)""";
            case SEQUENCE -> """


                **Sequence Diagram Specifics:**
                - Show interaction between key components/actors
                - Use proper participant declarations
                - Show meaningful message exchanges
                - Group related sequences with alt/opt/loop blocks where appropriate
                - Attach notes to participants (note over X: text), never floating notes
                - Keep diagram focused and readable""";
            case USE_CASES -> """


                **Use Case Diagram Specifics:**
                - Define clear actors (users, systems)
                - Show use cases as ovals
                - Show include/extend relationships where appropriate
                - Group related use cases with rectangles/packages
                - Keep actor relationships clear""";
        };
    }
}
