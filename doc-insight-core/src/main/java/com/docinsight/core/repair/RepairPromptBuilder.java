package com.docinsight.core.repair;

import com.docinsight.core.model.DiagramType;

import java.util.Locale;

/**
 * Builds the prompt asking a provider to fix a diagram the syntax checker rejected.
 */
public class RepairPromptBuilder {

    /**
     * Builds a repair prompt.
     *
     * @param type diagram type
     * @param brokenText text the checker rejected
     * @param diagnostic checker output
     * @return prompt text
     */
    public String build(DiagramType type, String brokenText, String diagnostic) {
        return """
            You are a PlantUML syntax expert. A PlantUML %1$s diagram has a syntax error.

            **ERROR FROM PLANTUML:**
            %2$s

            **BROKEN PLANTUML CONTENT:**
            ```plantuml
            %3$s
            ```

            **YOUR TASK:**
            Fix the syntax error and return ONLY the corrected PlantUML code. No explanations.

            **COMMON FIXES FOR %4$s DIAGRAMS:**
            %5$s

            **CRITICAL RULES:**
            1. Keep the same @startuml and @enduml tags
            2. Keep the !include line for the style sheet unchanged
            3. Do NOT add skinparam - styles come from the include
            4. Return ONLY valid PlantUML code starting with @startuml

            Return the fixed PlantUML code now:"""
            .formatted(type.slug(), diagnostic, brokenText, type.slug().toUpperCase(Locale.ROOT), guidance(type));
    }

    static String guidance(DiagramType type) {
        return switch (type) {
            case SEQUENCE -> """
                - Sequence diagrams do NOT support 'note as X ... end note' floating notes
                - Use 'note over Participant: text' or 'note right of Participant: text' instead
                - Ensure all participants are declared before use
                - Arrow syntax: -> for solid, --> for dashed, ->> for async""";
            case ARCHITECTURE -> """
                - Use proper component/package nesting
                - Notes inside packages use 'note as X ... end note' format
                - Ensure braces { } are balanced""";
            case CLASS -> """
                - Class members use +public, -private, #protected prefixes
                - Relationships: --|> extends, ..|> implements, --> association""";
            case USE_CASES -> """
                - Actors are defined with 'actor Name'
                - Use cases are defined with 'usecase "Name" as UC1' or '(Name)'
                - Relationships: --> for association""";
        };
    }
}
