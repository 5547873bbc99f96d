package com.docinsight.core.validator;

import com.docinsight.core.model.DiagramType;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Grammar context a diagram is validated in.
 *
 * <p>Some fixes are only correct for one family of PlantUML diagrams: relationship
 * decorations such as composition are legal only in structural (class) diagrams, and
 * floating notes must be attached to a participant in interaction (sequence) diagrams.
 * When the diagram type is known it decides; otherwise the context is inferred from the text.
 *
 * @param structural true if class-diagram relationship operators are legal
 * @param interaction true if the diagram is a sequence diagram
 */
public record DiagramSyntax(boolean structural, boolean interaction) {

    private static final Pattern CLASS_DECLARATION = Pattern.compile(
        "(?m)^\\s*(abstract\\s+class|class|interface|enum)\\s+\\S");
    private static final Pattern NON_CLASS_DECLARATION = Pattern.compile(
        "(?m)^\\s*(component|node|usecase|participant|actor|database|cloud|queue)\\b");
    private static final Pattern INTERACTION_KEYWORD = Pattern.compile(
        "\\b(participant|actor)\\b");
    private static final Pattern USE_CASE_MARKER = Pattern.compile(
        "(?m)\\busecase\\b|^\\s*\\([^)]+\\)");
    private static final Pattern FIRST_PARTICIPANT = Pattern.compile(
        "(?m)^\\s*(?:participant|actor)\\s+(?:\"[^\"]*\"\\s+as\\s+)?(\\w+)");

    /**
     * Returns the context for a known diagram type.
     *
     * @param type diagram type
     * @return syntax context
     */
    public static DiagramSyntax of(DiagramType type) {
        return new DiagramSyntax(type.structural(), type == DiagramType.SEQUENCE);
    }

    /**
     * Infers the context from diagram text.
     *
     * <p>A diagram is structural when it declares classes, interfaces or enums and none of the
     * component, deployment or interaction elements. It is an interaction diagram when it
     * declares participants or actors, sends messages with {@code ->} and has no use cases.
     *
     * @param text diagram text
     * @return inferred syntax context
     */
    public static DiagramSyntax infer(String text) {
        boolean structural = CLASS_DECLARATION.matcher(text).find()
            && !NON_CLASS_DECLARATION.matcher(text).find();
        boolean interaction = INTERACTION_KEYWORD.matcher(text).find()
            && text.contains("->")
            && !USE_CASE_MARKER.matcher(text).find();
        return new DiagramSyntax(structural, interaction);
    }

    /**
     * Returns the alias of the first declared participant or actor.
     *
     * @param text diagram text
     * @return participant alias, or "Unknown" if none is declared
     */
    public static String firstParticipant(String text) {
        Matcher matcher = FIRST_PARTICIPANT.matcher(text);
        return matcher.find() ? matcher.group(1) : "Unknown";
    }
}
