package com.docinsight.core.validator.rules;

import com.docinsight.core.validator.DiagramSyntax;
import com.docinsight.core.validator.FixRule;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Restores the space after element keywords at the start of a line.
 *
 * <p>Generated text sometimes glues the keyword to the name ({@code participantOrderService});
 * this rule splits it back ({@code participant OrderService}). Only a keyword followed by an
 * uppercase name is split, and only when the rest of the line reads like a declaration: end of
 * line, an alias ({@code as}), a body, a stereotype, a color or a quoted label. Identifiers in
 * messages and relations, such as {@code nodeCount -> x}, stay intact.
 */
public class KeywordSpacingRule implements FixRule {

    static final List<String> KEYWORDS = List.of(
        "participant", "actor", "component", "interface", "database", "entity", "boundary",
        "control", "collections", "queue", "node", "rectangle", "package"
    );

    private static final Pattern GLUED_KEYWORD = Pattern.compile(
        "(?m)^([ \\t]*)(" + String.join("|", KEYWORDS) + ")([A-Z][A-Za-z0-9_]*+)"
            + "(?=[ \\t]*(?:\\r?$|as\\b|\\{|<<|#|\"))");

    @Override
    public String apply(String text, DiagramSyntax syntax) {
        return GLUED_KEYWORD.matcher(text).replaceAll("$1$2 $3");
    }
}
