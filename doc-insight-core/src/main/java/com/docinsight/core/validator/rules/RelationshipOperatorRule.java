package com.docinsight.core.validator.rules;

import com.docinsight.core.validator.DiagramSyntax;
import com.docinsight.core.validator.FixRule;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Downgrades class-diagram relationship operators outside class diagrams.
 *
 * <p>Inheritance ({@code <|--}, {@code --|>}), realization ({@code <|..}, {@code ..|>}),
 * composition ({@code *--}, {@code --*}) and aggregation ({@code o--}, {@code --o}) are only
 * legal in structural diagrams. Elsewhere the decoration is dropped and a plain dependency
 * arrow is kept, preserving the line style: {@code A *-- B} becomes {@code A --> B} and
 * {@code A ..|> B} becomes {@code A ..> B}. Decorations on both ends collapse to one
 * arrow: {@code A *--* B} becomes {@code A --> B}.
 */
public class RelationshipOperatorRule implements FixRule {

    private static final List<Replacement> REPLACEMENTS = List.of(
        new Replacement(Pattern.compile("(?<=\\s)(?:\\*|o|<\\|)([-.]{2,})(?:\\*|o|\\|>)(?=\\s)"), "$1>"),
        new Replacement(Pattern.compile("<\\|([-.]+)"), "<$1"),
        new Replacement(Pattern.compile("([-.]+)\\|>"), "$1>"),
        new Replacement(Pattern.compile("(?<=[\\s\\w\"])\\*([-.]{2,})>?"), "$1>"),
        new Replacement(Pattern.compile("([-.]{2,})\\*(?=[\\s\\w\"])"), "$1>"),
        new Replacement(Pattern.compile("(?<=\\s)o([-.]{2,})>?(?=[\\s\\w\"])"), "$1>"),
        new Replacement(Pattern.compile("([-.]{2,})o(?=\\s)"), "$1>")
    );

    @Override
    public String apply(String text, DiagramSyntax syntax) {
        if (syntax.structural()) {
            return text;
        }
        String result = text;
        for (Replacement replacement : REPLACEMENTS) {
            result = replacement.pattern().matcher(result).replaceAll(replacement.with());
        }
        return result;
    }

    private record Replacement(Pattern pattern, String with) {
    }
}
