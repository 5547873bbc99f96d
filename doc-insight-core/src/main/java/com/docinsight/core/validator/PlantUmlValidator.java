package com.docinsight.core.validator;

import com.docinsight.core.model.DiagramType;
import com.docinsight.core.validator.rules.FloatingNoteRule;
import com.docinsight.core.validator.rules.KeywordSpacingRule;
import com.docinsight.core.validator.rules.MemberListRule;
import com.docinsight.core.validator.rules.QuotedLabelLineBreakRule;
import com.docinsight.core.validator.rules.RelationshipOperatorRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rule-based fixer and structural checker for generated PlantUML text.
 *
 * <p>The fix rules run in a fixed order, each feeding the next. The result must then contain
 * an {@code @startuml}/{@code @enduml} pair and balanced braces; otherwise the text is
 * reported as unrepairable. Validation performs no I/O and is idempotent for a given
 * diagram type: validating already-fixed text returns it unchanged.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * PlantUmlValidator validator = new PlantUmlValidator();
 * Optional<String> fixed = validator.validate(raw, DiagramType.SEQUENCE);
 * }</pre>
 */
public class PlantUmlValidator {

    private static final Logger log = LoggerFactory.getLogger(PlantUmlValidator.class);

    private static final String START_MARKER = "@startuml";
    private static final String END_MARKER = "@enduml";
    private static final Pattern DIAGRAM_BLOCK = Pattern.compile("@startuml[\\s\\S]*?@enduml");

    private static final FixRule QUOTED_LABELS = new QuotedLabelLineBreakRule();
    private static final FixRule KEYWORD_SPACING = new KeywordSpacingRule();

    private final List<FixRule> rules;

    /**
     * Creates a validator with the default rule chain.
     */
    public PlantUmlValidator() {
        this(defaultRules());
    }

    /**
     * Creates a validator with a custom rule chain.
     *
     * @param rules fix rules in application order
     */
    public PlantUmlValidator(List<FixRule> rules) {
        this.rules = List.copyOf(Objects.requireNonNull(rules, "rules must not be null"));
    }

    /**
     * Returns the default rules in application order.
     *
     * @return quoted labels, keyword spacing, floating notes, relationship operators, member lists
     */
    public static List<FixRule> defaultRules() {
        return List.of(
            QUOTED_LABELS,
            KEYWORD_SPACING,
            new FloatingNoteRule(),
            new RelationshipOperatorRule(),
            new MemberListRule()
        );
    }

    /**
     * Fixes text whose diagram type is known.
     *
     * @param raw generated diagram text
     * @param type diagram type
     * @return fixed text, or empty if it cannot be repaired by rules
     */
    public Optional<String> validate(String raw, DiagramType type) {
        return check(raw, DiagramSyntax.of(type)).text();
    }

    /**
     * Fixes text of unknown diagram type, inferring the grammar context from the text.
     *
     * @param raw generated diagram text
     * @return fixed text, or empty if it cannot be repaired by rules
     */
    public Optional<String> validate(String raw) {
        return check(raw, inferSyntax(raw)).text();
    }

    /**
     * Runs the rule chain and the hard invariants.
     *
     * @param raw generated diagram text
     * @param syntax grammar context
     * @return fixed text or the violated invariant
     */
    public ValidationResult check(String raw, DiagramSyntax syntax) {
        Objects.requireNonNull(raw, "raw must not be null");
        Objects.requireNonNull(syntax, "syntax must not be null");

        String fixed = raw.replace("\r\n", "\n");
        for (FixRule rule : rules) {
            fixed = rule.apply(fixed, syntax);
        }

        int start = fixed.indexOf(START_MARKER);
        int end = fixed.lastIndexOf(END_MARKER);
        if (start < 0 || end < start) {
            log.warn("PlantUML validation failed: missing {}/{} markers", START_MARKER, END_MARKER);
            return new ValidationResult.Unrepairable("missing " + START_MARKER + "/" + END_MARKER + " markers");
        }

        long open = fixed.chars().filter(c -> c == '{').count();
        long close = fixed.chars().filter(c -> c == '}').count();
        if (open != close) {
            log.warn("PlantUML validation failed: unbalanced braces ({} open, {} close)", open, close);
            return new ValidationResult.Unrepairable(
                "unbalanced braces (" + open + " open, " + close + " close)");
        }

        return new ValidationResult.Fixed(fixed);
    }

    /**
     * Infers the grammar context after the context-free rules have normalized the text,
     * so glued keywords such as {@code participantApi} are recognized.
     *
     * @param raw generated diagram text
     * @return inferred context
     */
    public static DiagramSyntax inferSyntax(String raw) {
        DiagramSyntax neutral = new DiagramSyntax(false, false);
        String normalized = KEYWORD_SPACING.apply(QUOTED_LABELS.apply(raw.replace("\r\n", "\n"), neutral), neutral);
        return DiagramSyntax.infer(normalized);
    }

    /**
     * Extracts the first {@code @startuml ... @enduml} block from a provider response.
     *
     * @param response provider response, possibly wrapped in prose or code fences
     * @return diagram block, or empty if the response contains none
     */
    public static Optional<String> extractDiagram(String response) {
        if (response == null) {
            return Optional.empty();
        }
        Matcher matcher = DIAGRAM_BLOCK.matcher(response);
        return matcher.find() ? Optional.of(matcher.group()) : Optional.empty();
    }
}
