package com.docinsight.core.validator.rules;

import com.docinsight.core.validator.DiagramSyntax;
import com.docinsight.core.validator.FixRule;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Collapses {@code \n} escapes inside quoted labels into single-line text.
 *
 * <p>{@code component "Order\nService" as "Order\nSvc"} becomes
 * {@code component "Order Service" as "Order Svc"}. Quoted text directly after {@code note}
 * is left alone; {@link FloatingNoteRule} expands it into a multi-line note block.
 */
public class QuotedLabelLineBreakRule implements FixRule {

    private static final Pattern QUOTED = Pattern.compile("\"([^\"\\n]*)\"");
    private static final Pattern NOTE_PREFIX = Pattern.compile("\\bnote[ \\t]+$");
    private static final String LINE_BREAK_ESCAPE = "\\n";

    @Override
    public String apply(String text, DiagramSyntax syntax) {
        if (!text.contains(LINE_BREAK_ESCAPE)) {
            return text;
        }

        Matcher matcher = QUOTED.matcher(text);
        StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            String label = matcher.group(1);
            String replacement = matcher.group();
            if (label.contains(LINE_BREAK_ESCAPE) && !followsNoteKeyword(text, matcher.start())) {
                replacement = "\"" + collapse(label) + "\"";
            }
            matcher.appendReplacement(result, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    private static boolean followsNoteKeyword(String text, int quoteStart) {
        int lineStart = text.lastIndexOf('\n', quoteStart - 1) + 1;
        return NOTE_PREFIX.matcher(text.substring(lineStart, quoteStart)).find();
    }

    private static String collapse(String label) {
        return label.replace(LINE_BREAK_ESCAPE, " ").replaceAll("\\s+", " ").trim();
    }
}
