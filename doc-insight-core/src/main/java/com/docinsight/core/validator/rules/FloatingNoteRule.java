package com.docinsight.core.validator.rules;

import com.docinsight.core.validator.DiagramSyntax;
import com.docinsight.core.validator.FixRule;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Rewrites free-floating notes into the block form the diagram grammar accepts.
 *
 * <p>Three steps, in order:
 * <ol>
 *   <li>A standalone {@code note "text"} line (optionally {@code note "text" as N1}) becomes a
 *       {@code note as AutoNoteN ... end note} block; {@code \n} escapes become separate lines
 *       and an empty note is dropped.</li>
 *   <li>{@code end note as X} is reduced to {@code end note}.</li>
 *   <li>Every {@code note as X ... end note} block is normalized: body lines are trimmed,
 *       blank lines removed and the body indented by two spaces. Sequence diagrams do not
 *       support floating notes at all, so there each block becomes
 *       {@code note over <first participant>: text}.</li>
 * </ol>
 * Generated note ids continue after the highest {@code AutoNoteN} already present.
 */
public class FloatingNoteRule implements FixRule {

    private static final Pattern INLINE_NOTE = Pattern.compile(
        "(?m)^([ \\t]*)note[ \\t]+\"([^\"\\n]*)\"(?:[ \\t]+as[ \\t]+(\\w+))?[ \\t]*$");
    private static final Pattern END_NOTE_ALIAS = Pattern.compile("\\bend[ \\t]+note[ \\t]+as[ \\t]+\\w+");
    private static final Pattern BLOCK_START = Pattern.compile("([ \\t]*)note[ \\t]+as[ \\t]+(\\w+)[ \\t]*");
    private static final Pattern BLOCK_END = Pattern.compile("[ \\t]*end[ \\t]+note[ \\t]*");
    private static final Pattern AUTO_NOTE_ID = Pattern.compile("\\bAutoNote(\\d+)\\b");

    static final String AUTO_NOTE_PREFIX = "AutoNote";

    @Override
    public String apply(String text, DiagramSyntax syntax) {
        String expanded = expandInlineNotes(text);
        String cleaned = END_NOTE_ALIAS.matcher(expanded).replaceAll("end note");
        return normalizeBlocks(cleaned, syntax);
    }

    private static String expandInlineNotes(String text) {
        Matcher matcher = INLINE_NOTE.matcher(text);
        if (!matcher.find()) {
            return text;
        }
        matcher.reset();

        int nextId = highestAutoNoteId(text) + 1;
        StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            String indent = matcher.group(1);
            List<String> lines = splitNoteText(matcher.group(2).replace("\\n", "\n"));

            String replacement;
            if (lines.isEmpty()) {
                replacement = "";
            } else {
                String id = matcher.group(3) != null ? matcher.group(3) : AUTO_NOTE_PREFIX + nextId++;
                replacement = block(indent, id, lines);
            }
            matcher.appendReplacement(result, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    private static String normalizeBlocks(String text, DiagramSyntax syntax) {
        String[] lines = text.split("\n", -1);
        String participant = syntax.interaction() ? DiagramSyntax.firstParticipant(text) : null;
        List<String> out = new ArrayList<>(lines.length);

        int i = 0;
        while (i < lines.length) {
            Matcher start = BLOCK_START.matcher(lines[i]);
            int end = start.matches() ? findBlockEnd(lines, i + 1) : -1;
            if (end < 0) {
                out.add(lines[i]);
                i++;
                continue;
            }

            String indent = start.group(1);
            List<String> body = splitNoteText(String.join("\n", Arrays.asList(lines).subList(i + 1, end)));
            if (participant != null) {
                out.add(indent + "note over " + participant + ": " + String.join(" ", body));
            } else {
                out.add(block(indent, start.group(2), body));
            }
            i = end + 1;
        }
        return String.join("\n", out);
    }

    private static int findBlockEnd(String[] lines, int from) {
        for (int j = from; j < lines.length; j++) {
            if (BLOCK_END.matcher(lines[j]).matches()) {
                return j;
            }
            if (BLOCK_START.matcher(lines[j]).matches()) {
                return -1;
            }
        }
        return -1;
    }

    private static List<String> splitNoteText(String content) {
        return Arrays.stream(content.split("\n"))
            .map(String::trim)
            .filter(line -> !line.isEmpty())
            .collect(Collectors.toList());
    }

    private static String block(String indent, String id, List<String> body) {
        StringBuilder sb = new StringBuilder();
        sb.append(indent).append("note as ").append(id);
        for (String line : body) {
            sb.append('\n').append(indent).append("  ").append(line);
        }
        sb.append('\n').append(indent).append("end note");
        return sb.toString();
    }

    private static int highestAutoNoteId(String text) {
        Matcher matcher = AUTO_NOTE_ID.matcher(text);
        int highest = 0;
        while (matcher.find()) {
            highest = Math.max(highest, Integer.parseInt(matcher.group(1)));
        }
        return highest;
    }
}
