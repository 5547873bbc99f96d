package com.docinsight.core.validator.rules;

import com.docinsight.core.validator.DiagramSyntax;
import com.docinsight.core.validator.FixRule;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Removes class-style member lists from elements that cannot have members.
 *
 * <p>Components, nodes, packages and similar containers accept nested elements but no
 * {@code + method()} / {@code - field} lines. Inside such a block those lines are removed
 * together with blank lines; the text of multi-line notes inside the block is kept as
 * written. A block left without content, or written as an empty
 * {@code {}} body, is reduced to a plain declaration; a quoted single-word alias on that
 * declaration is unquoted.
 */
public class MemberListRule implements FixRule {

    static final Set<String> MEMBERLESS_KINDS = Set.of(
        "component", "node", "rectangle", "package", "frame", "folder", "database", "cloud"
    );

    private static final Pattern EMPTY_BODY = Pattern.compile(
        "(?m)^([ \\t]*)(" + String.join("|", MEMBERLESS_KINDS) + ")([ \\t]+[^{\\n]*?)[ \\t]*\\{[ \\t]*\\}[ \\t]*$");
    private static final Pattern LEADING_WORD = Pattern.compile("^[ \\t]*(\\w+)");
    private static final Pattern MEMBER_LINE = Pattern.compile("^[ \\t]*[+\\-#~][ \\t]*[A-Za-z_].*$");
    private static final Pattern QUOTED_ALIAS = Pattern.compile("\\bas[ \\t]+\"(\\w+)\"");
    private static final Pattern OPEN_BRACE_SUFFIX = Pattern.compile("[ \\t]*\\{[ \\t]*$");
    private static final Pattern NOTE_BLOCK_START = Pattern.compile("^note\\b[^:\"]*$");
    private static final Pattern NOTE_BLOCK_END = Pattern.compile("^end[ \\t]?note\\b.*$");

    @Override
    public String apply(String text, DiagramSyntax syntax) {
        Matcher emptyBody = EMPTY_BODY.matcher(text);
        StringBuilder collapsed = new StringBuilder();
        while (emptyBody.find()) {
            String declaration = emptyBody.group(1) + emptyBody.group(2) + emptyBody.group(3);
            emptyBody.appendReplacement(collapsed, Matcher.quoteReplacement(unquoteAlias(declaration)));
        }
        emptyBody.appendTail(collapsed);
        return stripMembers(collapsed.toString());
    }

    private static String stripMembers(String text) {
        String[] lines = text.split("\n", -1);
        List<String> out = new ArrayList<>(lines.length);
        Deque<OpenBlock> blocks = new ArrayDeque<>();
        boolean inNote = false;

        for (String line : lines) {
            String trimmed = line.trim();
            if (inNote) {
                out.add(line);
                inNote = !NOTE_BLOCK_END.matcher(trimmed).matches();
                continue;
            }
            if (NOTE_BLOCK_START.matcher(trimmed).matches()) {
                out.add(line);
                inNote = true;
                continue;
            }
            OpenBlock current = blocks.peek();
            boolean insideMemberless = current != null && current.memberless();

            if (trimmed.endsWith("{") && !trimmed.startsWith("}")) {
                out.add(line);
                blocks.push(new OpenBlock(isMemberlessDeclaration(line), out.size() - 1));
            } else if (trimmed.startsWith("}") && current != null) {
                blocks.pop();
                if (current.memberless() && current.openLine() == out.size() - 1) {
                    String declaration = OPEN_BRACE_SUFFIX.matcher(out.get(current.openLine())).replaceFirst("");
                    out.set(current.openLine(), unquoteAlias(declaration));
                } else {
                    out.add(line);
                }
            } else if (insideMemberless && (trimmed.isEmpty() || MEMBER_LINE.matcher(line).matches())) {
                continue;
            } else {
                out.add(line);
            }
        }
        return String.join("\n", out);
    }

    private static boolean isMemberlessDeclaration(String line) {
        Matcher matcher = LEADING_WORD.matcher(line);
        return matcher.find() && MEMBERLESS_KINDS.contains(matcher.group(1));
    }

    private static String unquoteAlias(String declaration) {
        return QUOTED_ALIAS.matcher(declaration).replaceAll("as $1");
    }

    private record OpenBlock(boolean memberless, int openLine) {
    }
}
