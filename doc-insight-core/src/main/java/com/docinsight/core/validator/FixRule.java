package com.docinsight.core.validator;

/**
 * A structural normalization applied to generated diagram text.
 *
 * <p>Implementations must be pure and idempotent: applying a rule to its own output returns
 * that output unchanged.
 */
@FunctionalInterface
public interface FixRule {

    /**
     * Applies the fix.
     *
     * @param text diagram text
     * @param syntax grammar context of the diagram
     * @return fixed text (the input itself when nothing applies)
     */
    String apply(String text, DiagramSyntax syntax);
}
