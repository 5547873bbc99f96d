package com.docinsight.core.repair;

import java.nio.file.Path;

/**
 * External structural syntax checker for diagram source files.
 */
public interface SyntaxChecker {

    /**
     * Checks a source file.
     *
     * @param sourceFile diagram source file
     * @return verdict with diagnostic on failure
     */
    CheckResult check(Path sourceFile);
}
