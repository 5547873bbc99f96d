package com.docinsight.core.repair;

/**
 * Verdict of an external syntax check.
 *
 * @param valid true if the checker accepted the file
 * @param diagnostic checker output explaining the rejection, or null when valid
 */
public record CheckResult(boolean valid, String diagnostic) {

    public static CheckResult passed() {
        return new CheckResult(true, null);
    }

    public static CheckResult failed(String diagnostic) {
        return new CheckResult(false, diagnostic == null || diagnostic.isBlank() ? "unknown syntax error" : diagnostic);
    }
}
