package com.docinsight.core.util;

import java.util.Locale;

/**
 * Naming helpers for generated file names.
 */
public final class Names {

    private Names() {
        // Utility class
    }

    /**
     * Converts a name to kebab-case containing only lowercase letters, digits and hyphens.
     *
     * <p>Examples: {@code DecoratorPattern -> decorator-pattern},
     * {@code MCPServerSetup -> mcp-server-setup}, {@code Some_Name_Here -> some-name-here}.
     *
     * @param name name in any casing
     * @return kebab-case slug, possibly empty
     */
    public static String toKebabCase(String name) {
        if (name == null) {
            return "";
        }
        return name
            .replaceAll("([a-z0-9])([A-Z])", "$1-$2")
            .replaceAll("([A-Z]+)([A-Z][a-z])", "$1-$2")
            .replaceAll("[_\\s]+", "-")
            .toLowerCase(Locale.ROOT)
            .replaceAll("[^a-z0-9-]", "")
            .replaceAll("-+", "-")
            .replaceAll("^-|-$", "");
    }

    /**
     * Makes a name safe to use as a single file name inside the output directory.
     *
     * <p>Path separators, parent references ({@code ..}) and characters not allowed in file
     * names are removed; casing and spaces are kept. {@code ../etc/passwd} becomes
     * {@code etcpasswd}.
     *
     * @param name entity name
     * @param fallback name to use when nothing is left
     * @return file name without extension
     */
    public static String toFileName(String name, String fallback) {
        String cleaned = name == null ? "" : name
            .replace("..", "")
            .replaceAll("[/\\\\:*?\"<>|\\p{Cntrl}]", "")
            .replaceAll("^[.\\s]+", "")
            .trim();
        return cleaned.isEmpty() ? fallback : cleaned;
    }
}
