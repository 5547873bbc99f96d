package com.docinsight.core.provider;

/**
 * Per-call model parameters.
 *
 * <p>Null values fall back to the provider's configured defaults.
 *
 * @param maxTokens completion token limit, or null
 * @param temperature sampling temperature, or null
 * @param providerHint id of a provider to try first, or null for priority order
 */
public record CompletionOptions(
    Integer maxTokens,
    Double temperature,
    String providerHint
) {
    /**
     * Compact constructor with validation.
     */
    public CompletionOptions {
        if (maxTokens != null && maxTokens <= 0) {
            throw new IllegalArgumentException("maxTokens must be positive");
        }
    }

    /**
     * Creates options that use provider defaults and priority order.
     *
     * @return default options
     */
    public static CompletionOptions defaults() {
        return new CompletionOptions(null, null, null);
    }
}
