package com.docinsight.core.provider;

import java.util.Objects;

/**
 * Immutable request passed to a provider, created per call.
 *
 * @param prompt prompt text
 * @param options model parameters
 */
public record CompletionRequest(
    String prompt,
    CompletionOptions options
) {
    /**
     * Compact constructor with validation.
     */
    public CompletionRequest {
        Objects.requireNonNull(prompt, "prompt must not be null");
        if (options == null) {
            options = CompletionOptions.defaults();
        }
    }
}
