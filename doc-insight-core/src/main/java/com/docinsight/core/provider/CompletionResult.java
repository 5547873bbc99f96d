package com.docinsight.core.provider;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of a gateway invocation: either text from one provider or a failure kind.
 */
public sealed interface CompletionResult permits CompletionResult.Ok, CompletionResult.Err {

    /**
     * Returns the generated text when this is a success.
     *
     * @return text, or empty for a failure
     */
    Optional<String> completion();

    /**
     * Returns whether the call succeeded.
     *
     * @return true for {@link Ok}
     */
    default boolean isOk() {
        return this instanceof Ok;
    }

    /**
     * Successful completion.
     *
     * @param text non-blank generated text
     * @param providerId provider that produced the text
     */
    record Ok(String text, String providerId) implements CompletionResult {
        public Ok {
            Objects.requireNonNull(text, "text must not be null");
            Objects.requireNonNull(providerId, "providerId must not be null");
        }

        @Override
        public Optional<String> completion() {
            return Optional.of(text);
        }
    }

    /**
     * Failed completion.
     *
     * @param kind failure classification
     * @param detail short description of the last failure
     */
    record Err(FailureKind kind, String detail) implements CompletionResult {
        public Err {
            Objects.requireNonNull(kind, "kind must not be null");
            if (detail == null) {
                detail = kind.name();
            }
        }

        @Override
        public Optional<String> completion() {
            return Optional.empty();
        }
    }
}
