package com.docinsight.core.validator;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of rule-based validation.
 */
public sealed interface ValidationResult permits ValidationResult.Fixed, ValidationResult.Unrepairable {

    /**
     * Returns the fixed text if validation succeeded.
     *
     * @return fixed text, or empty when unrepairable
     */
    default Optional<String> text() {
        return this instanceof Fixed fixed ? Optional.of(fixed.fixedText()) : Optional.empty();
    }

    /**
     * Text that passed every fix rule and hard invariant.
     *
     * @param fixedText fixed diagram text
     */
    record Fixed(String fixedText) implements ValidationResult {
        public Fixed {
            Objects.requireNonNull(fixedText, "fixedText must not be null");
        }
    }

    /**
     * Text that still violates a hard invariant after all fixes.
     *
     * @param reason violated invariant
     */
    record Unrepairable(String reason) implements ValidationResult {
        public Unrepairable {
            Objects.requireNonNull(reason, "reason must not be null");
        }
    }
}
