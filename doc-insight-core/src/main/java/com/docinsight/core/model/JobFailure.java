package com.docinsight.core.model;

/**
 * Job-level failure kinds surfaced in a {@link GenerationResult}.
 *
 * <p>Provider-level kinds (rate limits, fatal provider errors, timeouts) are recovered
 * inside the gateway and never appear here directly.
 */
public enum JobFailure {
    /** Narrative draft failed: every provider was exhausted or the answer was empty */
    CONTENT_GENERATION_FAILED,

    /** The narrative file could not be written; diagram files were rolled back */
    WRITE_FAILED
}
