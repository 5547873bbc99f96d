package com.docinsight.core.provider;

/**
 * Classification of a failed completion call.
 *
 * <p>Providers classify their own errors into the first three kinds. The gateway reports
 * {@link #ALL_PROVIDERS_EXHAUSTED} once no provider is left to try.
 */
public enum FailureKind {
    /** Provider throttled the call; retry the same provider after backoff */
    RATE_LIMITED,

    /** Non-recoverable provider error; move on to the next provider */
    FATAL,

    /** The call exceeded its timeout; move on to the next provider */
    TIMEOUT,

    /** No provider produced a result */
    ALL_PROVIDERS_EXHAUSTED
}
