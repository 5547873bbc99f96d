package com.docinsight.core.provider;

import java.net.http.HttpTimeoutException;
import java.util.Locale;
import java.util.concurrent.TimeoutException;

/**
 * Maps provider failures onto {@link FailureKind}s.
 *
 * <p>Status codes win over message inspection. Anything not recognised as a rate limit or a
 * timeout is {@link FailureKind#FATAL}.
 */
public final class ProviderErrorClassifier {

    private static final int HTTP_REQUEST_TIMEOUT = 408;
    private static final int HTTP_TOO_MANY_REQUESTS = 429;
    private static final int HTTP_GATEWAY_TIMEOUT = 504;
    private static final int HTTP_OVERLOADED = 529;

    private ProviderErrorClassifier() {
        // Utility class
    }

    /**
     * Classifies a failure raised by a provider call.
     *
     * @param error the failure
     * @return rate-limited, timeout or fatal
     */
    public static FailureKind classify(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof ProviderException providerException) {
                int status = providerException.statusCode();
                if (status == HTTP_TOO_MANY_REQUESTS || status == HTTP_OVERLOADED) {
                    return FailureKind.RATE_LIMITED;
                }
                if (status == HTTP_REQUEST_TIMEOUT || status == HTTP_GATEWAY_TIMEOUT) {
                    return FailureKind.TIMEOUT;
                }
            }
            if (current instanceof HttpTimeoutException || current instanceof TimeoutException) {
                return FailureKind.TIMEOUT;
            }
            String message = current.getMessage();
            if (message != null) {
                String lower = message.toLowerCase(Locale.ROOT);
                if (lower.contains("rate limit") || lower.contains("too many requests")) {
                    return FailureKind.RATE_LIMITED;
                }
                if (lower.contains("timed out") || lower.contains("timeout")) {
                    return FailureKind.TIMEOUT;
                }
            }
            current = current.getCause();
        }
        return FailureKind.FATAL;
    }
}
