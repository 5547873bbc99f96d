package com.docinsight.core.provider;

/**
 * Raised by a provider when a call fails.
 *
 * <p>Carries the HTTP status code when the failure came from the provider's API, so that
 * {@link CompletionProvider#classify(Throwable)} can tell rate limits from other errors.
 */
public class ProviderException extends RuntimeException {

    /** Status code used when the failure did not come with one. */
    public static final int NO_STATUS = -1;

    private final int statusCode;

    public ProviderException(String message) {
        this(NO_STATUS, message, null);
    }

    public ProviderException(int statusCode, String message) {
        this(statusCode, message, null);
    }

    public ProviderException(String message, Throwable cause) {
        this(NO_STATUS, message, cause);
    }

    public ProviderException(int statusCode, String message, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    /**
     * Returns the HTTP status code of the failed call.
     *
     * @return status code, or {@link #NO_STATUS}
     */
    public int statusCode() {
        return statusCode;
    }
}
