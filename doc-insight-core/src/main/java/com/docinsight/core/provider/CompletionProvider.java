package com.docinsight.core.provider;

/**
 * A text-generation service reachable through a prompt/response contract.
 *
 * <p>Implementations hold their own client handles and must be safe to call from several
 * threads at once; the gateway shares one instance across concurrent diagram tasks.
 * They never retry on their own; retry and fallback belong to {@link CompletionGateway}.
 */
public interface CompletionProvider {

    /**
     * Returns the unique identifier of this provider (e.g. "anthropic").
     *
     * @return provider id
     */
    String id();

    /**
     * Performs one completion call.
     *
     * @param request prompt and model parameters
     * @return generated text (may be blank; the gateway rejects blank text)
     * @throws ProviderException if the call fails
     */
    String complete(CompletionRequest request);

    /**
     * Maps a failure of {@link #complete(CompletionRequest)} onto a failure kind.
     *
     * <p>Must return one of {@link FailureKind#RATE_LIMITED}, {@link FailureKind#FATAL}
     * or {@link FailureKind#TIMEOUT}.
     *
     * @param failure exception raised by the call
     * @return failure classification
     */
    default FailureKind classify(Throwable failure) {
        return ProviderErrorClassifier.classify(failure);
    }
}
