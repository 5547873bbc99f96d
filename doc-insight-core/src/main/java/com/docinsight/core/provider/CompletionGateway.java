package com.docinsight.core.provider;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Calls completion providers in priority order with classification-aware retry and fallback.
 *
 * <p>For each provider in {@link ProviderRegistry} order, up to {@code retryBudget} calls are
 * made. After a failure the error is classified by the provider:
 * <ul>
 *   <li>{@link FailureKind#RATE_LIMITED} - sleep {@code min(base * 2^retry, cap)} and call the
 *       same provider again, while budget remains</li>
 *   <li>{@link FailureKind#FATAL} or {@link FailureKind#TIMEOUT} - abandon the provider and
 *       move on to the next one immediately</li>
 * </ul>
 * A blank success is treated as {@code FATAL} for that provider. When no provider is left the
 * result is {@link FailureKind#ALL_PROVIDERS_EXHAUSTED}.
 *
 * <p>The gateway holds no per-call state; one instance is shared by concurrent diagram tasks.
 * Each call runs on a worker thread so its timeout can be enforced; a timed-out call is
 * cancelled on a best-effort basis.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * try (CompletionGateway gateway = new CompletionGateway(registry)) {
 *     CompletionResult result = gateway.invoke(prompt, CompletionOptions.defaults());
 *     if (result instanceof CompletionResult.Ok ok) {
 *         use(ok.text());
 *     }
 * }
 * }</pre>
 */
public class CompletionGateway implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(CompletionGateway.class);

    private final ProviderRegistry registry;
    private final Sleeper sleeper;
    private final ExecutorService callExecutor;

    /**
     * Creates a gateway that sleeps with {@link Thread#sleep(long)}.
     *
     * @param registry providers in priority order
     */
    public CompletionGateway(ProviderRegistry registry) {
        this(registry, Sleeper.system());
    }

    /**
     * Creates a gateway with a custom sleeper.
     *
     * @param registry providers in priority order
     * @param sleeper blocks between rate-limited retries
     */
    public CompletionGateway(ProviderRegistry registry, Sleeper sleeper) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
        this.callExecutor = Executors.newCachedThreadPool(new CallThreadFactory());
    }

    /**
     * Obtains a completion from the first provider that delivers one.
     *
     * @param prompt prompt text
     * @param options model parameters and optional provider hint
     * @return {@link CompletionResult.Ok} with the text, or {@link CompletionResult.Err} with
     *         {@link FailureKind#ALL_PROVIDERS_EXHAUSTED}
     */
    public CompletionResult invoke(String prompt, CompletionOptions options) {
        Objects.requireNonNull(prompt, "prompt must not be null");
        CompletionRequest request = new CompletionRequest(prompt, options);

        if (registry.isEmpty()) {
            log.warn("No completion providers configured");
            return new CompletionResult.Err(FailureKind.ALL_PROVIDERS_EXHAUSTED, "no providers configured");
        }

        String lastFailure = null;
        for (ProviderRegistry.Entry entry : registry.orderedFor(request.options().providerHint())) {
            ProviderRecord record = entry.record();

            for (int attempt = 1; attempt <= record.retryBudget(); attempt++) {
                AttemptOutcome outcome = callOnce(entry, request);

                if (outcome.text() != null) {
                    logAttempt(record, attempt, "OK", null);
                    return new CompletionResult.Ok(outcome.text(), record.id());
                }

                lastFailure = record.id() + ": " + outcome.detail();
                logAttempt(record, attempt, outcome.kind().name(), outcome.detail());

                if (outcome.kind() != FailureKind.RATE_LIMITED || attempt == record.retryBudget()) {
                    break;
                }

                Duration delay = record.backoff().delayFor(attempt - 1);
                log.debug("Backing off {}ms before retrying provider {}", delay.toMillis(), record.id());
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.warn("Interrupted while backing off from provider {}", record.id());
                    return new CompletionResult.Err(FailureKind.ALL_PROVIDERS_EXHAUSTED, "interrupted during backoff");
                }
            }
        }

        log.error("All {} completion providers exhausted; last failure: {}", registry.size(), lastFailure);
        return new CompletionResult.Err(FailureKind.ALL_PROVIDERS_EXHAUSTED, lastFailure);
    }

    /**
     * Convenience overload using default options.
     *
     * @param prompt prompt text
     * @return completion result
     */
    public CompletionResult invoke(String prompt) {
        return invoke(prompt, CompletionOptions.defaults());
    }

    /**
     * Performs one bounded call and classifies its outcome.
     *
     * @param entry provider to call
     * @param request request to send
     * @return text on success, otherwise a failure kind and detail
     */
    private AttemptOutcome callOnce(ProviderRegistry.Entry entry, CompletionRequest request) {
        CompletionProvider provider = entry.provider();
        Duration timeout = entry.record().timeout();
        Future<String> call = callExecutor.submit(() -> provider.complete(request));

        try {
            String text = call.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (text == null || text.isBlank()) {
                return AttemptOutcome.failure(FailureKind.FATAL, "empty response");
            }
            return AttemptOutcome.success(text);
        } catch (TimeoutException e) {
            call.cancel(true);
            return AttemptOutcome.failure(FailureKind.TIMEOUT, "no response within " + timeout.toMillis() + "ms");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            return AttemptOutcome.failure(classify(provider, cause), describe(cause));
        } catch (CancellationException e) {
            return AttemptOutcome.failure(FailureKind.FATAL, "call cancelled");
        } catch (InterruptedException e) {
            call.cancel(true);
            Thread.currentThread().interrupt();
            return AttemptOutcome.failure(FailureKind.FATAL, "interrupted");
        }
    }

    /**
     * Applies the provider's classification, treating anything outside the provider kinds as fatal.
     */
    private FailureKind classify(CompletionProvider provider, Throwable failure) {
        FailureKind kind = provider.classify(failure);
        if (kind == null || kind == FailureKind.ALL_PROVIDERS_EXHAUSTED) {
            return FailureKind.FATAL;
        }
        return kind;
    }

    private static String describe(Throwable failure) {
        String message = failure.getMessage();
        return failure.getClass().getSimpleName() + (message != null ? ": " + message : "");
    }

    private static void logAttempt(ProviderRecord record, int attempt, String outcome, String detail) {
        if ("OK".equals(outcome)) {
            log.info("provider_attempt provider={} attempt={}/{} outcome={}",
                record.id(), attempt, record.retryBudget(), outcome);
        } else {
            log.warn("provider_attempt provider={} attempt={}/{} outcome={} detail={}",
                record.id(), attempt, record.retryBudget(), outcome, detail);
        }
    }

    /**
     * Stops the worker threads. In-flight calls are interrupted.
     */
    @Override
    public void close() {
        callExecutor.shutdownNow();
    }

    /**
     * Result of a single provider call.
     */
    private record AttemptOutcome(String text, FailureKind kind, String detail) {

        static AttemptOutcome success(String text) {
            return new AttemptOutcome(text, null, null);
        }

        static AttemptOutcome failure(FailureKind kind, String detail) {
            return new AttemptOutcome(null, kind, detail);
        }
    }

    /**
     * Daemon threads so an abandoned call never keeps the JVM alive.
     */
    private static final class CallThreadFactory implements ThreadFactory {

        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable task) {
            Thread thread = new Thread(task, "completion-call-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
