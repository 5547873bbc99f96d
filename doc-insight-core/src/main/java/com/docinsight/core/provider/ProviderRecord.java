package com.docinsight.core.provider;

import com.docinsight.core.config.ProjectConfig.ProviderSettings;

import java.time.Duration;
import java.util.Objects;

/**
 * Read-only call policy of one provider.
 *
 * @param id provider id
 * @param priority rank, lower is called first
 * @param retryBudget maximum calls to this provider per invocation
 * @param backoff rate-limit backoff
 * @param timeout per-call timeout
 */
public record ProviderRecord(
    String id,
    int priority,
    int retryBudget,
    BackoffPolicy backoff,
    Duration timeout
) {
    /**
     * Compact constructor with validation.
     */
    public ProviderRecord {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(backoff, "backoff must not be null");
        Objects.requireNonNull(timeout, "timeout must not be null");
        if (retryBudget < 1) {
            throw new IllegalArgumentException("retryBudget must be at least 1");
        }
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
    }

    /**
     * Creates a record with default budget (3), backoff (1s base, 30s cap) and timeout (30s).
     *
     * @param id provider id
     * @param priority rank
     * @return provider record
     */
    public static ProviderRecord withDefaults(String id, int priority) {
        return new ProviderRecord(
            id,
            priority,
            ProviderSettings.DEFAULT_RETRY_BUDGET,
            new BackoffPolicy(ProviderSettings.DEFAULT_BACKOFF_BASE, ProviderSettings.DEFAULT_BACKOFF_CAP),
            ProviderSettings.DEFAULT_TIMEOUT
        );
    }

    /**
     * Creates a record from provider configuration.
     *
     * @param settings configured provider
     * @return provider record
     */
    public static ProviderRecord from(ProviderSettings settings) {
        return new ProviderRecord(
            settings.id(),
            settings.priority(),
            settings.retryBudget(),
            new BackoffPolicy(settings.backoffBase(), settings.backoffCap()),
            settings.timeout()
        );
    }
}
