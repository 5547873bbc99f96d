package com.docinsight.core.provider;

import java.time.Duration;
import java.util.Objects;

/**
 * Capped exponential backoff used between rate-limited calls to the same provider.
 *
 * @param base delay before the first retry
 * @param cap upper bound for any single delay
 */
public record BackoffPolicy(
    Duration base,
    Duration cap
) {
    /**
     * Compact constructor with validation.
     */
    public BackoffPolicy {
        Objects.requireNonNull(base, "base must not be null");
        Objects.requireNonNull(cap, "cap must not be null");
        if (base.isNegative() || cap.isNegative()) {
            throw new IllegalArgumentException("backoff durations must not be negative");
        }
    }

    /**
     * Returns {@code min(base * 2^retryIndex, cap)}.
     *
     * @param retryIndex zero-based index of the retry about to happen
     * @return delay before that retry
     */
    public Duration delayFor(int retryIndex) {
        if (retryIndex < 0) {
            throw new IllegalArgumentException("retryIndex must not be negative");
        }
        // 2^31 and above would overflow; the cap applies long before that
        if (retryIndex >= 31) {
            return cap;
        }
        long multiplier = 1L << retryIndex;
        long baseMillis = base.toMillis();
        if (baseMillis > 0 && multiplier > cap.toMillis() / baseMillis) {
            return cap;
        }
        Duration delay = Duration.ofMillis(baseMillis * multiplier);
        return delay.compareTo(cap) > 0 ? cap : delay;
    }
}
