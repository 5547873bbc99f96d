package com.docinsight.core.provider;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link BackoffPolicy}.
 */
class BackoffPolicyTest {

    private final BackoffPolicy policy = new BackoffPolicy(Duration.ofSeconds(1), Duration.ofSeconds(30));

    @Test
    void delayFor_doublesPerRetry() {
        assertThat(policy.delayFor(0)).isEqualTo(Duration.ofSeconds(1));
        assertThat(policy.delayFor(1)).isEqualTo(Duration.ofSeconds(2));
        assertThat(policy.delayFor(4)).isEqualTo(Duration.ofSeconds(16));
    }

    @Test
    void delayFor_neverExceedsCap() {
        assertThat(policy.delayFor(5)).isEqualTo(Duration.ofSeconds(30));
        assertThat(policy.delayFor(40)).isEqualTo(Duration.ofSeconds(30));
    }

    @Test
    void delayFor_negativeIndex_throwsException() {
        assertThatThrownBy(() -> policy.delayFor(-1))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void constructor_negativeDuration_throwsException() {
        assertThatThrownBy(() -> new BackoffPolicy(Duration.ofSeconds(-1), Duration.ofSeconds(30)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("must not be negative");
    }
}
