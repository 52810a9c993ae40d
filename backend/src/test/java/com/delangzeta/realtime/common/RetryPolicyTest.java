package com.delangzeta.realtime.common;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryPolicyTest {

    @Test
    void delayMs_attemptZero_returnsJitteredBaseDelay() {
        RetryPolicy policy = new RetryPolicy(1000L, 0.2, 30_000L);
        for (int i = 0; i < 20; i++) {
            long d = policy.delayMs(0);
            assertThat(d).isBetween(800L, 1200L); // ±20% of 1000
        }
    }

    @Test
    void delayMs_exponentialIncreases() {
        RetryPolicy policy = new RetryPolicy(100L, 0, 30_000L); // no jitter for deterministic test
        assertThat(policy.delayMs(0)).isEqualTo(100L);
        assertThat(policy.delayMs(1)).isEqualTo(200L);
        assertThat(policy.delayMs(2)).isEqualTo(400L);
    }

    @Test
    void delayMs_neverExceedsCap_evenWithJitter() {
        RetryPolicy policy = RetryPolicy.defaultPolicy();
        for (int attempt = 0; attempt < 100; attempt++) {
            assertThat(policy.delayMs(attempt)).isBetween(0L, 30_000L);
        }
        assertThat(new RetryPolicy(1000L, 0, 30_000L).delayMs(10)).isEqualTo(30_000L);
    }

    @Test
    void constructor_rejectsInvalidArguments() {
        assertThatThrownBy(() -> new RetryPolicy(0, 0.2, 1000)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RetryPolicy(2000, 0.2, 1000)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RetryPolicy(1000, 1.0, 30_000)).isInstanceOf(IllegalArgumentException.class);
    }
}
