package com.project.attest.net;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("RetryPolicy")
class RetryPolicyTest {

    @Test
    @DisplayName("delay doubles per attempt until the cap")
    void exponentialBackoff() {
        RetryPolicy policy = new RetryPolicy(100, 1_000, 0.0, 10);

        assertThat(policy.delay(0)).isEqualTo(Duration.ofMillis(100));
        assertThat(policy.delay(1)).isEqualTo(Duration.ofMillis(200));
        assertThat(policy.delay(3)).isEqualTo(Duration.ofMillis(800));
        assertThat(policy.delay(4)).isEqualTo(Duration.ofMillis(1_000));
        assertThat(policy.delay(60)).isEqualTo(Duration.ofMillis(1_000));
    }

    @Test
    @DisplayName("jitter stays within the configured factor")
    void jitterBounds() {
        RetryPolicy policy = new RetryPolicy(1_000, 1_000, 0.2, 3);

        for (int i = 0; i < 100; i++) {
            assertThat(policy.delay(0).toMillis()).isBetween(800L, 1_200L);
        }
    }

    @Test
    @DisplayName("allows retries until max attempts have failed")
    void attemptBudget() {
        RetryPolicy policy = new RetryPolicy(10, 10, 0.0, 3);

        assertThat(policy.allowsRetry(1)).isTrue();
        assertThat(policy.allowsRetry(2)).isTrue();
        assertThat(policy.allowsRetry(3)).isFalse();
        assertThat(policy.getMaxAttempts()).isEqualTo(3);
    }

    @Test
    @DisplayName("rejects inconsistent settings")
    void validation() {
        assertThatThrownBy(() -> new RetryPolicy(-1, 10, 0.0, 1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RetryPolicy(100, 10, 0.0, 1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RetryPolicy(10, 10, 1.0, 1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RetryPolicy(10, 10, 0.0, 0)).isInstanceOf(IllegalArgumentException.class);
    }
}
