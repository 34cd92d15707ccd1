package com.project.attest.net;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Poll signals")
class PollTriggerTest {

    @Test
    @DisplayName("a fired trigger cuts the wait short")
    void firedTrigger() throws InterruptedException {
        PollTrigger trigger = new PollTrigger();
        trigger.fire();

        long start = System.nanoTime();
        assertThat(trigger.await(Duration.ofSeconds(10))).isTrue();
        assertThat(Duration.ofNanos(System.nanoTime() - start)).isLessThan(Duration.ofSeconds(5));
    }

    @Test
    @DisplayName("duplicate notifications collapse into one wake-up")
    void duplicatesCollapse() throws InterruptedException {
        PollTrigger trigger = new PollTrigger();
        trigger.fire();
        trigger.fire();
        trigger.fire();

        assertThat(trigger.await(Duration.ofMillis(10))).isTrue();
        assertThat(trigger.await(Duration.ofMillis(10))).isFalse();
    }

    @Test
    @DisplayName("without a notification the full interval elapses")
    void timesOut() throws InterruptedException {
        assertThat(new PollTrigger().await(Duration.ofMillis(20))).isFalse();
    }

    @Test
    @DisplayName("cancellation runs each listener once, including late ones")
    void cancellationListeners() {
        CancellationSignal signal = new CancellationSignal();
        AtomicInteger early = new AtomicInteger();
        AtomicInteger late = new AtomicInteger();
        signal.onCancel(early::incrementAndGet);

        signal.cancel();
        signal.cancel();
        signal.onCancel(late::incrementAndGet);

        assertThat(signal.isCancelled()).isTrue();
        assertThat(early).hasValue(1);
        assertThat(late).hasValue(1);
    }
}
