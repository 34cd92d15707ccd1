package com.project.attest.net;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Circuit breaker guarding one remote endpoint.
 *
 * - CLOSED -> OPEN after {@code failureThreshold} consecutive failures
 * - OPEN -> HALF_OPEN once {@code openDuration} has passed
 * - HALF_OPEN -> CLOSED after {@code successThreshold} consecutive successes
 * - HALF_OPEN -> OPEN on any failure
 */
public class CircuitBreaker {
    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    public enum State {
        CLOSED,
        OPEN,
        HALF_OPEN
    }

    private final String name;
    private final int failureThreshold;
    private final int successThreshold;
    private final Duration openDuration;
    private final Clock clock;

    private final AtomicReference<State> state = new AtomicReference<>(State.CLOSED);
    private final AtomicInteger failureCount = new AtomicInteger();
    private final AtomicInteger successCount = new AtomicInteger();
    private final AtomicReference<Instant> stateChangedTime;

    public CircuitBreaker(String name) {
        this(name, 5, 3, Duration.ofSeconds(30), Clock.systemUTC());
    }

    public CircuitBreaker(String name, int failureThreshold, int successThreshold,
                          Duration openDuration, Clock clock) {
        if (failureThreshold <= 0 || successThreshold <= 0) {
            throw new IllegalArgumentException("Thresholds must be positive");
        }
        this.name = name;
        this.failureThreshold = failureThreshold;
        this.successThreshold = successThreshold;
        this.openDuration = openDuration;
        this.clock = clock;
        this.stateChangedTime = new AtomicReference<>(clock.instant());
    }

    public boolean canExecute() {
        return switch (state.get()) {
            case CLOSED, HALF_OPEN -> true;
            case OPEN -> {
                if (shouldTransitionToHalfOpen()) {
                    transitionTo(State.HALF_OPEN);
                    yield true;
                }
                yield false;
            }
        };
    }

    public void recordSuccess() {
        State current = state.get();
        if (current == State.HALF_OPEN) {
            if (successCount.incrementAndGet() >= successThreshold) {
                transitionTo(State.CLOSED);
            }
        } else if (current == State.CLOSED) {
            failureCount.set(0);
        }
    }

    public void recordFailure() {
        State current = state.get();
        if (current == State.HALF_OPEN) {
            transitionTo(State.OPEN);
        } else if (current == State.CLOSED && failureCount.incrementAndGet() >= failureThreshold) {
            transitionTo(State.OPEN);
        }
    }

    public State getState() {
        if (state.get() == State.OPEN && shouldTransitionToHalfOpen()) {
            transitionTo(State.HALF_OPEN);
        }
        return state.get();
    }

    public String getName() {
        return name;
    }

    private boolean shouldTransitionToHalfOpen() {
        return !clock.instant().isBefore(stateChangedTime.get().plus(openDuration));
    }

    private synchronized void transitionTo(State newState) {
        State oldState = state.get();
        if (oldState == newState) {
            return;
        }
        state.set(newState);
        stateChangedTime.set(clock.instant());
        successCount.set(0);
        if (newState == State.CLOSED) {
            failureCount.set(0);
        }
        if (newState == State.OPEN) {
            log.warn("Circuit breaker '{}' opened (was {})", name, oldState);
        } else {
            log.info("Circuit breaker '{}' {} -> {}", name, oldState, newState);
        }
    }
}
