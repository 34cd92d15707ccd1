package com.project.attest.ledger;

import com.project.attest.core.ErrorKind;
import com.project.attest.core.ExternalServiceException;
import com.project.attest.core.TransientNetworkException;
import com.project.attest.net.CancellationSignal;
import com.project.attest.net.RetryPolicy;
import com.project.attest.net.TimedCall;
import com.project.attest.support.Await;
import com.project.attest.support.ScriptedLedgerGateway;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ConfirmationTracker")
class ConfirmationTrackerTest {

    private static final Map<String, String> RELAYS = Map.of("chainA", "0xaa", "chainB", "0xbb", "chainC", "0xcc");
    private static final QuorumPolicy TWO_OF_THREE = new QuorumPolicy(2, 3);

    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        executor = Executors.newCachedThreadPool();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Nested
    @DisplayName("Quorum decisions")
    class Decisions {

        @Test
        @DisplayName("two confirmations decide a 2-of-3 quorum while the third is still pending")
        void partialConfirmation() {
            List<ChainTarget> targets = List.of(
                    target("chainA", ScriptedLedgerGateway.confirmedAt(100, 3)),
                    target("chainB", new ScriptedLedgerGateway()
                            .then(TransactionStatus.included(200, 1))
                            .then(TransactionStatus.included(200, 3))),
                    target("chainC", ScriptedLedgerGateway.alwaysPending(300)));

            TrackingResult result = tracker(Duration.ofSeconds(10)).track(targets, RELAYS, TWO_OF_THREE, new CancellationSignal());

            assertThat(result.status()).isEqualTo(AggregateStatus.CONFIRMED);
            assertThat(result.cutoff()).isFalse();
            assertThat(result.failure()).isNull();
            assertThat(result.confirmations()).containsOnlyKeys("chainA", "chainB", "chainC");
            assertThat(result.confirmations().get("chainC").status()).isNotEqualTo(ConfirmationStatus.CONFIRMED);
            assertThat(result.confirmations().get("chainC").detail()).contains("aggregate status was decided");
        }

        @Test
        @DisplayName("two failures make a 2-of-3 quorum unreachable before the third resolves")
        void quorumUnreachable() {
            List<ChainTarget> targets = List.of(
                    target("chainA", new ScriptedLedgerGateway().then(TransactionStatus.reverted(100, 5))),
                    target("chainB", ScriptedLedgerGateway.failingWith(new ExternalServiceException("chainB", "bad request"))),
                    target("chainC", ScriptedLedgerGateway.alwaysPending(300)));

            TrackingResult result = tracker(Duration.ofSeconds(10)).track(targets, RELAYS, TWO_OF_THREE, new CancellationSignal());

            assertThat(result.status()).isEqualTo(AggregateStatus.FAILED);
            assertThat(result.cutoff()).isFalse();
            assertThat(result.failure().kind()).isEqualTo(ErrorKind.QUORUM_UNREACHABLE);
            assertThat(result.confirmations().get("chainA").detail()).isEqualTo("Transaction reverted");
            assertThat(result.confirmations().get("chainB").detail()).contains("bad request");
            assertThat(result.confirmations().get("chainC").status().isTerminal()).isFalse();
        }

        @Test
        @DisplayName("a ledger whose call hangs does not hold up the others")
        void hangingLedger() {
            LedgerGateway hanging = transactionRef -> {
                try {
                    Thread.sleep(10_000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return TransactionStatus.notFound();
            };
            List<ChainTarget> targets = List.of(
                    target("chainA", ScriptedLedgerGateway.confirmedAt(100, 3)),
                    target("chainB", ScriptedLedgerGateway.confirmedAt(200, 4)),
                    target("chainC", hanging));

            long started = System.nanoTime();
            TrackingResult result = tracker(Duration.ofSeconds(10)).track(targets, RELAYS, TWO_OF_THREE, new CancellationSignal());

            assertThat(result.status()).isEqualTo(AggregateStatus.CONFIRMED);
            assertThat(Duration.ofNanos(System.nanoTime() - started)).isLessThan(Duration.ofSeconds(5));
            assertThat(result.confirmations().get("chainC").status()).isEqualTo(ConfirmationStatus.UNCONFIRMED);
        }

        @Test
        @DisplayName("the deadline leaves the aggregate PENDING with a TIMEOUT failure")
        void deadline() {
            List<ChainTarget> targets = List.of(
                    target("chainA", ScriptedLedgerGateway.confirmedAt(100, 3)),
                    target("chainB", ScriptedLedgerGateway.alwaysPending(200)),
                    target("chainC", ScriptedLedgerGateway.alwaysPending(300)));

            TrackingResult result = tracker(Duration.ofMillis(300)).track(targets, RELAYS, TWO_OF_THREE, new CancellationSignal());

            assertThat(result.status()).isEqualTo(AggregateStatus.PENDING);
            assertThat(result.cutoff()).isTrue();
            assertThat(result.failure().kind()).isEqualTo(ErrorKind.TIMEOUT);
            assertThat(result.confirmations().get("chainA").isConfirmed()).isTrue();
            assertThat(result.confirmations().get("chainB").status()).isEqualTo(ConfirmationStatus.PENDING);
            assertThat(result.confirmations().get("chainB").detail()).contains("deadline");
        }
    }

    @Nested
    @DisplayName("Per-ledger failures")
    class LedgerFailures {

        @Test
        @DisplayName("a ledger without a relay transaction fails immediately")
        void missingRelay() {
            TrackingResult result = tracker(Duration.ofSeconds(5)).track(
                    List.of(target("chainA", ScriptedLedgerGateway.confirmedAt(1, 3))), Map.of(),
                    QuorumPolicy.majorityOf(1), new CancellationSignal());

            assertThat(result.status()).isEqualTo(AggregateStatus.FAILED);
            assertThat(result.confirmations().get("chainA").detail()).contains("no relay transaction");
        }

        @Test
        @DisplayName("a transaction never seen fails after the grace period")
        void notFoundAfterGrace() {
            ChainTarget target = new ChainTarget("chainA", new ScriptedLedgerGateway(), 3,
                    Duration.ofMillis(50), Duration.ofMillis(10));

            TrackingResult result = tracker(Duration.ofSeconds(5)).track(List.of(target), RELAYS,
                    QuorumPolicy.majorityOf(1), new CancellationSignal());

            assertThat(result.status()).isEqualTo(AggregateStatus.FAILED);
            assertThat(result.confirmations().get("chainA").detail()).contains("grace period");
        }

        @Test
        @DisplayName("a transaction that disappears after inclusion counts as reorganized")
        void reorganized() {
            ScriptedLedgerGateway gateway = new ScriptedLedgerGateway()
                    .then(TransactionStatus.included(100, 1))
                    .then(TransactionStatus.notFound());

            TrackingResult result = tracker(Duration.ofSeconds(5)).track(List.of(target("chainA", gateway)), RELAYS,
                    QuorumPolicy.majorityOf(1), new CancellationSignal());

            assertThat(result.status()).isEqualTo(AggregateStatus.FAILED);
            assertThat(result.confirmations().get("chainA").detail()).contains("reorganized");
        }

        @Test
        @DisplayName("transient errors are retried until the budget runs out")
        void retryBudget() {
            ScriptedLedgerGateway flaky = new ScriptedLedgerGateway()
                    .thenFail(new TransientNetworkException("connection reset"))
                    .thenFail(new TransientNetworkException("connection reset"))
                    .then(TransactionStatus.included(100, 3));
            ScriptedLedgerGateway dead = ScriptedLedgerGateway.failingWith(new TransientNetworkException("connection refused"));

            TrackingResult recovered = tracker(Duration.ofSeconds(5)).track(List.of(target("chainA", flaky)), RELAYS,
                    QuorumPolicy.majorityOf(1), new CancellationSignal());
            TrackingResult exhausted = tracker(Duration.ofSeconds(5)).track(List.of(target("chainA", dead)), RELAYS,
                    QuorumPolicy.majorityOf(1), new CancellationSignal());

            assertThat(recovered.status()).isEqualTo(AggregateStatus.CONFIRMED);
            assertThat(flaky.calls()).isEqualTo(3);
            assertThat(exhausted.status()).isEqualTo(AggregateStatus.FAILED);
            assertThat(exhausted.confirmations().get("chainA").detail()).contains("unreachable after 3 attempts");
        }

        @Test
        @DisplayName("an overloaded endpoint recovers once it answers again")
        void overloadedThenConfirmed() {
            ScriptedLedgerGateway gateway = new ScriptedLedgerGateway()
                    .thenFail(new TransientNetworkException("RPC call to chainA failed: Invalid response received: 503; busy"))
                    .then(TransactionStatus.included(100, 3));

            TrackingResult result = tracker(Duration.ofSeconds(5)).track(List.of(target("chainA", gateway)), RELAYS,
                    QuorumPolicy.majorityOf(1), new CancellationSignal());

            assertThat(result.status()).isEqualTo(AggregateStatus.CONFIRMED);
            assertThat(gateway.calls()).isGreaterThanOrEqualTo(2);
        }

        @Test
        @DisplayName("an unexpected gateway error fails the ledger at once with the cause")
        void unexpectedError() {
            ScriptedLedgerGateway broken = ScriptedLedgerGateway.failingWith(new IllegalStateException("decoder blew up"));
            long started = System.nanoTime();

            TrackingResult result = tracker(Duration.ofSeconds(5)).track(List.of(target("chainA", broken)), RELAYS,
                    QuorumPolicy.majorityOf(1), new CancellationSignal());

            assertThat(result.status()).isEqualTo(AggregateStatus.FAILED);
            assertThat(result.confirmations().get("chainA").detail())
                    .contains("failed unexpectedly")
                    .contains("decoder blew up");
            assertThat(broken.calls()).isEqualTo(1);
            assertThat(Duration.ofNanos(System.nanoTime() - started)).isLessThan(Duration.ofSeconds(4));
        }
    }

    @Nested
    @DisplayName("Signals")
    class Signals {

        @Test
        @DisplayName("cancellation stops tracking with a CANCELLED failure")
        void cancellation() throws Exception {
            ScriptedLedgerGateway gateway = ScriptedLedgerGateway.alwaysPending(100);
            ChainTarget slow = new ChainTarget("chainA", gateway, 3, Duration.ofMinutes(5), Duration.ofSeconds(30));
            ConfirmationTracker tracker = tracker(Duration.ofMinutes(5));
            CancellationSignal cancellation = new CancellationSignal();

            Future<TrackingResult> running = executor.submit(() ->
                    tracker.track(List.of(slow), RELAYS, QuorumPolicy.majorityOf(1), cancellation));
            Await.until(() -> gateway.calls() >= 1, Duration.ofSeconds(5));
            cancellation.cancel();

            TrackingResult result = running.get(5, TimeUnit.SECONDS);
            assertThat(result.cutoff()).isTrue();
            assertThat(result.status()).isEqualTo(AggregateStatus.PENDING);
            assertThat(result.failure().kind()).isEqualTo(ErrorKind.CANCELLED);
            assertThat(result.confirmations().get("chainA").detail()).contains("cancelled");
        }

        @Test
        @DisplayName("a new-block notification makes the ledger poll early")
        void notifyUpdate() throws Exception {
            ScriptedLedgerGateway gateway = new ScriptedLedgerGateway()
                    .then(TransactionStatus.included(100, 1))
                    .then(TransactionStatus.included(100, 3));
            ChainTarget slow = new ChainTarget("chainA", gateway, 3, Duration.ofMinutes(5), Duration.ofSeconds(30));
            ConfirmationTracker tracker = tracker(Duration.ofMinutes(5));

            Future<TrackingResult> running = executor.submit(() ->
                    tracker.track(List.of(slow), RELAYS, QuorumPolicy.majorityOf(1), new CancellationSignal()));
            Await.until(() -> gateway.calls() >= 1, Duration.ofSeconds(5));
            tracker.notifyUpdate("chainA");

            assertThat(running.get(5, TimeUnit.SECONDS).status()).isEqualTo(AggregateStatus.CONFIRMED);
        }
    }

    @Test
    @DisplayName("the quorum must match the configured ledgers")
    void validatesArguments() {
        ConfirmationTracker tracker = tracker(Duration.ofSeconds(1));
        ChainTarget a = target("chainA", new ScriptedLedgerGateway());

        assertThatThrownBy(() -> tracker.track(List.of(a), RELAYS, TWO_OF_THREE, new CancellationSignal()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> tracker.track(List.of(a, a), RELAYS, QuorumPolicy.majorityOf(2), new CancellationSignal()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Duplicate");
        assertThatThrownBy(() -> tracker.track(List.of(), RELAYS, TWO_OF_THREE, new CancellationSignal()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private ConfirmationTracker tracker(Duration ceiling) {
        return new ConfirmationTracker(executor, new TimedCall(executor), new RetryPolicy(5, 20, 0.0, 3),
                Duration.ofMillis(200), ceiling, Clock.systemUTC());
    }

    private static ChainTarget target(String chainId, LedgerGateway gateway) {
        return new ChainTarget(chainId, gateway, 3, Duration.ofMinutes(1), Duration.ofMillis(10));
    }
}
