package com.project.attest.core;

import com.project.attest.ledger.QuorumPolicy;
import com.project.attest.net.RetryPolicy;
import com.project.attest.oracle.OraclePolicy;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Engine settings, read from environment variables:
 * - ATTEST_ORACLE_URL, ATTEST_ORACLE_AUTH_TOKEN: oracle endpoint and bearer token
 * - ATTEST_ORACLE_POLL_INTERVAL_MS, ATTEST_ORACLE_CEILING_MS: oracle polling
 * - ATTEST_CALL_TIMEOUT_MS: timeout of every single gateway call
 * - ATTEST_STALENESS_WINDOW_S: age after which a report is flagged stale
 * - ATTEST_AUTHORIZED_ORACLE_KEYS: comma-separated oracle signer addresses
 * - ATTEST_QUORUM: ledgers that must confirm, default majority
 * - ATTEST_LEDGER_CEILING_MS: wall-clock ceiling for ledger tracking
 * - ATTEST_RETRY_BASE_MS, ATTEST_RETRY_MAX_ATTEMPTS: backoff for transient errors
 * - ATTEST_CHAINS_DIR, ATTEST_OUTBOX_DIR: ledger definitions and artifact output
 * - IPFS_URL, IPFS_GATEWAY_URL: IPFS content store
 * - ATTEST_CONTENT_DIR: local content store, used when IPFS_URL is not set
 */
public record EngineConfig(
        Optional<String> oracleUrl,
        Optional<String> oracleAuthToken,
        Duration oraclePollInterval,
        Duration oracleCeiling,
        Duration callTimeout,
        Duration stalenessWindow,
        List<String> authorizedOracleKeys,
        OptionalInt quorum,
        Duration ledgerCeiling,
        long retryBaseMillis,
        int retryMaxAttempts,
        Path chainsDirectory,
        Path outboxDirectory,
        Optional<String> ipfsUrl,
        Optional<String> ipfsGatewayUrl,
        Path contentDirectory
) {
    public EngineConfig {
        requirePositive(oraclePollInterval, "oraclePollInterval");
        requirePositive(oracleCeiling, "oracleCeiling");
        requirePositive(callTimeout, "callTimeout");
        requirePositive(stalenessWindow, "stalenessWindow");
        requirePositive(ledgerCeiling, "ledgerCeiling");
        if (retryBaseMillis < 0) {
            throw new IllegalArgumentException("retryBaseMillis must not be negative");
        }
        if (retryMaxAttempts < 1) {
            throw new IllegalArgumentException("retryMaxAttempts must be positive");
        }
        if (quorum.isPresent() && quorum.getAsInt() < 1) {
            throw new IllegalArgumentException("quorum must be positive");
        }
        authorizedOracleKeys = List.copyOf(authorizedOracleKeys);
    }

    public static EngineConfig defaults() {
        return fromEnv(Map.of());
    }

    public static EngineConfig fromEnv() {
        return fromEnv(System.getenv());
    }

    public static EngineConfig fromEnv(Map<String, String> env) {
        return new EngineConfig(
                text(env, "ATTEST_ORACLE_URL"),
                text(env, "ATTEST_ORACLE_AUTH_TOKEN"),
                Duration.ofMillis(parseLong(env, "ATTEST_ORACLE_POLL_INTERVAL_MS", 2_000L)),
                Duration.ofMillis(parseLong(env, "ATTEST_ORACLE_CEILING_MS", 300_000L)),
                Duration.ofMillis(parseLong(env, "ATTEST_CALL_TIMEOUT_MS", 15_000L)),
                Duration.ofSeconds(parseLong(env, "ATTEST_STALENESS_WINDOW_S", 3_600L)),
                text(env, "ATTEST_AUTHORIZED_ORACLE_KEYS")
                        .map(keys -> Arrays.stream(keys.split(","))
                                .map(String::trim)
                                .filter(key -> !key.isEmpty())
                                .toList())
                        .orElse(List.of()),
                text(env, "ATTEST_QUORUM").map(value -> OptionalInt.of(parseInt("ATTEST_QUORUM", value)))
                        .orElse(OptionalInt.empty()),
                Duration.ofMillis(parseLong(env, "ATTEST_LEDGER_CEILING_MS", 600_000L)),
                parseLong(env, "ATTEST_RETRY_BASE_MS", 500L),
                (int) parseLong(env, "ATTEST_RETRY_MAX_ATTEMPTS", 5L),
                Path.of(text(env, "ATTEST_CHAINS_DIR").orElse("chains")),
                Path.of(text(env, "ATTEST_OUTBOX_DIR").orElse("outbox")),
                text(env, "IPFS_URL"),
                text(env, "IPFS_GATEWAY_URL"),
                Path.of(text(env, "ATTEST_CONTENT_DIR").orElse("content"))
        );
    }

    public RetryPolicy retryPolicy() {
        return new RetryPolicy(retryBaseMillis, Math.max(retryBaseMillis, 30_000L), 0.2, retryMaxAttempts);
    }

    public OraclePolicy oraclePolicy() {
        return new OraclePolicy(oraclePollInterval, oracleCeiling, callTimeout, retryPolicy());
    }

    /**
     * The configured quorum for {@code ledgerCount} ledgers, or their majority when none is set.
     */
    public QuorumPolicy quorumFor(int ledgerCount) {
        return quorum.isPresent()
                ? new QuorumPolicy(quorum.getAsInt(), ledgerCount)
                : QuorumPolicy.majorityOf(ledgerCount);
    }

    private static void requirePositive(Duration value, String name) {
        if (value == null || value.isNegative() || value.isZero()) {
            throw new IllegalArgumentException(name + " must be a positive duration");
        }
    }

    private static Optional<String> text(Map<String, String> env, String name) {
        String value = env.get(name);
        return value == null || value.isBlank() ? Optional.empty() : Optional.of(value.trim());
    }

    private static long parseLong(Map<String, String> env, String name, long defaultValue) {
        Optional<String> value = text(env, name);
        if (value.isEmpty()) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.get());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be an integer but was '" + value.get() + "'", e);
        }
    }

    private static int parseInt(String name, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be an integer but was '" + value + "'", e);
        }
    }
}
