package com.project.attest.core;

/**
 * Classification of everything that can go wrong while attesting or verifying.
 *
 * <ul>
 *   <li>{@link #INTEGRITY_FAULT} - non-deterministic hashing or a checksum/digest mismatch. Always fatal.</li>
 *   <li>{@link #TRANSIENT_NETWORK} - timeouts and 5xx responses. Retried with backoff; only surfaced once retries run out.</li>
 *   <li>{@link #VALIDATION} - bad signature, digest mismatch, malformed report. Terminal for the request.</li>
 *   <li>{@link #QUORUM_UNREACHABLE} - too many ledgers failed for the quorum to be met. Still yields a negative artifact.</li>
 *   <li>{@link #TIMEOUT} - the wall-clock ceiling of the request was exceeded.</li>
 *   <li>{@link #CANCELLED} - the caller cancelled the request.</li>
 * </ul>
 */
public enum ErrorKind {
    INTEGRITY_FAULT,
    TRANSIENT_NETWORK,
    VALIDATION,
    QUORUM_UNREACHABLE,
    TIMEOUT,
    CANCELLED
}
