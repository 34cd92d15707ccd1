package com.project.attest.oracle;

import com.project.attest.core.AttestationFailure;
import com.project.attest.crypto.DocumentId;
import com.project.attest.io.ContentLocator;
import com.project.attest.net.PollTrigger;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * One attestation request and its state. Only the {@link OracleClient} routine that owns the
 * request writes to it; everyone else reads.
 */
public final class AttestationRequest {

    private final DocumentId documentId;
    private final ContentLocator locator;
    private final Instant createdAt;
    private final PollTrigger pollTrigger = new PollTrigger();

    private volatile RequestState state = RequestState.CREATED;
    private volatile String requestId;
    private volatile Instant submittedAt;
    private volatile OracleReport report;
    private volatile AttestationFailure failure;
    private volatile List<String> warnings = List.of();

    AttestationRequest(DocumentId documentId, ContentLocator locator, Instant createdAt) {
        this.documentId = Objects.requireNonNull(documentId, "documentId must not be null");
        this.locator = Objects.requireNonNull(locator, "locator must not be null");
        this.createdAt = createdAt;
    }

    void markSubmitted(String assignedId, Instant at) {
        requireState(RequestState.CREATED);
        this.requestId = assignedId;
        this.submittedAt = at;
        this.state = RequestState.SUBMITTED;
    }

    void markPolling() {
        if (state == RequestState.SUBMITTED) {
            state = RequestState.POLLING;
        }
    }

    void finalizeWith(OracleReport accepted, List<String> reportWarnings) {
        if (state.isTerminal()) {
            return;
        }
        this.report = accepted;
        this.warnings = List.copyOf(reportWarnings);
        this.state = RequestState.FINALIZED;
    }

    void terminate(RequestState terminal, AttestationFailure reason) {
        if (!terminal.isTerminal() || terminal == RequestState.FINALIZED) {
            throw new IllegalArgumentException("Not a failure state: " + terminal);
        }
        if (state.isTerminal()) {
            return;
        }
        this.failure = reason;
        this.state = terminal;
    }

    public DocumentId documentId() {
        return documentId;
    }

    public ContentLocator locator() {
        return locator;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant submittedAt() {
        return submittedAt;
    }

    public RequestState state() {
        return state;
    }

    public String requestId() {
        return requestId;
    }

    PollTrigger pollTrigger() {
        return pollTrigger;
    }

    public OracleOutcome outcome() {
        return new OracleOutcome(state, requestId, report, failure, warnings);
    }

    private void requireState(RequestState expected) {
        if (state != expected) {
            throw new IllegalStateException("Request is " + state + ", expected " + expected);
        }
    }
}
