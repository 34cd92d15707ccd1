package com.project.attest.core;

/**
 * A payload received at the boundary (oracle report, serialized artifact) is malformed.
 */
public class ReportValidationException extends RuntimeException {

    private final String field;

    public ReportValidationException(String field, String message) {
        super(message + " (field: " + field + ")");
        this.field = field;
    }

    public ReportValidationException(String field, String message, Throwable cause) {
        super(message + " (field: " + field + ")", cause);
        this.field = field;
    }

    public String field() {
        return field;
    }
}
