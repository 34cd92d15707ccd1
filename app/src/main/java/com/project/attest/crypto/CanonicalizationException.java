package com.project.attest.crypto;

/**
 * Metadata cannot be expressed canonically. The JSON path of the offending value is included so
 * the analysis collaborator can fix its output; nothing is ever hashed from a partial tree.
 */
public class CanonicalizationException extends IllegalArgumentException {

    private final String path;

    public CanonicalizationException(String path, String message) {
        super(message + " at " + path);
        this.path = path;
    }

    public CanonicalizationException(String path, String message, Throwable cause) {
        super(message + " at " + path, cause);
        this.path = path;
    }

    public String path() {
        return path;
    }
}
