package com.deploybot.orchestrator.backend;

/**
 * Thrown when a build backend cannot accept a submission or answer a poll.
 *
 * TRANSIENT covers connection-level trouble (I/O errors, timeouts, 5xx):
 * worth another attempt. REJECTED is the backend saying no (unknown job,
 * bad credentials, malformed response): retrying would not help.
 */
public class BackendException extends RuntimeException {

    public enum Kind { TRANSIENT, REJECTED }

    private final Kind kind;

    public BackendException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public BackendException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() { return kind; }

    public boolean isTransient() {
        return kind == Kind.TRANSIENT;
    }

    public static BackendException rejected(String message) {
        return new BackendException(Kind.REJECTED, message);
    }

    public static BackendException transientError(String message, Throwable cause) {
        return new BackendException(Kind.TRANSIENT, message, cause);
    }
}
