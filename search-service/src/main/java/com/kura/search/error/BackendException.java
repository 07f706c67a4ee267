package com.kura.search.error;

/**
 * A single external collaborator failed. Absorbed by the orchestrator, which
 * degrades to the remaining backend; never surfaced to search callers.
 */
public class BackendException extends RuntimeException {

    private final Backend backend;
    private final FailureKind kind;

    public BackendException(Backend backend, FailureKind kind, String message) {
        super(message);
        this.backend = backend;
        this.kind = kind;
    }

    public BackendException(Backend backend, FailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.backend = backend;
        this.kind = kind;
    }

    public Backend getBackend() {
        return backend;
    }

    public FailureKind getKind() {
        return kind;
    }
}
