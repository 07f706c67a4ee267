package com.kura.search.error;

/**
 * Base class of every error a search caller can observe. Messages are
 * caller-safe: they never carry provider secrets or backend payloads.
 */
public abstract class SearchException extends RuntimeException {

    private final ErrorCode code;
    private final boolean retryable;

    protected SearchException(ErrorCode code, String message, boolean retryable) {
        super(message);
        this.code = code;
        this.retryable = retryable;
    }

    protected SearchException(ErrorCode code, String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.retryable = retryable;
    }

    public ErrorCode getCode() {
        return code;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
