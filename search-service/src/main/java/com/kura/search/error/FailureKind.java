package com.kura.search.error;

import java.util.Locale;

public enum FailureKind {
    TIMEOUT(true),
    RATE_LIMITED(true),
    AUTH_FAILED(false),
    UNAVAILABLE(true);

    private final boolean transientFailure;

    FailureKind(boolean transientFailure) {
        this.transientFailure = transientFailure;
    }

    /**
     * Whether an adapter may retry the call after backoff.
     */
    public boolean isTransient() {
        return transientFailure;
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
