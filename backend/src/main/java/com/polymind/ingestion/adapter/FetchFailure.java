package com.polymind.ingestion.adapter;

/**
 * Failure kinds of a chain fetch. TIMEOUT and RATE_LIMITED are transient; INVALID is not.
 */
public enum FetchFailure {
    TIMEOUT(true),
    RATE_LIMITED(true),
    INVALID(false);

    private final boolean retryable;

    FetchFailure(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
