package com.polymind.ingestion.adapter;

/**
 * Raised by {@link ChainLogSource} when a fetch fails. The failure kind drives indexer backoff or halt.
 */
public class ChainFetchException extends RuntimeException {

    private final FetchFailure failure;

    public ChainFetchException(FetchFailure failure, String message) {
        super(message);
        this.failure = failure;
    }

    public ChainFetchException(FetchFailure failure, String message, Throwable cause) {
        super(message, cause);
        this.failure = failure;
    }

    public FetchFailure getFailure() {
        return failure;
    }

    public boolean isRetryable() {
        return failure.isRetryable();
    }
}
