package com.polymind.ingestion.indexer;

public enum IndexerState {
    IDLE,
    FETCHING,
    APPLYING,
    BACKOFF,
    /** Halted on a non-retryable fetch failure or on shutdown. */
    STOPPED
}
