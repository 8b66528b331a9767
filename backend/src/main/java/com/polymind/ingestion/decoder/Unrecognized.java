package com.polymind.ingestion.decoder;

/**
 * Log whose topic0 is not a known event. Ignored, not an error.
 */
public record Unrecognized(long blockNumber, int logIndex, String transactionHash, String topic0) implements DomainEvent {

    @Override
    public EventKind kind() {
        return EventKind.UNRECOGNIZED;
    }
}
