package com.polymind.ingestion.adapter;

import java.time.Instant;
import java.util.List;

/**
 * Undecoded EVM log as returned by eth_getLogs. Topics and data are 0x-prefixed hex.
 * {@code blockTimestamp} is null until resolved.
 */
public record RawLog(
        String address,
        List<String> topics,
        String data,
        long blockNumber,
        int logIndex,
        String transactionHash,
        Instant blockTimestamp
) {

    public RawLog {
        topics = topics == null ? List.of() : List.copyOf(topics);
    }

    /** Topic at position i, or null if absent. */
    public String topic(int i) {
        return i < topics.size() ? topics.get(i) : null;
    }

    public RawLog withBlockTimestamp(Instant timestamp) {
        return new RawLog(address, topics, data, blockNumber, logIndex, transactionHash, timestamp);
    }
}
