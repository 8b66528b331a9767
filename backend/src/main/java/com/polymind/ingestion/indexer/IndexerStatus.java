package com.polymind.ingestion.indexer;

import java.time.Instant;
import java.util.Map;

/**
 * Read-only snapshot of the indexer. Cursor and head are -1 until known; lag is head - cursor block.
 */
public record IndexerStatus(
        IndexerState state,
        long cursorBlock,
        int cursorLogIndex,
        long headBlock,
        long lag,
        int consecutiveFailures,
        long pollIntervalMs,
        Map<String, Long> counters,
        String lastError,
        String haltReason,
        Instant lastCommittedAt
) {

    public IndexerStatus {
        counters = Map.copyOf(counters);
    }
}
