package com.polymind.ingestion.adapter;

import java.time.Instant;
import java.util.List;

/**
 * Source of contract logs for the indexer. Implementations throw {@link ChainFetchException} on failure.
 */
public interface ChainLogSource {

    /**
     * Logs of the watched contracts in [fromBlock, toBlock], ordered by (block, logIndex).
     */
    List<RawLog> fetchLogs(long fromBlock, long toBlock);

    long headBlock();

    Instant blockTimestamp(long blockNumber);
}
