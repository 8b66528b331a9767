package com.polymind.ingestion.indexer;

/**
 * @param lastLogIndexInEndBlock highest log index seen in the range's last block, or -1
 */
public record BatchResult(int logs, int applied, int decodeFailures, int lastLogIndexInEndBlock) {
}
