package com.polymind.domain;

/**
 * Ingestion bookmark: last fully applied block and the last log index seen in it (-1 when the block had none).
 */
public record IndexCursor(long block, int logIndex) implements Comparable<IndexCursor> {

    public static IndexCursor beforeBlock(long block) {
        return new IndexCursor(block - 1, -1);
    }

    @Override
    public int compareTo(IndexCursor other) {
        int byBlock = Long.compare(block, other.block);
        return byBlock != 0 ? byBlock : Integer.compare(logIndex, other.logIndex);
    }
}
