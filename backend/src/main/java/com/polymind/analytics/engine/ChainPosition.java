package com.polymind.analytics.engine;

/**
 * (block, logIndex) ordering of applied events.
 */
record ChainPosition(long block, int logIndex) implements Comparable<ChainPosition> {

    @Override
    public int compareTo(ChainPosition other) {
        int byBlock = Long.compare(block, other.block);
        return byBlock != 0 ? byBlock : Integer.compare(logIndex, other.logIndex);
    }
}
