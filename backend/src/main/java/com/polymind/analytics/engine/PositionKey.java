package com.polymind.analytics.engine;

import java.util.Comparator;

record PositionKey(String marketId, int outcomeIndex) implements Comparable<PositionKey> {

    private static final Comparator<PositionKey> ORDER = Comparator.comparing(PositionKey::marketId)
            .thenComparingInt(PositionKey::outcomeIndex);

    @Override
    public int compareTo(PositionKey other) {
        return ORDER.compare(this, other);
    }
}
