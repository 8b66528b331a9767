package com.polymind.analytics.engine;

import java.time.Instant;

public record EngineStats(
        int markets,
        long resolvedMarkets,
        long trades,
        int traders,
        long skippedEvents,
        Instant latestTradeAt
) {
}
