package com.polymind.api.dto;

import java.time.Instant;

/**
 * Engine totals next to stored ledger totals; they match once replay and indexing have caught up.
 */
public record StatsResponse(
        int markets,
        long resolvedMarkets,
        long trades,
        int traders,
        long skippedEvents,
        Instant latestTradeAt,
        long storedMarkets,
        long storedResolvedMarkets,
        long storedTrades,
        int registeredTokens,
        String indexerState,
        long indexerLag
) {
}
