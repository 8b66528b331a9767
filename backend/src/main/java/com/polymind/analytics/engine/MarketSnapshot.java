package com.polymind.analytics.engine;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Collections;
import java.util.List;

/**
 * Price state of one market as of the latest applied trade.
 */
public record MarketSnapshot(
        String conditionId,
        int outcomeCount,
        List<BigDecimal> lastPrices,
        long tradeCount,
        BigDecimal volume,
        Instant lastTradeAt,
        boolean resolved,
        Integer winningOutcomeIndex
) {

    public MarketSnapshot {
        lastPrices = Collections.unmodifiableList(lastPrices);
    }
}
