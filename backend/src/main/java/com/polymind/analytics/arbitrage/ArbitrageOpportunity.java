package com.polymind.analytics.arbitrage;

import java.math.BigDecimal;
import java.util.List;

/**
 * Mispricing of a market's outcome set: {@code magnitude = |1 - priceSum|}.
 */
public record ArbitrageOpportunity(
        String conditionId,
        List<BigDecimal> outcomePrices,
        BigDecimal priceSum,
        BigDecimal magnitude,
        ArbitrageDirection direction,
        ArbitrageConfidence confidence
) {

    public ArbitrageOpportunity {
        outcomePrices = List.copyOf(outcomePrices);
    }
}
