package com.polymind.analytics.engine;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.List;

/**
 * Market activity inside a trailing window. {@code lastPrices} entries are null for untraded outcomes.
 */
public record HotMarket(String conditionId, long windowTrades, BigDecimal windowVolume, List<BigDecimal> lastPrices,
                        boolean resolved) {

    public HotMarket {
        lastPrices = Collections.unmodifiableList(lastPrices);
    }
}
