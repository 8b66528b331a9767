package com.polymind.analytics.smartmoney;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Window aggregates of one address before scoring. {@code winRate} is 0 when unknown.
 */
public record SmartMoneyCandidate(
        String address,
        BigDecimal winRate,
        BigDecimal windowVolume,
        long windowTrades,
        Instant lastTradeAt
) {
}
