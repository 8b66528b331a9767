package com.polymind.analytics.smartmoney;

import java.math.BigDecimal;
import java.time.Instant;

public record SmartMoneyEntry(
        String address,
        BigDecimal score,
        BigDecimal winRate,
        BigDecimal windowVolume,
        long windowTrades,
        Instant lastTradeAt
) {
}
