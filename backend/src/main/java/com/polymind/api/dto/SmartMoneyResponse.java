package com.polymind.api.dto;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

public record SmartMoneyResponse(int windowHours, Instant asOf, List<Entry> entries) {

    public record Entry(int rank, String address, BigDecimal score, BigDecimal winRate, BigDecimal windowVolume,
                        long windowTrades, Instant lastTradeAt) {
    }
}
