package com.polymind.api.dto;

import java.math.BigDecimal;
import java.time.Instant;

public record TradeResponse(
        String id,
        String txHash,
        int logIndex,
        long blockNumber,
        String marketId,
        int outcomeIndex,
        String tokenId,
        String side,
        String maker,
        String taker,
        BigDecimal price,
        BigDecimal size,
        BigDecimal notional,
        BigDecimal fee,
        Instant timestamp
) {
}
