package com.polymind.api.dto;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Market with its live price state. Prices are null for outcomes that never traded.
 */
public record MarketResponse(
        String conditionId,
        String slug,
        String question,
        String status,
        Integer winningOutcomeIndex,
        List<OutcomeResponse> outcomes,
        long tradeCount,
        BigDecimal volume,
        Instant lastTradeAt,
        long createdBlock,
        Instant createdAt,
        Long resolvedBlock
) {
}
