package com.polymind.api.dto;

import java.math.BigDecimal;

/**
 * GET /markets/{conditionId}/pnl leaderboard row, best total first.
 */
public record MarketPnlResponse(
        int rank,
        String address,
        BigDecimal realizedPnl,
        BigDecimal unrealizedPnl,
        BigDecimal totalPnl,
        long tradeCount
) {
}
