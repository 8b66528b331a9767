package com.polymind.api.dto;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * GET /traders/{address}. estimatedWinRate is null until at least one fill can be judged. P&L is in USDC.
 */
public record TraderProfileResponse(
        String address,
        long tradeCount,
        long buyCount,
        long sellCount,
        BigDecimal buyVolume,
        BigDecimal sellVolume,
        BigDecimal totalVolume,
        int distinctMarkets,
        long wonCount,
        long lostCount,
        long openPositionCount,
        BigDecimal estimatedWinRate,
        BigDecimal averagePrice,
        BigDecimal averageNotional,
        Instant firstTradeAt,
        Instant lastTradeAt,
        int activeDays,
        List<String> topMarkets,
        BigDecimal realizedPnl,
        BigDecimal unrealizedPnl,
        BigDecimal totalPnl,
        List<Position> openPositions,
        List<String> labels,
        String tradingStyle,
        String riskLevel
) {

    public record Position(String marketId, int outcomeIndex, BigDecimal netSize, BigDecimal averageCost,
                           BigDecimal markPrice, BigDecimal unrealizedPnl) {
    }
}
