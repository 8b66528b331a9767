package com.polymind.analytics.profile;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Point-in-time view of one address's fills. Volumes and P&L are in collateral (USDC); {@code estimatedWinRate} is in
 * [0, 1] and null until the configured {@link WinRatePolicy} can judge at least one fill.
 * <p>
 * P&L is average-cost per outcome token: a sell realizes against the average cost of the held size, resolution
 * redeems what is still open at 1 or 0, and open positions are marked at the outcome's last price.
 * {@code openPositions} lists the largest open exposures first.
 */
public record TraderProfile(
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
        List<PositionSummary> openPositions
) {

    public TraderProfile {
        topMarkets = topMarkets == null ? List.of() : List.copyOf(topMarkets);
        openPositions = openPositions == null ? List.of() : List.copyOf(openPositions);
    }

    /** Fills per active day; 0 without dated fills. */
    public double tradesPerActiveDay() {
        return activeDays == 0 ? 0.0 : (double) tradeCount / activeDays;
    }
}
