package com.polymind.analytics.profile;

import java.math.BigDecimal;

/**
 * An open average-cost position in one outcome of an unresolved market. {@code netSize} is negative for a short;
 * {@code markPrice} is the outcome's last traded price.
 */
public record PositionSummary(
        String marketId,
        int outcomeIndex,
        BigDecimal netSize,
        BigDecimal averageCost,
        BigDecimal markPrice,
        BigDecimal unrealizedPnl
) {
}
