package com.polymind.analytics.profile;

import com.polymind.domain.TradeSide;

import java.math.BigDecimal;

/**
 * A non-flat position in a market that has not resolved yet: BUY when long, SELL when short, entered at its
 * average cost and marked at the outcome's latest price.
 */
public record OpenPosition(TradeSide side, BigDecimal entryPrice, BigDecimal markPrice) {
}
