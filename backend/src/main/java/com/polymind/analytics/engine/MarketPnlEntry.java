package com.polymind.analytics.engine;

import java.math.BigDecimal;

/**
 * One address's profit and loss across the outcomes of a single market, in collateral.
 */
public record MarketPnlEntry(String address, BigDecimal realizedPnl, BigDecimal unrealizedPnl, BigDecimal totalPnl,
                             long tradeCount) {
}
