package com.polymind.analytics.engine;

import java.math.BigDecimal;
import java.time.Instant;

record PriceTick(ChainPosition position, int outcomeIndex, BigDecimal price, BigDecimal notional, Instant timestamp) {
}
