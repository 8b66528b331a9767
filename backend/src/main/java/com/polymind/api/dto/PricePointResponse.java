package com.polymind.api.dto;

import java.math.BigDecimal;
import java.time.Instant;

public record PricePointResponse(long blockNumber, int logIndex, int outcomeIndex, BigDecimal price, BigDecimal size,
                                 Instant timestamp) {
}
