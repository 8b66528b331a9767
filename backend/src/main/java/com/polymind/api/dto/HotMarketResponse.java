package com.polymind.api.dto;

import java.math.BigDecimal;
import java.util.List;

public record HotMarketResponse(
        String conditionId,
        String slug,
        String question,
        long windowTrades,
        BigDecimal windowVolume,
        List<BigDecimal> lastPrices,
        boolean resolved
) {
}
