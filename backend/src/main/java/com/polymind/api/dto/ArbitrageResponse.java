package com.polymind.api.dto;

import java.math.BigDecimal;
import java.util.List;

public record ArbitrageResponse(
        String conditionId,
        String slug,
        List<BigDecimal> outcomePrices,
        BigDecimal priceSum,
        BigDecimal magnitude,
        String direction,
        String confidence
) {
}
