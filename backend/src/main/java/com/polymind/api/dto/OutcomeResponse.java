package com.polymind.api.dto;

import java.math.BigDecimal;

public record OutcomeResponse(int outcomeIndex, String label, String tokenId, BigDecimal lastPrice) {
}
