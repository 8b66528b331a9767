package com.polymind.analytics.profile;

import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Scores ticket size, concentration, extreme prices and frequency into a {@link RiskLevel}.
 */
@Component
public class RiskAssessor {

    private static final BigDecimal BIG_TICKET = new BigDecimal("1000");
    private static final BigDecimal MID_TICKET = new BigDecimal("500");
    private static final BigDecimal EXTREME_LOW = new BigDecimal("0.1");
    private static final BigDecimal EXTREME_HIGH = new BigDecimal("0.9");

    public RiskLevel assess(TraderProfile profile) {
        if (profile == null || profile.tradeCount() == 0) {
            return RiskLevel.LOW;
        }
        int score = 0;
        if (profile.averageNotional().compareTo(BIG_TICKET) > 0) {
            score += 2;
        } else if (profile.averageNotional().compareTo(MID_TICKET) > 0) {
            score += 1;
        }
        if (profile.distinctMarkets() <= 2) {
            score += 2;
        } else if (profile.distinctMarkets() <= 4) {
            score += 1;
        }
        if (profile.averagePrice().compareTo(EXTREME_LOW) < 0 || profile.averagePrice().compareTo(EXTREME_HIGH) > 0) {
            score += 2;
        }
        if (profile.tradesPerActiveDay() > 10.0) {
            score += 1;
        }
        if (score >= 5) {
            return RiskLevel.HIGH;
        }
        if (score >= 3) {
            return RiskLevel.MEDIUM_HIGH;
        }
        return score >= 1 ? RiskLevel.MEDIUM : RiskLevel.LOW;
    }
}
