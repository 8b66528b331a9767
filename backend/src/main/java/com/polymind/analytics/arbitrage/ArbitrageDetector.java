package com.polymind.analytics.arbitrage;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * Sum-of-prices check over one market's latest outcome prices.
 */
public class ArbitrageDetector {

    private final BigDecimal threshold;
    private final BigDecimal highConfidenceThreshold;

    public ArbitrageDetector(BigDecimal threshold, BigDecimal highConfidenceThreshold) {
        if (threshold == null || threshold.signum() < 0) {
            throw new IllegalArgumentException("threshold must be >= 0");
        }
        this.threshold = threshold;
        this.highConfidenceThreshold = highConfidenceThreshold != null ? highConfidenceThreshold : threshold;
    }

    /**
     * Opportunity iff the market has at least two outcomes, every outcome has a price,
     * and |1 - sum| is strictly greater than the threshold.
     */
    public Optional<ArbitrageOpportunity> detect(String conditionId, List<BigDecimal> outcomePrices) {
        if (outcomePrices == null || outcomePrices.size() < 2) {
            return Optional.empty();
        }
        BigDecimal sum = BigDecimal.ZERO;
        for (BigDecimal price : outcomePrices) {
            if (price == null) {
                return Optional.empty();
            }
            sum = sum.add(price);
        }
        BigDecimal deviation = sum.subtract(BigDecimal.ONE);
        BigDecimal magnitude = deviation.abs();
        if (magnitude.compareTo(threshold) <= 0) {
            return Optional.empty();
        }
        ArbitrageDirection direction = deviation.signum() > 0 ? ArbitrageDirection.SELL_ALL : ArbitrageDirection.BUY_ALL;
        ArbitrageConfidence confidence = magnitude.compareTo(highConfidenceThreshold) > 0
                ? ArbitrageConfidence.HIGH
                : ArbitrageConfidence.MEDIUM;
        return Optional.of(new ArbitrageOpportunity(conditionId, outcomePrices, sum, magnitude, direction, confidence));
    }
}
