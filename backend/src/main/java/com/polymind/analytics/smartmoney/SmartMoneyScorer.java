package com.polymind.analytics.smartmoney;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;

/**
 * Composite score = wWin * winRate + wVolume * (volume / maxVolume) + wRecency * recency,
 * recency = 1 - age / window clamped to [0, 1]. Order: score desc, window volume desc, address asc.
 */
public class SmartMoneyScorer {

    public static final int SCALE = 6;
    private static final RoundingMode ROUNDING = RoundingMode.HALF_UP;

    static final Comparator<SmartMoneyEntry> RANKING = Comparator
            .comparing(SmartMoneyEntry::score, Comparator.reverseOrder())
            .thenComparing(SmartMoneyEntry::windowVolume, Comparator.reverseOrder())
            .thenComparing(SmartMoneyEntry::address);

    private final BigDecimal winRateWeight;
    private final BigDecimal volumeWeight;
    private final BigDecimal recencyWeight;

    public SmartMoneyScorer(BigDecimal winRateWeight, BigDecimal volumeWeight, BigDecimal recencyWeight) {
        this.winRateWeight = winRateWeight;
        this.volumeWeight = volumeWeight;
        this.recencyWeight = recencyWeight;
    }

    public List<SmartMoneyEntry> rank(List<SmartMoneyCandidate> candidates, Instant asOf, Duration window, int limit) {
        if (candidates.isEmpty() || limit <= 0) {
            return List.of();
        }
        BigDecimal maxVolume = candidates.stream()
                .map(SmartMoneyCandidate::windowVolume)
                .max(Comparator.naturalOrder())
                .orElse(BigDecimal.ZERO);
        return candidates.stream()
                .map(c -> score(c, maxVolume, asOf, window))
                .sorted(RANKING)
                .limit(limit)
                .toList();
    }

    private SmartMoneyEntry score(SmartMoneyCandidate c, BigDecimal maxVolume, Instant asOf, Duration window) {
        BigDecimal normalizedVolume = maxVolume.signum() == 0
                ? BigDecimal.ZERO
                : c.windowVolume().divide(maxVolume, SCALE, ROUNDING);
        BigDecimal winRate = c.winRate() != null ? c.winRate() : BigDecimal.ZERO;
        BigDecimal score = winRateWeight.multiply(winRate)
                .add(volumeWeight.multiply(normalizedVolume))
                .add(recencyWeight.multiply(recency(c.lastTradeAt(), asOf, window)))
                .setScale(SCALE, ROUNDING);
        return new SmartMoneyEntry(c.address(), score, winRate, c.windowVolume(), c.windowTrades(), c.lastTradeAt());
    }

    static BigDecimal recency(Instant lastTradeAt, Instant asOf, Duration window) {
        if (lastTradeAt == null || window.isZero() || window.isNegative()) {
            return BigDecimal.ZERO;
        }
        long ageMs = Math.max(0L, Duration.between(lastTradeAt, asOf).toMillis());
        long windowMs = window.toMillis();
        if (ageMs >= windowMs) {
            return BigDecimal.ZERO;
        }
        return BigDecimal.ONE.subtract(BigDecimal.valueOf(ageMs).divide(BigDecimal.valueOf(windowMs), SCALE, ROUNDING));
    }
}
