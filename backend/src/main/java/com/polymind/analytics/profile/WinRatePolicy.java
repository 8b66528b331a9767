package com.polymind.analytics.profile;

import com.polymind.domain.TradeSide;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Optional;

/**
 * How a trader's win rate is estimated. Resolved fills always count by their settled result;
 * policies differ only in what open positions contribute.
 */
public enum WinRatePolicy {

    /** Only settled fills count. */
    RESOLVED_ONLY {
        @Override
        public Optional<BigDecimal> estimate(long won, long lost, List<OpenPosition> openPositions) {
            return ratio(won, won + lost);
        }
    },

    /**
     * Each open position counts as one provisional win or loss by the sign of its mark-to-last-price P&L:
     * a long wins when the last price is above its average cost, a short when it is below. Flat marks are left out.
     */
    MARK_TO_LAST_PRICE {
        @Override
        public Optional<BigDecimal> estimate(long won, long lost, List<OpenPosition> openPositions) {
            long provisionalWon = 0;
            long provisionalLost = 0;
            for (OpenPosition p : openPositions) {
                if (p.markPrice() == null || p.entryPrice() == null) {
                    continue;
                }
                int cmp = p.markPrice().compareTo(p.entryPrice());
                if (cmp == 0) {
                    continue;
                }
                boolean inProfit = p.side() == TradeSide.BUY ? cmp > 0 : cmp < 0;
                if (inProfit) {
                    provisionalWon++;
                } else {
                    provisionalLost++;
                }
            }
            long wins = won + provisionalWon;
            return ratio(wins, wins + lost + provisionalLost);
        }
    };

    public static final int SCALE = 6;

    /**
     * Win rate in [0, 1], or empty when nothing can be judged yet.
     */
    public abstract Optional<BigDecimal> estimate(long won, long lost, List<OpenPosition> openPositions);

    private static Optional<BigDecimal> ratio(long numerator, long denominator) {
        if (denominator <= 0) {
            return Optional.empty();
        }
        return Optional.of(BigDecimal.valueOf(numerator).divide(BigDecimal.valueOf(denominator), SCALE, RoundingMode.HALF_UP));
    }
}
