package com.polymind.analytics.profile;

import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Picks one {@link TradingStyle} per profile; rules are tried in declaration order and the first match wins.
 * Pure: same profile, same style.
 */
@Component
public class TradingStyleClassifier {

    static final long MIN_TRADES = 3;
    static final double SCALPER_TRADES_PER_DAY = 5.0;
    static final BigDecimal SCALPER_MAX_NOTIONAL = new BigDecimal("100");
    static final BigDecimal VALUE_MIN_NOTIONAL = new BigDecimal("500");
    static final long VALUE_MAX_TRADES = 20;
    static final int FOCUSED_MAX_MARKETS = 3;
    static final BigDecimal FOCUSED_MIN_WIN_RATE = new BigDecimal("0.55");
    static final int DIVERSIFIED_MIN_MARKETS = 5;
    static final double BALANCED_LOW = 0.4;
    static final double BALANCED_HIGH = 0.6;

    public TradingStyle classify(TraderProfile profile) {
        if (profile == null || profile.tradeCount() < MIN_TRADES) {
            return TradingStyle.INSUFFICIENT_DATA;
        }
        if (profile.tradesPerActiveDay() > SCALPER_TRADES_PER_DAY
                && profile.averageNotional().compareTo(SCALPER_MAX_NOTIONAL) < 0) {
            return TradingStyle.SCALPER;
        }
        if (profile.averageNotional().compareTo(VALUE_MIN_NOTIONAL) > 0 && profile.tradeCount() < VALUE_MAX_TRADES) {
            return TradingStyle.VALUE_INVESTOR;
        }
        if (profile.distinctMarkets() <= FOCUSED_MAX_MARKETS
                && profile.estimatedWinRate() != null
                && profile.estimatedWinRate().compareTo(FOCUSED_MIN_WIN_RATE) > 0) {
            return TradingStyle.FOCUSED;
        }
        if (profile.distinctMarkets() > DIVERSIFIED_MIN_MARKETS) {
            return TradingStyle.DIVERSIFIED;
        }
        double buyRatio = (double) profile.buyCount() / profile.tradeCount();
        if (buyRatio >= BALANCED_LOW && buyRatio <= BALANCED_HIGH) {
            return TradingStyle.ARBITRAGEUR;
        }
        return TradingStyle.MIXED;
    }
}
