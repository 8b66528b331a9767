package com.polymind.analytics.profile;

import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Heuristic tags derived from a profile. Pure: same profile, same labels.
 */
@Component
public class TraderLabeler {

    static final BigDecimal WHALE_VOLUME = new BigDecimal("10000");
    static final long ACTIVE_TRADES = 50;
    static final BigDecimal SNIPER_LOW = new BigDecimal("0.15");
    static final BigDecimal SNIPER_HIGH = new BigDecimal("0.85");
    static final int DIVERSIFIED_MARKETS = 5;
    static final double HIGH_FREQUENCY_PER_DAY = 10.0;
    static final BigDecimal LARGE_TICKET_NOTIONAL = new BigDecimal("1000");
    static final long NEWCOMER_TRADES = 5;
    static final BigDecimal HIGH_WIN_RATE = new BigDecimal("0.6");
    static final long HIGH_WIN_RATE_MIN_TRADES = 10;

    public Set<TraderLabel> labels(TraderProfile profile) {
        if (profile == null || profile.tradeCount() == 0) {
            return Collections.emptySet();
        }
        Set<TraderLabel> labels = EnumSet.noneOf(TraderLabel.class);
        if (profile.totalVolume().compareTo(WHALE_VOLUME) >= 0) {
            labels.add(TraderLabel.WHALE);
        }
        if (profile.tradeCount() >= ACTIVE_TRADES) {
            labels.add(TraderLabel.ACTIVE);
        }
        if (profile.averagePrice().compareTo(SNIPER_LOW) < 0 || profile.averagePrice().compareTo(SNIPER_HIGH) > 0) {
            labels.add(TraderLabel.SNIPER);
        }
        if (profile.distinctMarkets() >= DIVERSIFIED_MARKETS) {
            labels.add(TraderLabel.DIVERSIFIED);
        }
        if (profile.tradesPerActiveDay() >= HIGH_FREQUENCY_PER_DAY) {
            labels.add(TraderLabel.HIGH_FREQUENCY);
        }
        if (profile.buyCount() > profile.sellCount() * 2) {
            labels.add(TraderLabel.BUY_BIASED);
        } else if (profile.sellCount() > profile.buyCount() * 2) {
            labels.add(TraderLabel.SELL_BIASED);
        }
        if (profile.averageNotional().compareTo(LARGE_TICKET_NOTIONAL) > 0) {
            labels.add(TraderLabel.LARGE_TICKET);
        }
        if (profile.tradeCount() < NEWCOMER_TRADES) {
            labels.add(TraderLabel.NEWCOMER);
        }
        if (profile.estimatedWinRate() != null
                && profile.estimatedWinRate().compareTo(HIGH_WIN_RATE) > 0
                && profile.tradeCount() >= HIGH_WIN_RATE_MIN_TRADES) {
            labels.add(TraderLabel.HIGH_WIN_RATE);
        }
        return Collections.unmodifiableSet(labels);
    }
}
