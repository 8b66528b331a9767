package com.polymind.analytics.profile;

/**
 * Dominant trading pattern of an address. Exactly one per profile, unlike {@link TraderLabel}.
 */
public enum TradingStyle {
    /** Fewer fills than any rule needs. */
    INSUFFICIENT_DATA,
    /** Many small fills per active day. */
    SCALPER,
    /** Few, large fills. */
    VALUE_INVESTOR,
    /** A handful of markets at a high win rate. */
    FOCUSED,
    DIVERSIFIED,
    /** Buys and sells in near-equal measure. */
    ARBITRAGEUR,
    MIXED
}
