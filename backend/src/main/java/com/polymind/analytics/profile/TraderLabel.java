package com.polymind.analytics.profile;

public enum TraderLabel {
    WHALE,
    ACTIVE,
    SNIPER,
    DIVERSIFIED,
    HIGH_FREQUENCY,
    BUY_BIASED,
    SELL_BIASED,
    LARGE_TICKET,
    NEWCOMER,
    HIGH_WIN_RATE
}
