package com.polymind.analytics.arbitrage;

public enum ArbitrageDirection {
    /** Outcome prices sum above 1: selling one of every outcome locks in the excess. */
    SELL_ALL,
    /** Outcome prices sum below 1: buying one of every outcome pays out 1 at resolution. */
    BUY_ALL
}
