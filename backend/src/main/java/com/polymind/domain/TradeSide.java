package com.polymind.domain;

/**
 * Side of a fill from the perspective of the party it is attributed to.
 */
public enum TradeSide {
    BUY,
    SELL;

    public TradeSide opposite() {
        return this == BUY ? SELL : BUY;
    }
}
