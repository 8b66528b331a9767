package com.polymind.analytics.engine;

public enum HotMarketSort {
    VOLUME,
    TRADES
}
