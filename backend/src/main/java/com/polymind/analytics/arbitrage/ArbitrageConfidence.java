package com.polymind.analytics.arbitrage;

public enum ArbitrageConfidence {
    MEDIUM,
    HIGH
}
