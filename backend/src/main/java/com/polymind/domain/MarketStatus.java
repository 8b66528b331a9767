package com.polymind.domain;

public enum MarketStatus {
    OPEN,
    RESOLVED
}
