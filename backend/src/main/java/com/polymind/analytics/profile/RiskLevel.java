package com.polymind.analytics.profile;

public enum RiskLevel {
    LOW,
    MEDIUM,
    MEDIUM_HIGH,
    HIGH
}
