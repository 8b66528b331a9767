package com.polymind.analytics.query;

public record LedgerCounts(long markets, long resolvedMarkets, long trades) {
}
