package com.polymind.ingestion.decoder;

/**
 * Closed set of log kinds the decoder understands. Priority orders application inside a batch:
 * markets must exist before their fills resolve.
 */
public enum EventKind {
    MARKET_CREATED(0),
    MARKET_RESOLVED(1),
    TRADE_FILLED(2),
    UNRECOGNIZED(3);

    private final int applyPriority;

    EventKind(int applyPriority) {
        this.applyPriority = applyPriority;
    }

    public int getApplyPriority() {
        return applyPriority;
    }
}
