package com.polymind.analytics.engine;

/**
 * What the engine did with one event.
 */
public enum ApplyResult {
    APPLIED,
    /** Already applied (same trade key, market already known or already resolved). */
    DUPLICATE,
    /** Event references a market the engine does not know; skipped. */
    UNKNOWN_MARKET,
    /** Event contradicts the market (outcome index out of range); skipped. */
    REJECTED
}
