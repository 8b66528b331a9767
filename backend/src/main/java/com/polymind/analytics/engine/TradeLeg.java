package com.polymind.analytics.engine;

import com.polymind.domain.TradeSide;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One party's side of a fill. A trade yields a maker leg and, unless the taker is excluded, a taker leg.
 */
record TradeLeg(
        String address,
        String marketId,
        int outcomeIndex,
        TradeSide side,
        BigDecimal price,
        BigDecimal size,
        BigDecimal notional,
        Instant timestamp
) {

    /** BUY of the winner or SELL of a loser. */
    boolean wins(int winningOutcomeIndex) {
        return wins(side, outcomeIndex, winningOutcomeIndex);
    }

    static boolean wins(TradeSide side, int outcomeIndex, int winningOutcomeIndex) {
        boolean heldWinner = outcomeIndex == winningOutcomeIndex;
        return side == TradeSide.BUY ? heldWinner : !heldWinner;
    }

    PositionKey positionKey() {
        return new PositionKey(marketId, outcomeIndex);
    }
}
