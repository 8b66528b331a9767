package com.polymind.ingestion.decoder;

import com.polymind.domain.OutcomeToken;
import com.polymind.domain.TradeSide;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;

/**
 * OrderFilled with the collateral leg resolved: side is the maker's, price is collateral per outcome token.
 */
public record TradeFilled(
        long blockNumber,
        int logIndex,
        String transactionHash,
        String exchange,
        String orderHash,
        String maker,
        String taker,
        OutcomeToken token,
        TradeSide side,
        BigDecimal price,
        BigDecimal size,
        BigDecimal fee,
        BigInteger collateralAmount,
        BigInteger tokenAmount,
        Instant timestamp
) implements DomainEvent {

    @Override
    public EventKind kind() {
        return EventKind.TRADE_FILLED;
    }
}
