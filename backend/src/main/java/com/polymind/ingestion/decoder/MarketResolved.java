package com.polymind.ingestion.decoder;

import java.math.BigInteger;
import java.time.Instant;
import java.util.List;

public record MarketResolved(
        long blockNumber,
        int logIndex,
        String transactionHash,
        String conditionId,
        int winningOutcomeIndex,
        List<BigInteger> payoutNumerators,
        Instant timestamp
) implements DomainEvent {

    public MarketResolved {
        payoutNumerators = List.copyOf(payoutNumerators);
    }

    @Override
    public EventKind kind() {
        return EventKind.MARKET_RESOLVED;
    }
}
