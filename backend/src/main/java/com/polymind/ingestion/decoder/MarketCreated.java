package com.polymind.ingestion.decoder;

import com.polymind.domain.OutcomeToken;

import java.time.Instant;
import java.util.List;

/**
 * ConditionPreparation with derived outcome token ids, in outcome order.
 */
public record MarketCreated(
        long blockNumber,
        int logIndex,
        String transactionHash,
        String conditionId,
        String oracle,
        String questionId,
        int outcomeSlotCount,
        List<OutcomeToken> outcomes,
        Instant timestamp
) implements DomainEvent {

    public MarketCreated {
        outcomes = List.copyOf(outcomes);
    }

    @Override
    public EventKind kind() {
        return EventKind.MARKET_CREATED;
    }
}
