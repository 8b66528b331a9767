package com.polymind.ingestion.store;

import com.polymind.domain.Market;
import com.polymind.domain.Trade;

import java.math.BigInteger;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.function.Consumer;

/**
 * Durable record of discovered markets and applied fills. Every write is an idempotent upsert,
 * so re-applying a batch after a failed cursor save leaves the store unchanged.
 */
public interface LedgerStore {

    void saveMarket(Market market);

    /**
     * Marks the market resolved unless it already is. Returns false when the market is unknown or already resolved.
     */
    boolean markResolved(String conditionId, int winningOutcomeIndex, List<BigInteger> payoutNumerators,
                         long block, Instant resolvedAt);

    void saveTrades(Collection<Trade> trades);

    List<Market> loadMarkets();

    /** Streams every stored fill in (blockNumber, logIndex) order. */
    void forEachTradeInChainOrder(Consumer<Trade> consumer);
}
