package com.polymind.ingestion.indexer;

import com.polymind.domain.Market;
import com.polymind.domain.MarketStatus;
import com.polymind.domain.Trade;
import com.polymind.ingestion.store.LedgerStore;
import org.springframework.dao.DataAccessResourceFailureException;

import java.math.BigInteger;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/** Map-backed ledger with the same upsert semantics as the Mongo store. */
class InMemoryLedgerStore implements LedgerStore {

    final Map<String, Market> markets = new LinkedHashMap<>();
    final Map<String, Trade> trades = new LinkedHashMap<>();
    int failTradeWrites;

    @Override
    public void saveMarket(Market market) {
        markets.putIfAbsent(market.getConditionId(), market);
    }

    @Override
    public boolean markResolved(String conditionId, int winningOutcomeIndex, List<BigInteger> payoutNumerators,
                                long block, Instant resolvedAt) {
        Market market = markets.get(conditionId);
        if (market == null || market.isResolved()) {
            return false;
        }
        market.setStatus(MarketStatus.RESOLVED);
        market.setWinningOutcomeIndex(winningOutcomeIndex);
        market.setPayoutNumerators(payoutNumerators.stream().map(BigInteger::toString).toList());
        market.setResolvedBlock(block);
        market.setResolvedAt(resolvedAt);
        return true;
    }

    @Override
    public void saveTrades(Collection<Trade> batch) {
        if (failTradeWrites > 0) {
            failTradeWrites--;
            throw new DataAccessResourceFailureException("ledger unavailable");
        }
        batch.forEach(t -> trades.put(t.getId(), t));
    }

    @Override
    public List<Market> loadMarkets() {
        return new ArrayList<>(markets.values());
    }

    @Override
    public void forEachTradeInChainOrder(Consumer<Trade> consumer) {
        trades.values().stream()
                .sorted(Comparator.comparingLong(Trade::getBlockNumber).thenComparingInt(Trade::getLogIndex))
                .forEach(consumer);
    }
}
