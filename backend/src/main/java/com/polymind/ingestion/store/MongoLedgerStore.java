package com.polymind.ingestion.store;

import com.polymind.domain.Market;
import com.polymind.domain.MarketRepository;
import com.polymind.domain.MarketStatus;
import com.polymind.domain.Trade;
import com.polymind.domain.TradeRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.mongodb.core.BulkOperations;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.function.Consumer;
import java.util.stream.Stream;

/**
 * MongoDB ledger. Markets are inserted once (setOnInsert) so enrichment and resolution fields written later are
 * never overwritten by a replayed creation or a catalogue re-sync; fills are bulk-upserted by txHash:logIndex.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class MongoLedgerStore implements LedgerStore {

    private static final int UPSERT_FLUSH_SIZE = 500;

    private final MongoTemplate mongoTemplate;
    private final MarketRepository marketRepository;
    private final TradeRepository tradeRepository;

    @Override
    public void saveMarket(Market market) {
        Query query = Query.query(Criteria.where("_id").is(market.getConditionId()));
        Update update = new Update()
                .setOnInsert("oracle", market.getOracle())
                .setOnInsert("questionId", market.getQuestionId())
                .setOnInsert("outcomeSlotCount", market.getOutcomeSlotCount())
                .setOnInsert("outcomes", market.getOutcomes())
                .setOnInsert("status", MarketStatus.OPEN)
                .setOnInsert("createdBlock", market.getCreatedBlock())
                .setOnInsert("createdAt", market.getCreatedAt());
        if (market.getSlug() != null) {
            update.setOnInsert("slug", market.getSlug());
        }
        if (market.getQuestion() != null) {
            update.setOnInsert("question", market.getQuestion());
        }
        if (market.getMetadataFetchedAt() != null) {
            update.setOnInsert("metadataFetchedAt", market.getMetadataFetchedAt());
        }
        mongoTemplate.upsert(query, update, Market.class);
    }

    @Override
    public boolean markResolved(String conditionId, int winningOutcomeIndex, List<BigInteger> payoutNumerators,
                                long block, Instant resolvedAt) {
        Query query = Query.query(Criteria.where("_id").is(conditionId).and("status").is(MarketStatus.OPEN));
        Update update = new Update()
                .set("status", MarketStatus.RESOLVED)
                .set("winningOutcomeIndex", winningOutcomeIndex)
                .set("payoutNumerators", payoutNumerators.stream().map(BigInteger::toString).toList())
                .set("resolvedBlock", block)
                .set("resolvedAt", resolvedAt);
        boolean updated = mongoTemplate.updateFirst(query, update, Market.class).getModifiedCount() > 0;
        if (!updated) {
            log.debug("Market {} not marked resolved (unknown or already resolved)", conditionId);
        }
        return updated;
    }

    @Override
    public void saveTrades(Collection<Trade> trades) {
        if (trades.isEmpty()) {
            return;
        }
        List<Trade> chunk = new ArrayList<>(Math.min(trades.size(), UPSERT_FLUSH_SIZE));
        for (Trade trade : trades) {
            ensureId(trade);
            chunk.add(trade);
            if (chunk.size() >= UPSERT_FLUSH_SIZE) {
                bulkUpsert(chunk);
                chunk.clear();
            }
        }
        if (!chunk.isEmpty()) {
            bulkUpsert(chunk);
        }
    }

    @Override
    public List<Market> loadMarkets() {
        return marketRepository.findAll();
    }

    @Override
    public void forEachTradeInChainOrder(Consumer<Trade> consumer) {
        try (Stream<Trade> trades = tradeRepository.streamAllByOrderByBlockNumberAscLogIndexAsc()) {
            trades.forEach(consumer);
        }
    }

    private static void ensureId(Trade trade) {
        if (trade.getId() == null || trade.getId().isBlank()) {
            trade.setId(Trade.idOf(trade.getTxHash(), trade.getLogIndex()));
        }
    }

    private void bulkUpsert(List<Trade> trades) {
        BulkOperations ops = mongoTemplate.bulkOps(BulkOperations.BulkMode.UNORDERED, Trade.class);
        for (Trade t : trades) {
            Query query = Query.query(Criteria.where("_id").is(t.getId()));
            Update update = new Update()
                    .set("txHash", t.getTxHash())
                    .set("logIndex", t.getLogIndex())
                    .set("blockNumber", t.getBlockNumber())
                    .set("exchange", t.getExchange())
                    .set("orderHash", t.getOrderHash())
                    .set("maker", t.getMaker())
                    .set("taker", t.getTaker())
                    .set("tokenId", t.getTokenId())
                    .set("marketId", t.getMarketId())
                    .set("outcomeIndex", t.getOutcomeIndex())
                    .set("side", t.getSide())
                    .set("price", t.getPrice())
                    .set("size", t.getSize())
                    .set("notional", t.getNotional())
                    .set("fee", t.getFee())
                    .set("timestamp", t.getTimestamp());
            ops.upsert(query, update);
        }
        ops.execute();
    }
}
