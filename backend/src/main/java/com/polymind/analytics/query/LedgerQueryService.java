package com.polymind.analytics.query;

import com.polymind.common.EvmAddresses;
import com.polymind.domain.Market;
import com.polymind.domain.MarketRepository;
import com.polymind.domain.MarketStatus;
import com.polymind.domain.Trade;
import com.polymind.domain.TradeRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Read-only queries over the persisted ledger. Trades are returned newest first unless stated otherwise.
 * Limits are clamped to [1, {@value #MAX_LIMIT}] and default to {@value #DEFAULT_LIMIT}.
 */
@Service
@RequiredArgsConstructor
public class LedgerQueryService {

    public static final int DEFAULT_LIMIT = 50;
    public static final int MAX_LIMIT = 500;

    private static final Sort NEWEST_FIRST = Sort.by(Sort.Direction.DESC, "blockNumber", "logIndex");

    private final MarketRepository marketRepository;
    private final TradeRepository tradeRepository;
    private final MongoTemplate mongoTemplate;

    public static int clampLimit(Integer limit) {
        if (limit == null) {
            return DEFAULT_LIMIT;
        }
        return Math.max(1, Math.min(MAX_LIMIT, limit));
    }

    public Optional<Market> findMarket(String conditionId) {
        return marketRepository.findById(normalizeId(conditionId));
    }

    /**
     * Case-insensitive substring match on slug or question. The query is matched literally.
     */
    public List<Market> searchMarkets(String query, Integer limit) {
        if (query == null || query.isBlank()) {
            return marketRepository.findAll(PageRequest.of(0, clampLimit(limit), Sort.by(Sort.Direction.DESC, "createdBlock")))
                    .getContent();
        }
        return marketRepository.searchBySlugOrQuestion(Pattern.quote(query.trim()), PageRequest.of(0, clampLimit(limit)));
    }

    public List<Trade> marketTrades(String conditionId, Integer limit, Integer offset) {
        Query query = Query.query(Criteria.where("marketId").is(normalizeId(conditionId)));
        return page(query, limit, offset);
    }

    /**
     * Fill prices of one market in chain order (oldest first), optionally for one outcome.
     */
    public List<Trade> priceHistory(String conditionId, Integer outcomeIndex, Integer limit) {
        PageRequest page = PageRequest.of(0, clampLimit(limit));
        List<Trade> newestFirst = outcomeIndex == null
                ? tradeRepository.findByMarketIdOrderByBlockNumberDescLogIndexDesc(normalizeId(conditionId), page)
                : tradeRepository.findByMarketIdAndOutcomeIndexOrderByBlockNumberDescLogIndexDesc(
                        normalizeId(conditionId), outcomeIndex, page);
        List<Trade> chronological = new ArrayList<>(newestFirst);
        Collections.reverse(chronological);
        return chronological;
    }

    public List<Trade> recentTrades(Integer limit) {
        return tradeRepository.findAllByOrderByBlockNumberDescLogIndexDesc(PageRequest.of(0, clampLimit(limit)));
    }

    public List<Trade> largeTrades(BigDecimal minNotional, Integer limit) {
        return tradeRepository.findByNotionalGreaterThanEqualOrderByBlockNumberDescLogIndexDesc(
                minNotional, PageRequest.of(0, clampLimit(limit)));
    }

    /** Fills where the address is maker or taker. */
    public List<Trade> traderTrades(String address, Integer limit, Integer offset) {
        String normalized = EvmAddresses.normalize(address);
        Query query = new Query(new Criteria().orOperator(
                Criteria.where("maker").is(normalized),
                Criteria.where("taker").is(normalized)));
        return page(query, limit, offset);
    }

    public LedgerCounts counts() {
        return new LedgerCounts(
                marketRepository.count(),
                marketRepository.countByStatus(MarketStatus.RESOLVED),
                tradeRepository.count());
    }

    private List<Trade> page(Query query, Integer limit, Integer offset) {
        query.with(NEWEST_FIRST)
                .skip(offset == null ? 0 : Math.max(0, offset))
                .limit(clampLimit(limit));
        return mongoTemplate.find(query, Trade.class);
    }

    private static String normalizeId(String conditionId) {
        return conditionId == null ? null : conditionId.trim().toLowerCase(Locale.ROOT);
    }
}
