package com.polymind.ingestion.indexer;

import com.polymind.analytics.engine.AnalyticsEngine;
import com.polymind.analytics.engine.ApplyResult;
import com.polymind.domain.Market;
import com.polymind.domain.Trade;
import com.polymind.ingestion.adapter.ChainLogSource;
import com.polymind.ingestion.adapter.RawLog;
import com.polymind.ingestion.decoder.DecodeError;
import com.polymind.ingestion.decoder.DecodeResult;
import com.polymind.ingestion.decoder.DomainEvent;
import com.polymind.ingestion.decoder.EventDecoder;
import com.polymind.ingestion.decoder.MarketCreated;
import com.polymind.ingestion.decoder.MarketResolved;
import com.polymind.ingestion.decoder.TradeFilled;
import com.polymind.ingestion.registry.CatalogMarketQueue;
import com.polymind.ingestion.registry.TokenRegistry;
import com.polymind.ingestion.store.LedgerStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Decodes and applies the logs of one block range.
 * <p>
 * Logs are stable-sorted by (kind priority, block, logIndex) so markets created or resolved in the range are known
 * before its fills are decoded. Each log is decoded only after every earlier one was applied.
 * All writes are idempotent; the caller commits the range by saving the cursor afterwards.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class LogBatchProcessor {

    private static final int NOTIONAL_SCALE = 6;

    private final EventDecoder eventDecoder;
    private final TokenRegistry tokenRegistry;
    private final AnalyticsEngine analyticsEngine;
    private final LedgerStore ledgerStore;
    private final ChainLogSource chainLogSource;
    private final IngestionCounters counters;
    private final CatalogMarketQueue catalogQueue;

    /**
     * Registers markets queued by the catalogue sync. Runs on the indexer thread before each cycle's fetch; the
     * markets were already persisted by the sync.
     */
    public int applyCatalogMarkets() {
        return catalogQueue.drain(market -> {
            tokenRegistry.register(market);
            if (analyticsEngine.applyMarketCreated(market) == ApplyResult.APPLIED) {
                counters.marketSeeded();
            }
        });
    }

    public BatchResult process(List<RawLog> logs, long toBlock) {
        List<RawLog> ordered = withTimestamps(logs).stream()
                .sorted(Comparator.comparingInt((RawLog l) -> eventDecoder.kindOf(l).getApplyPriority())
                        .thenComparingLong(RawLog::blockNumber)
                        .thenComparingInt(RawLog::logIndex))
                .toList();

        List<Trade> trades = new ArrayList<>();
        int applied = 0;
        int failures = 0;
        int lastLogIndexInEndBlock = -1;
        for (RawLog raw : ordered) {
            if (raw.blockNumber() == toBlock) {
                lastLogIndexInEndBlock = Math.max(lastLogIndexInEndBlock, raw.logIndex());
            }
            DecodeResult result = eventDecoder.decode(raw);
            if (!result.isSuccess()) {
                failures++;
                recordFailure(raw, result);
                continue;
            }
            if (apply(result.getEvent().orElseThrow(), trades)) {
                applied++;
            }
        }
        ledgerStore.saveTrades(trades);
        return new BatchResult(logs.size(), applied, failures, lastLogIndexInEndBlock);
    }

    private boolean apply(DomainEvent event, List<Trade> trades) {
        return switch (event.kind()) {
            case MARKET_CREATED -> applyCreated((MarketCreated) event);
            case MARKET_RESOLVED -> applyResolved((MarketResolved) event);
            case TRADE_FILLED -> applyFill((TradeFilled) event, trades);
            case UNRECOGNIZED -> {
                counters.unrecognized();
                yield false;
            }
        };
    }

    private boolean applyCreated(MarketCreated created) {
        Market market = toMarket(created);
        tokenRegistry.register(market);
        ledgerStore.saveMarket(market);
        if (analyticsEngine.applyMarketCreated(market) == ApplyResult.APPLIED) {
            counters.marketCreated();
            log.debug("Market {} created with {} outcomes at block {}",
                    created.conditionId(), created.outcomeSlotCount(), created.blockNumber());
        }
        return true;
    }

    private boolean applyResolved(MarketResolved resolved) {
        ledgerStore.markResolved(resolved.conditionId(), resolved.winningOutcomeIndex(),
                resolved.payoutNumerators(), resolved.blockNumber(), resolved.timestamp());
        if (analyticsEngine.applyMarketResolved(resolved.conditionId(), resolved.winningOutcomeIndex())
                == ApplyResult.APPLIED) {
            counters.marketResolved();
        }
        return true;
    }

    private boolean applyFill(TradeFilled filled, List<Trade> trades) {
        Trade trade = toTrade(filled);
        trades.add(trade);
        if (analyticsEngine.applyTrade(trade) == ApplyResult.APPLIED) {
            counters.tradeApplied();
        }
        return true;
    }

    private void recordFailure(RawLog raw, DecodeResult result) {
        DecodeError error = result.getError().orElseThrow();
        counters.decodeError(error);
        if (error == DecodeError.UNKNOWN_TOKEN) {
            log.debug("Skipping fill {}:{} for unknown token {}", raw.transactionHash(), raw.logIndex(), result.getDetail());
        } else {
            log.warn("Skipping log {}:{}: {} {}", raw.transactionHash(), raw.logIndex(), error, result.getDetail());
        }
    }

    /** Logs from providers without blockTimestamp get it from the (cached) block lookup, once per block. */
    private List<RawLog> withTimestamps(List<RawLog> logs) {
        Map<Long, Instant> byBlock = new HashMap<>();
        List<RawLog> out = new ArrayList<>(logs.size());
        for (RawLog raw : logs) {
            if (raw.blockTimestamp() != null) {
                out.add(raw);
                continue;
            }
            Instant ts = byBlock.computeIfAbsent(raw.blockNumber(), chainLogSource::blockTimestamp);
            out.add(raw.withBlockTimestamp(ts));
        }
        return out;
    }

    static Market toMarket(MarketCreated created) {
        Market market = new Market();
        market.setConditionId(created.conditionId());
        market.setOracle(created.oracle());
        market.setQuestionId(created.questionId());
        market.setOutcomeSlotCount(created.outcomeSlotCount());
        market.setOutcomes(new ArrayList<>(created.outcomes()));
        market.setCreatedBlock(created.blockNumber());
        market.setCreatedAt(created.timestamp());
        return market;
    }

    static Trade toTrade(TradeFilled filled) {
        Trade trade = new Trade();
        trade.setId(Trade.idOf(filled.transactionHash(), filled.logIndex()));
        trade.setTxHash(filled.transactionHash());
        trade.setLogIndex(filled.logIndex());
        trade.setBlockNumber(filled.blockNumber());
        trade.setExchange(filled.exchange());
        trade.setOrderHash(filled.orderHash());
        trade.setMaker(filled.maker());
        trade.setTaker(filled.taker());
        trade.setTokenId(filled.token().getTokenId());
        trade.setMarketId(filled.token().getConditionId());
        trade.setOutcomeIndex(filled.token().getOutcomeIndex());
        trade.setSide(filled.side());
        trade.setPrice(filled.price());
        trade.setSize(filled.size());
        trade.setNotional(filled.price().multiply(filled.size()).setScale(NOTIONAL_SCALE, RoundingMode.HALF_UP));
        trade.setFee(filled.fee() != null ? filled.fee() : BigDecimal.ZERO);
        trade.setTimestamp(filled.timestamp());
        return trade;
    }
}
