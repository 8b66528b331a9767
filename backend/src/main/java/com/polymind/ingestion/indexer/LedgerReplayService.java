package com.polymind.ingestion.indexer;

import com.polymind.analytics.engine.AnalyticsEngine;
import com.polymind.domain.Market;
import com.polymind.ingestion.registry.TokenRegistry;
import com.polymind.ingestion.store.LedgerStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Rebuilds the token registry and analytics engine from the ledger before the indexer resumes.
 * Markets are loaded with their resolution, so fills replayed afterwards settle as they did live.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class LedgerReplayService {

    private final LedgerStore ledgerStore;
    private final TokenRegistry tokenRegistry;
    private final AnalyticsEngine analyticsEngine;

    public void rebuild() {
        long started = System.currentTimeMillis();
        List<Market> markets = ledgerStore.loadMarkets();
        for (Market market : markets) {
            tokenRegistry.register(market);
            analyticsEngine.applyMarketCreated(market);
        }
        AtomicLong trades = new AtomicLong();
        ledgerStore.forEachTradeInChainOrder(trade -> {
            analyticsEngine.applyTrade(trade);
            trades.incrementAndGet();
        });
        log.info("Ledger replay: {} markets, {} tokens, {} trades in {} ms",
                markets.size(), tokenRegistry.size(), trades.get(), System.currentTimeMillis() - started);
    }
}
