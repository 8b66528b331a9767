package com.polymind.api.controller;

import com.polymind.analytics.engine.AnalyticsEngine;
import com.polymind.analytics.engine.EngineStats;
import com.polymind.analytics.query.LedgerCounts;
import com.polymind.analytics.query.LedgerQueryService;
import com.polymind.api.dto.StatsResponse;
import com.polymind.ingestion.indexer.BlockRangeIndexer;
import com.polymind.ingestion.indexer.IndexerStatus;
import com.polymind.ingestion.registry.TokenRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * GET /stats and GET /indexer/status.
 */
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class StatsController {

    private final AnalyticsEngine analyticsEngine;
    private final LedgerQueryService ledgerQueryService;
    private final TokenRegistry tokenRegistry;
    private final BlockRangeIndexer indexer;

    @GetMapping("/stats")
    public ResponseEntity<StatsResponse> stats() {
        EngineStats engine = analyticsEngine.stats();
        LedgerCounts stored = ledgerQueryService.counts();
        IndexerStatus status = indexer.status();
        return ResponseEntity.ok(new StatsResponse(
                engine.markets(),
                engine.resolvedMarkets(),
                engine.trades(),
                engine.traders(),
                engine.skippedEvents(),
                engine.latestTradeAt(),
                stored.markets(),
                stored.resolvedMarkets(),
                stored.trades(),
                tokenRegistry.size(),
                status.state().name(),
                status.lag()));
    }

    @GetMapping("/indexer/status")
    public ResponseEntity<IndexerStatus> indexerStatus() {
        return ResponseEntity.ok(indexer.status());
    }
}
