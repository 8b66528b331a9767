package com.polymind.api.controller;

import com.polymind.analytics.config.AnalyticsProperties;
import com.polymind.analytics.engine.AnalyticsEngine;
import com.polymind.analytics.engine.HotMarket;
import com.polymind.analytics.engine.HotMarketSort;
import com.polymind.analytics.engine.MarketPnlEntry;
import com.polymind.analytics.query.LedgerQueryService;
import com.polymind.api.dto.ErrorBody;
import com.polymind.api.dto.HotMarketResponse;
import com.polymind.api.dto.MarketPnlResponse;
import com.polymind.api.validation.ConditionIds;
import com.polymind.domain.Market;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Markets: lookup, search, fills, price history, arbitrage, P&L leaderboard and hot-market ranking.
 */
@RestController
@RequestMapping("/api/v1/markets")
@RequiredArgsConstructor
public class MarketController {

    private final LedgerQueryService ledgerQueryService;
    private final AnalyticsEngine analyticsEngine;
    private final AnalyticsProperties analyticsProperties;

    @GetMapping
    public ResponseEntity<?> search(@RequestParam(required = false) String query,
                                    @RequestParam(required = false) Integer limit) {
        return ResponseEntity.ok(ledgerQueryService.searchMarkets(query, limit).stream()
                .map(m -> ResponseMapper.market(m, analyticsEngine.getMarketState(m.getConditionId()).orElse(null)))
                .toList());
    }

    @GetMapping("/hot")
    public ResponseEntity<?> hot(@RequestParam(required = false) Integer windowHours,
                                 @RequestParam(required = false, defaultValue = "VOLUME") String sortBy,
                                 @RequestParam(required = false) Integer limit) {
        int hours = windowHours != null ? windowHours : analyticsProperties.getDefaultHotWindowHours();
        long maxHours = analyticsEngine.retention().toHours();
        if (hours <= 0 || hours > maxHours) {
            return badRequest("INVALID_WINDOW", "windowHours must be between 1 and " + maxHours);
        }
        HotMarketSort sort;
        try {
            sort = HotMarketSort.valueOf(sortBy.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return badRequest("INVALID_SORT", "sortBy must be VOLUME or TRADES");
        }
        return ResponseEntity.ok(analyticsEngine.hotMarkets(Duration.ofHours(hours), sort,
                        LedgerQueryService.clampLimit(limit)).stream()
                .map(this::toHotResponse)
                .toList());
    }

    @GetMapping("/{conditionId}")
    public ResponseEntity<?> getMarket(@PathVariable String conditionId) {
        if (!ConditionIds.isValid(conditionId)) {
            return invalidConditionId();
        }
        return ledgerQueryService.findMarket(conditionId)
                .<ResponseEntity<?>>map(m -> ResponseEntity.ok(
                        ResponseMapper.market(m, analyticsEngine.getMarketState(m.getConditionId()).orElse(null))))
                .orElseGet(MarketController::marketNotFound);
    }

    @GetMapping("/{conditionId}/trades")
    public ResponseEntity<?> getTrades(@PathVariable String conditionId,
                                       @RequestParam(required = false) Integer limit,
                                       @RequestParam(required = false) Integer offset) {
        if (!ConditionIds.isValid(conditionId)) {
            return invalidConditionId();
        }
        if (ledgerQueryService.findMarket(conditionId).isEmpty()) {
            return marketNotFound();
        }
        return ResponseEntity.ok(ledgerQueryService.marketTrades(conditionId, limit, offset).stream()
                .map(ResponseMapper::trade)
                .toList());
    }

    @GetMapping("/{conditionId}/price-history")
    public ResponseEntity<?> getPriceHistory(@PathVariable String conditionId,
                                             @RequestParam(required = false) Integer outcomeIndex,
                                             @RequestParam(required = false) Integer limit) {
        if (!ConditionIds.isValid(conditionId)) {
            return invalidConditionId();
        }
        if (ledgerQueryService.findMarket(conditionId).isEmpty()) {
            return marketNotFound();
        }
        return ResponseEntity.ok(ledgerQueryService.priceHistory(conditionId, outcomeIndex, limit).stream()
                .map(ResponseMapper::pricePoint)
                .toList());
    }

    /**
     * 200 with the opportunity, 204 when prices are consistent (or the market is resolved), 404 for unknown markets.
     */
    @GetMapping("/{conditionId}/arbitrage")
    public ResponseEntity<?> getArbitrage(@PathVariable String conditionId) {
        if (!ConditionIds.isValid(conditionId)) {
            return invalidConditionId();
        }
        Optional<Market> market = ledgerQueryService.findMarket(conditionId);
        if (market.isEmpty()) {
            return marketNotFound();
        }
        return analyticsEngine.findArbitrage(market.get().getConditionId())
                .<ResponseEntity<?>>map(o -> ResponseEntity.ok(ResponseMapper.arbitrage(o, market.get().getSlug())))
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    @GetMapping("/{conditionId}/pnl")
    public ResponseEntity<?> getPnlLeaderboard(@PathVariable String conditionId,
                                               @RequestParam(required = false) Integer limit) {
        if (!ConditionIds.isValid(conditionId)) {
            return invalidConditionId();
        }
        Optional<Market> market = ledgerQueryService.findMarket(conditionId);
        if (market.isEmpty()) {
            return marketNotFound();
        }
        List<MarketPnlEntry> ranked = analyticsEngine
                .marketPnl(market.get().getConditionId(), LedgerQueryService.clampLimit(limit))
                .orElse(List.of());
        List<MarketPnlResponse> rows = new ArrayList<>(ranked.size());
        for (int i = 0; i < ranked.size(); i++) {
            MarketPnlEntry e = ranked.get(i);
            rows.add(new MarketPnlResponse(i + 1, e.address(), e.realizedPnl(), e.unrealizedPnl(), e.totalPnl(),
                    e.tradeCount()));
        }
        return ResponseEntity.ok(rows);
    }

    private HotMarketResponse toHotResponse(HotMarket h) {
        Optional<Market> market = ledgerQueryService.findMarket(h.conditionId());
        return new HotMarketResponse(
                h.conditionId(),
                market.map(Market::getSlug).orElse(null),
                market.map(Market::getQuestion).orElse(null),
                h.windowTrades(),
                h.windowVolume(),
                h.lastPrices(),
                h.resolved());
    }

    private static ResponseEntity<?> invalidConditionId() {
        return badRequest("INVALID_CONDITION_ID", "Condition id must be 0x followed by 64 hex characters");
    }

    private static ResponseEntity<?> marketNotFound() {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ErrorBody.of("MARKET_NOT_FOUND", "Unknown market"));
    }

    private static ResponseEntity<?> badRequest(String error, String message) {
        return ResponseEntity.badRequest().body(ErrorBody.of(error, message));
    }
}
