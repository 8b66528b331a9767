package com.polymind.api.controller;

import com.polymind.analytics.engine.AnalyticsEngine;
import com.polymind.analytics.profile.RiskAssessor;
import com.polymind.analytics.profile.TraderLabeler;
import com.polymind.analytics.profile.TraderProfile;
import com.polymind.analytics.profile.TradingStyleClassifier;
import com.polymind.analytics.query.LedgerQueryService;
import com.polymind.api.dto.ErrorBody;
import com.polymind.api.dto.TraderProfileResponse;
import com.polymind.api.validation.EvmAddress;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Trader profile with P&L, labels, trading style and risk level, and the trader's fills.
 */
@RestController
@RequestMapping("/api/v1/traders")
@RequiredArgsConstructor
public class TraderController {

    private final AnalyticsEngine analyticsEngine;
    private final LedgerQueryService ledgerQueryService;
    private final TraderLabeler traderLabeler;
    private final RiskAssessor riskAssessor;
    private final TradingStyleClassifier tradingStyleClassifier;

    @GetMapping("/{address}")
    public ResponseEntity<?> getProfile(@PathVariable @EvmAddress String address) {
        return analyticsEngine.getTraderProfile(address)
                .<ResponseEntity<?>>map(p -> ResponseEntity.ok(toResponse(p)))
                .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND)
                        .body(ErrorBody.of("TRADER_NOT_FOUND", "No fills for address")));
    }

    @GetMapping("/{address}/trades")
    public ResponseEntity<?> getTrades(@PathVariable @EvmAddress String address,
                                       @RequestParam(required = false) Integer limit,
                                       @RequestParam(required = false) Integer offset) {
        return ResponseEntity.ok(ledgerQueryService.traderTrades(address, limit, offset).stream()
                .map(ResponseMapper::trade)
                .toList());
    }

    private TraderProfileResponse toResponse(TraderProfile p) {
        return new TraderProfileResponse(
                p.address(),
                p.tradeCount(),
                p.buyCount(),
                p.sellCount(),
                p.buyVolume(),
                p.sellVolume(),
                p.totalVolume(),
                p.distinctMarkets(),
                p.wonCount(),
                p.lostCount(),
                p.openPositionCount(),
                p.estimatedWinRate(),
                p.averagePrice(),
                p.averageNotional(),
                p.firstTradeAt(),
                p.lastTradeAt(),
                p.activeDays(),
                p.topMarkets(),
                p.realizedPnl(),
                p.unrealizedPnl(),
                p.totalPnl(),
                p.openPositions().stream()
                        .map(o -> new TraderProfileResponse.Position(o.marketId(), o.outcomeIndex(), o.netSize(),
                                o.averageCost(), o.markPrice(), o.unrealizedPnl()))
                        .toList(),
                traderLabeler.labels(p).stream().map(Enum::name).sorted().toList(),
                tradingStyleClassifier.classify(p).name(),
                riskAssessor.assess(p).name());
    }
}
