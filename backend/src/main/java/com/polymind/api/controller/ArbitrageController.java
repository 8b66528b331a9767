package com.polymind.api.controller;

import com.polymind.analytics.engine.AnalyticsEngine;
import com.polymind.analytics.query.LedgerQueryService;
import com.polymind.api.dto.ArbitrageResponse;
import com.polymind.domain.Market;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Current arbitrage opportunities across open markets, largest deviation first.
 */
@RestController
@RequestMapping("/api/v1/arbitrage")
@RequiredArgsConstructor
public class ArbitrageController {

    private final AnalyticsEngine analyticsEngine;
    private final LedgerQueryService ledgerQueryService;

    @GetMapping
    public ResponseEntity<List<ArbitrageResponse>> list(@RequestParam(required = false) Integer limit) {
        return ResponseEntity.ok(analyticsEngine.listArbitrage(LedgerQueryService.clampLimit(limit)).stream()
                .map(o -> ResponseMapper.arbitrage(o,
                        ledgerQueryService.findMarket(o.conditionId()).map(Market::getSlug).orElse(null)))
                .toList());
    }
}
