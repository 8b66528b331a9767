package com.polymind.api.controller;

import com.polymind.analytics.config.AnalyticsProperties;
import com.polymind.analytics.engine.AnalyticsEngine;
import com.polymind.analytics.query.LedgerQueryService;
import com.polymind.analytics.smartmoney.SmartMoneyEntry;
import com.polymind.api.dto.ErrorBody;
import com.polymind.api.dto.SmartMoneyResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@RestController
@RequestMapping("/api/v1/smart-money")
@RequiredArgsConstructor
public class SmartMoneyController {

    private final AnalyticsEngine analyticsEngine;
    private final AnalyticsProperties analyticsProperties;

    @GetMapping
    public ResponseEntity<?> list(@RequestParam(required = false) Integer windowHours,
                                  @RequestParam(required = false) Integer limit) {
        int hours = windowHours != null ? windowHours : analyticsProperties.getSmartMoney().getDefaultWindowHours();
        long maxHours = analyticsEngine.retention().toHours();
        if (hours <= 0 || hours > maxHours) {
            return ResponseEntity.badRequest().body(
                    ErrorBody.of("INVALID_WINDOW", "windowHours must be between 1 and " + maxHours));
        }
        List<SmartMoneyEntry> ranked = analyticsEngine.getSmartMoney(Duration.ofHours(hours),
                LedgerQueryService.clampLimit(limit));
        List<SmartMoneyResponse.Entry> entries = new ArrayList<>(ranked.size());
        for (int i = 0; i < ranked.size(); i++) {
            SmartMoneyEntry e = ranked.get(i);
            entries.add(new SmartMoneyResponse.Entry(i + 1, e.address(), e.score(), e.winRate(), e.windowVolume(),
                    e.windowTrades(), e.lastTradeAt()));
        }
        return ResponseEntity.ok(new SmartMoneyResponse(hours, analyticsEngine.stats().latestTradeAt(), entries));
    }
}
