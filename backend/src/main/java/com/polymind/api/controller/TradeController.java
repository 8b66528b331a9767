package com.polymind.api.controller;

import com.polymind.analytics.query.LedgerQueryService;
import com.polymind.api.dto.ErrorBody;
import com.polymind.api.dto.TradeResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.util.List;

@RestController
@RequestMapping("/api/v1/trades")
@RequiredArgsConstructor
public class TradeController {

    private static final BigDecimal DEFAULT_MIN_NOTIONAL = new BigDecimal("1000");

    private final LedgerQueryService ledgerQueryService;

    @GetMapping("/recent")
    public ResponseEntity<List<TradeResponse>> recent(@RequestParam(required = false) Integer limit) {
        return ResponseEntity.ok(ledgerQueryService.recentTrades(limit).stream()
                .map(ResponseMapper::trade)
                .toList());
    }

    /** Fills with notional (collateral) at or above minNotional, newest first. */
    @GetMapping("/large")
    public ResponseEntity<?> large(@RequestParam(required = false) BigDecimal minNotional,
                                   @RequestParam(required = false) Integer limit) {
        BigDecimal threshold = minNotional != null ? minNotional : DEFAULT_MIN_NOTIONAL;
        if (threshold.signum() < 0) {
            return ResponseEntity.badRequest().body(ErrorBody.of("INVALID_NOTIONAL", "minNotional must be >= 0"));
        }
        return ResponseEntity.ok(ledgerQueryService.largeTrades(threshold, limit).stream()
                .map(ResponseMapper::trade)
                .toList());
    }
}
