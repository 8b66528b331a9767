package com.polymind.api.controller;

import com.polymind.analytics.arbitrage.ArbitrageOpportunity;
import com.polymind.analytics.engine.MarketSnapshot;
import com.polymind.api.dto.ArbitrageResponse;
import com.polymind.api.dto.MarketResponse;
import com.polymind.api.dto.OutcomeResponse;
import com.polymind.api.dto.PricePointResponse;
import com.polymind.api.dto.TradeResponse;
import com.polymind.domain.Market;
import com.polymind.domain.OutcomeToken;
import com.polymind.domain.Trade;

import java.math.BigDecimal;
import java.util.List;

final class ResponseMapper {

    private ResponseMapper() {
    }

    static MarketResponse market(Market m, MarketSnapshot snapshot) {
        List<OutcomeResponse> outcomes = m.getOutcomes().stream()
                .map(o -> new OutcomeResponse(o.getOutcomeIndex(), o.getOutcomeLabel(), o.getTokenId(),
                        lastPrice(snapshot, o)))
                .toList();
        return new MarketResponse(
                m.getConditionId(),
                m.getSlug(),
                m.getQuestion(),
                m.getStatus() != null ? m.getStatus().name() : null,
                m.getWinningOutcomeIndex(),
                outcomes,
                snapshot != null ? snapshot.tradeCount() : 0L,
                snapshot != null ? snapshot.volume() : BigDecimal.ZERO,
                snapshot != null ? snapshot.lastTradeAt() : null,
                m.getCreatedBlock(),
                m.getCreatedAt(),
                m.getResolvedBlock());
    }

    static TradeResponse trade(Trade t) {
        return new TradeResponse(
                t.getId(),
                t.getTxHash(),
                t.getLogIndex(),
                t.getBlockNumber(),
                t.getMarketId(),
                t.getOutcomeIndex(),
                t.getTokenId(),
                t.getSide() != null ? t.getSide().name() : null,
                t.getMaker(),
                t.getTaker(),
                t.getPrice(),
                t.getSize(),
                t.getNotional(),
                t.getFee(),
                t.getTimestamp());
    }

    static PricePointResponse pricePoint(Trade t) {
        return new PricePointResponse(t.getBlockNumber(), t.getLogIndex(), t.getOutcomeIndex(), t.getPrice(),
                t.getSize(), t.getTimestamp());
    }

    static ArbitrageResponse arbitrage(ArbitrageOpportunity o, String slug) {
        return new ArbitrageResponse(o.conditionId(), slug, o.outcomePrices(), o.priceSum(), o.magnitude(),
                o.direction().name(), o.confidence().name());
    }

    private static BigDecimal lastPrice(MarketSnapshot snapshot, OutcomeToken outcome) {
        if (snapshot == null || outcome.getOutcomeIndex() >= snapshot.lastPrices().size()) {
            return null;
        }
        return snapshot.lastPrices().get(outcome.getOutcomeIndex());
    }
}
