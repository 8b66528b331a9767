package com.polymind.analytics.engine;

import com.polymind.domain.TradeSide;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Mutable per-address fold owned by {@link AnalyticsEngine}; only touched under its write lock.
 * Counters and positions cover every fill; {@code recentLegs} only the retention window.
 */
final class TraderState {

    private final String address;
    private final Deque<TradeLeg> recentLegs = new ArrayDeque<>();
    private final Map<PositionKey, Position> positions = new HashMap<>();
    private final Map<String, Long> tradesByMarket = new HashMap<>();
    private final Set<LocalDate> activeDays = new HashSet<>();
    private long tradeCount;
    private long buyCount;
    private long sellCount;
    private BigDecimal buyVolume = BigDecimal.ZERO;
    private BigDecimal sellVolume = BigDecimal.ZERO;
    private BigDecimal priceSum = BigDecimal.ZERO;
    private long wonCount;
    private long lostCount;
    private Instant firstTradeAt;
    private Instant lastTradeAt;

    TraderState(String address) {
        this.address = address;
    }

    void record(TradeLeg leg) {
        tradeCount++;
        if (leg.timestamp() != null) {
            recentLegs.addLast(leg);
        }
        positions.computeIfAbsent(leg.positionKey(), k -> new Position()).apply(leg.side(), leg.size(), leg.price());
        tradesByMarket.merge(leg.marketId(), 1L, Long::sum);
        if (leg.side() == TradeSide.BUY) {
            buyCount++;
            buyVolume = buyVolume.add(leg.notional());
        } else {
            sellCount++;
            sellVolume = sellVolume.add(leg.notional());
        }
        priceSum = priceSum.add(leg.price());
        Instant ts = leg.timestamp();
        if (ts != null) {
            activeDays.add(LocalDate.ofInstant(ts, ZoneOffset.UTC));
            if (firstTradeAt == null || ts.isBefore(firstTradeAt)) {
                firstTradeAt = ts;
            }
            if (lastTradeAt == null || ts.isAfter(lastTradeAt)) {
                lastTradeAt = ts;
            }
        }
    }

    /** Counts each leg exactly once, when its market resolves or when the leg arrives after resolution. */
    void settle(long won, long lost) {
        wonCount += won;
        lostCount += lost;
    }

    /** Redeems every open position in the market: the winning outcome pays 1, the others 0. */
    void settlePositions(String marketId, int outcomeCount, int winningOutcomeIndex) {
        for (int i = 0; i < outcomeCount; i++) {
            Position position = positions.get(new PositionKey(marketId, i));
            if (position != null) {
                position.settle(i == winningOutcomeIndex ? BigDecimal.ONE : BigDecimal.ZERO);
            }
        }
    }

    /**
     * Drops retained legs stamped before {@code cutoff}. Legs are appended in chain order, so the deque is
     * trimmed from the head; a leg older than a newer predecessor stays until that one is dropped.
     */
    void pruneBefore(Instant cutoff) {
        while (!recentLegs.isEmpty() && recentLegs.peekFirst().timestamp().isBefore(cutoff)) {
            recentLegs.pollFirst();
        }
    }

    String address() {
        return address;
    }

    Deque<TradeLeg> recentLegs() {
        return recentLegs;
    }

    Map<PositionKey, Position> positions() {
        return positions;
    }

    Map<String, Long> tradesByMarket() {
        return tradesByMarket;
    }

    int activeDays() {
        return activeDays.size();
    }

    long tradeCount() {
        return tradeCount;
    }

    long buyCount() {
        return buyCount;
    }

    long sellCount() {
        return sellCount;
    }

    BigDecimal buyVolume() {
        return buyVolume;
    }

    BigDecimal sellVolume() {
        return sellVolume;
    }

    BigDecimal priceSum() {
        return priceSum;
    }

    long wonCount() {
        return wonCount;
    }

    long lostCount() {
        return lostCount;
    }

    Instant firstTradeAt() {
        return firstTradeAt;
    }

    Instant lastTradeAt() {
        return lastTradeAt;
    }
}
