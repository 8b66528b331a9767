package com.polymind.analytics.engine;

import java.math.BigDecimal;
import java.time.Instant;
import com.polymind.domain.TradeSide;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Mutable per-market aggregate owned by {@link AnalyticsEngine}; only touched under its write lock.
 */
final class MarketState {

    private final String conditionId;
    private final int outcomeCount;
    private final BigDecimal[] lastPrices;
    private final ChainPosition[] lastPricePositions;
    /** Dated fills inside the retention window, in arrival order. */
    private final Deque<PriceTick> ticks = new ArrayDeque<>();
    /** Leg counts per address awaiting resolution, indexed by {@link #legSlot}. Emptied when the market settles. */
    private final Map<String, long[]> unsettledLegs = new HashMap<>();
    private final Set<String> participants = new HashSet<>();
    private BigDecimal volume = BigDecimal.ZERO;
    private long tradeCount;
    private Instant lastTradeAt;
    private Integer winningOutcomeIndex;

    MarketState(String conditionId, int outcomeCount) {
        this.conditionId = conditionId;
        this.outcomeCount = outcomeCount;
        this.lastPrices = new BigDecimal[outcomeCount];
        this.lastPricePositions = new ChainPosition[outcomeCount];
    }

    void recordTrade(ChainPosition position, int outcomeIndex, BigDecimal price, BigDecimal notional, Instant timestamp) {
        ChainPosition current = lastPricePositions[outcomeIndex];
        if (current == null || position.compareTo(current) > 0) {
            lastPrices[outcomeIndex] = price;
            lastPricePositions[outcomeIndex] = position;
        }
        if (timestamp != null) {
            ticks.addLast(new PriceTick(position, outcomeIndex, price, notional, timestamp));
        }
        volume = volume.add(notional);
        tradeCount++;
        if (timestamp != null && (lastTradeAt == null || timestamp.isAfter(lastTradeAt))) {
            lastTradeAt = timestamp;
        }
    }

    void addParticipant(String address) {
        participants.add(address);
    }

    void addUnsettledLeg(TradeLeg leg) {
        unsettledLegs.computeIfAbsent(leg.address(), k -> new long[outcomeCount * 2])
                [legSlot(leg.outcomeIndex(), leg.side())]++;
    }

    /** Same head-trimming rule as {@link TraderState#pruneBefore}. */
    void pruneTicksBefore(Instant cutoff) {
        while (!ticks.isEmpty() && ticks.peekFirst().timestamp().isBefore(cutoff)) {
            ticks.pollFirst();
        }
    }

    static int legSlot(int outcomeIndex, TradeSide side) {
        return outcomeIndex * 2 + (side == TradeSide.BUY ? 0 : 1);
    }

    void resolve(int winner) {
        this.winningOutcomeIndex = winner;
    }

    boolean isResolved() {
        return winningOutcomeIndex != null;
    }

    String conditionId() {
        return conditionId;
    }

    int outcomeCount() {
        return outcomeCount;
    }

    BigDecimal lastPrice(int outcomeIndex) {
        return lastPrices[outcomeIndex];
    }

    /** Copy; entries are null for outcomes never traded. */
    List<BigDecimal> lastPrices() {
        return Collections.unmodifiableList(Arrays.asList(lastPrices.clone()));
    }

    Deque<PriceTick> ticks() {
        return ticks;
    }

    Map<String, long[]> unsettledLegs() {
        return unsettledLegs;
    }

    Set<String> participants() {
        return participants;
    }

    BigDecimal volume() {
        return volume;
    }

    long tradeCount() {
        return tradeCount;
    }

    Instant lastTradeAt() {
        return lastTradeAt;
    }

    Integer winningOutcomeIndex() {
        return winningOutcomeIndex;
    }
}
