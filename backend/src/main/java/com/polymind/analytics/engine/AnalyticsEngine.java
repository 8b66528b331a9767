package com.polymind.analytics.engine;

import com.polymind.analytics.arbitrage.ArbitrageDetector;
import com.polymind.analytics.arbitrage.ArbitrageOpportunity;
import com.polymind.analytics.config.AnalyticsProperties;
import com.polymind.analytics.profile.OpenPosition;
import com.polymind.analytics.profile.PositionSummary;
import com.polymind.analytics.profile.TraderProfile;
import com.polymind.analytics.profile.WinRatePolicy;
import com.polymind.analytics.smartmoney.SmartMoneyCandidate;
import com.polymind.analytics.smartmoney.SmartMoneyEntry;
import com.polymind.analytics.smartmoney.SmartMoneyScorer;
import com.polymind.common.EvmAddresses;
import com.polymind.domain.Market;
import com.polymind.domain.Trade;
import com.polymind.domain.TradeSide;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * In-memory analytics over the applied event stream: trader profiles, per-market price state,
 * arbitrage, smart money and hot markets.
 * <p>
 * Sole mutator of its state. Each apply call takes the write lock for one event; each read takes the read lock
 * and returns immutable values. Arbitrage and smart money are computed on read, so they always reflect the
 * latest applied trade. Rebuilt at startup by replaying the ledger in chain order.
 * <p>
 * Memory: per-fill detail (price ticks, trader legs) is kept only for the retention window behind the latest
 * trade, and per-leg win/loss bookkeeping for a market is dropped once it resolves. Everything else is an
 * aggregate bounded by the number of markets, traders and traded outcomes.
 */
@Service
@Slf4j
public class AnalyticsEngine {

    private static final int SCALE = 6;
    private static final int TOP_MARKETS = 5;
    private static final int TOP_POSITIONS = 20;
    /** Applied trades between full retention sweeps over idle markets and traders. */
    static final int SWEEP_INTERVAL = 10_000;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, MarketState> markets = new HashMap<>();
    private final Map<String, TraderState> traders = new HashMap<>();
    /** Applied trade ids by block, kept for {@code dedupHorizonBlocks} behind the newest applied block. */
    private final TreeMap<Long, Set<String>> appliedTradeIds = new TreeMap<>();

    private final Set<String> excludedAddresses;
    private final WinRatePolicy winRatePolicy;
    private final int smartMoneyMinTrades;
    private final Duration retention;
    private final long dedupHorizonBlocks;
    private final ArbitrageDetector arbitrageDetector;
    private final SmartMoneyScorer smartMoneyScorer;

    private long appliedTrades;
    private long skippedEvents;
    private long resolvedMarkets;
    private Instant latestTradeAt;
    private long tradesSinceSweep;

    public AnalyticsEngine(AnalyticsProperties properties) {
        this.excludedAddresses = properties.getExcludedAddresses().stream()
                .map(EvmAddresses::normalize)
                .collect(Collectors.toUnmodifiableSet());
        this.winRatePolicy = properties.getWinRatePolicy();
        this.smartMoneyMinTrades = properties.getSmartMoney().getMinTrades();
        int retentionHours = Math.max(properties.getRetentionHours(),
                Math.max(properties.getDefaultHotWindowHours(), properties.getSmartMoney().getDefaultWindowHours()));
        this.retention = Duration.ofHours(retentionHours);
        this.dedupHorizonBlocks = properties.getDedupHorizonBlocks();
        this.arbitrageDetector = new ArbitrageDetector(
                properties.getArbitrageThreshold(), properties.getArbitrageHighConfidenceThreshold());
        this.smartMoneyScorer = new SmartMoneyScorer(
                properties.getSmartMoney().getWinRateWeight(),
                properties.getSmartMoney().getVolumeWeight(),
                properties.getSmartMoney().getRecencyWeight());
    }

    public ApplyResult applyMarketCreated(Market market) {
        return write(() -> {
            if (markets.containsKey(market.getConditionId())) {
                return ApplyResult.DUPLICATE;
            }
            int outcomeCount = market.getOutcomes().size();
            if (outcomeCount < 2) {
                log.warn("Market {} has {} outcomes; skipped", market.getConditionId(), outcomeCount);
                skippedEvents++;
                return ApplyResult.REJECTED;
            }
            MarketState state = new MarketState(market.getConditionId(), outcomeCount);
            if (market.isResolved() && market.getWinningOutcomeIndex() != null) {
                state.resolve(market.getWinningOutcomeIndex());
                resolvedMarkets++;
            }
            markets.put(market.getConditionId(), state);
            return ApplyResult.APPLIED;
        });
    }

    /**
     * Folds one fill into market and trader state. Re-applying the same txHash:logIndex is a no-op. Fills arrive
     * in chain order give or take one re-fetched batch, so a fill further than the dedup horizon behind the newest
     * applied block counts as already applied.
     */
    public ApplyResult applyTrade(Trade trade) {
        String tradeId = trade.getId() != null ? trade.getId() : Trade.idOf(trade.getTxHash(), trade.getLogIndex());
        BigDecimal notional = trade.getNotional() != null
                ? trade.getNotional()
                : trade.getPrice().multiply(trade.getSize()).setScale(SCALE, RoundingMode.HALF_UP);
        return write(() -> {
            if (isApplied(trade.getBlockNumber(), tradeId)) {
                return ApplyResult.DUPLICATE;
            }
            MarketState market = markets.get(trade.getMarketId());
            if (market == null) {
                skippedEvents++;
                log.warn("Trade {} references unknown market {}; skipped", tradeId, trade.getMarketId());
                return ApplyResult.UNKNOWN_MARKET;
            }
            int outcomeIndex = trade.getOutcomeIndex();
            if (outcomeIndex < 0 || outcomeIndex >= market.outcomeCount()) {
                skippedEvents++;
                log.warn("Trade {} has outcome index {} outside market {}; skipped",
                        tradeId, outcomeIndex, market.conditionId());
                return ApplyResult.REJECTED;
            }
            markApplied(trade.getBlockNumber(), tradeId);
            Instant ts = trade.getTimestamp();
            if (ts != null && (latestTradeAt == null || ts.isAfter(latestTradeAt))) {
                latestTradeAt = ts;
            }
            Instant cutoff = retentionCutoff();
            market.recordTrade(new ChainPosition(trade.getBlockNumber(), trade.getLogIndex()),
                    outcomeIndex, trade.getPrice(), notional, ts);
            attribute(market, trade.getMaker(), trade.getSide(), trade, notional, cutoff);
            attribute(market, trade.getTaker(), trade.getSide().opposite(), trade, notional, cutoff);
            if (cutoff != null) {
                market.pruneTicksBefore(cutoff);
                if (++tradesSinceSweep >= SWEEP_INTERVAL) {
                    sweep(cutoff);
                }
            }
            appliedTrades++;
            return ApplyResult.APPLIED;
        });
    }

    /**
     * Settles every leg of the market as won or lost and redeems open positions at 1 for the winning outcome and
     * 0 for the others. A second resolution is ignored.
     */
    public ApplyResult applyMarketResolved(String conditionId, int winningOutcomeIndex) {
        return write(() -> {
            MarketState market = markets.get(conditionId);
            if (market == null) {
                skippedEvents++;
                log.warn("Resolution for unknown market {}; skipped", conditionId);
                return ApplyResult.UNKNOWN_MARKET;
            }
            if (market.isResolved()) {
                log.info("Market {} already resolved to outcome {}; ignoring resolution to {}",
                        conditionId, market.winningOutcomeIndex(), winningOutcomeIndex);
                return ApplyResult.DUPLICATE;
            }
            if (winningOutcomeIndex < 0 || winningOutcomeIndex >= market.outcomeCount()) {
                skippedEvents++;
                log.warn("Resolution of market {} names outcome {} of {}; skipped",
                        conditionId, winningOutcomeIndex, market.outcomeCount());
                return ApplyResult.REJECTED;
            }
            market.resolve(winningOutcomeIndex);
            resolvedMarkets++;
            long settled = 0;
            for (Map.Entry<String, long[]> entry : market.unsettledLegs().entrySet()) {
                long[] counts = entry.getValue();
                long won = 0;
                long lost = 0;
                for (int outcome = 0; outcome < market.outcomeCount(); outcome++) {
                    for (TradeSide side : TradeSide.values()) {
                        long n = counts[MarketState.legSlot(outcome, side)];
                        if (TradeLeg.wins(side, outcome, winningOutcomeIndex)) {
                            won += n;
                        } else {
                            lost += n;
                        }
                    }
                }
                traders.get(entry.getKey()).settle(won, lost);
                settled += won + lost;
            }
            market.unsettledLegs().clear();
            for (String address : market.participants()) {
                traders.get(address).settlePositions(conditionId, market.outcomeCount(), winningOutcomeIndex);
            }
            log.debug("Market {} resolved to outcome {}; settled {} legs of {} traders",
                    conditionId, winningOutcomeIndex, settled, market.participants().size());
            return ApplyResult.APPLIED;
        });
    }

    public Optional<TraderProfile> getTraderProfile(String address) {
        String key = EvmAddresses.normalize(address);
        return read(() -> Optional.ofNullable(traders.get(key)).map(this::toProfile));
    }

    public Optional<ArbitrageOpportunity> findArbitrage(String conditionId) {
        return read(() -> Optional.ofNullable(markets.get(conditionId)).flatMap(this::detect));
    }

    /** Current opportunities by magnitude desc, then condition id. */
    public List<ArbitrageOpportunity> listArbitrage(int limit) {
        return read(() -> markets.values().stream()
                .map(this::detect)
                .flatMap(Optional::stream)
                .sorted(Comparator.comparing(ArbitrageOpportunity::magnitude, Comparator.reverseOrder())
                        .thenComparing(ArbitrageOpportunity::conditionId))
                .limit(Math.max(0, limit))
                .toList());
    }

    /** Widest window the windowed rankings can answer; longer requests are cut to it. */
    public Duration retention() {
        return retention;
    }

    /**
     * Addresses with at least the configured number of fills inside the trailing window, ranked by composite score.
     * The window ends at the latest applied trade timestamp.
     */
    public List<SmartMoneyEntry> getSmartMoney(Duration window, int limit) {
        Duration effective = clamp(window);
        return read(() -> {
            if (latestTradeAt == null) {
                return List.<SmartMoneyEntry>of();
            }
            Instant from = latestTradeAt.minus(effective);
            List<SmartMoneyCandidate> candidates = new ArrayList<>();
            for (TraderState trader : traders.values()) {
                if (trader.lastTradeAt() == null || trader.lastTradeAt().isBefore(from)) {
                    continue;
                }
                long windowTrades = 0;
                BigDecimal windowVolume = BigDecimal.ZERO;
                for (TradeLeg leg : trader.recentLegs()) {
                    if (!leg.timestamp().isBefore(from)) {
                        windowTrades++;
                        windowVolume = windowVolume.add(leg.notional());
                    }
                }
                if (windowTrades < smartMoneyMinTrades) {
                    continue;
                }
                BigDecimal winRate = winRatePolicy.estimate(trader.wonCount(), trader.lostCount(), openPositions(trader))
                        .orElse(BigDecimal.ZERO);
                candidates.add(new SmartMoneyCandidate(
                        trader.address(), winRate, windowVolume, windowTrades, trader.lastTradeAt()));
            }
            return smartMoneyScorer.rank(candidates, latestTradeAt, effective, limit);
        });
    }

    /**
     * Markets with at least one fill inside the trailing window (ending at the latest applied trade),
     * ranked by window volume or trade count, ties by condition id.
     */
    public List<HotMarket> hotMarkets(Duration window, HotMarketSort sortBy, int limit) {
        Duration effective = clamp(window);
        return read(() -> {
            if (latestTradeAt == null) {
                return List.<HotMarket>of();
            }
            Instant from = latestTradeAt.minus(effective);
            List<HotMarket> hot = new ArrayList<>();
            for (MarketState market : markets.values()) {
                if (market.lastTradeAt() == null || market.lastTradeAt().isBefore(from)) {
                    continue;
                }
                long windowTrades = 0;
                BigDecimal windowVolume = BigDecimal.ZERO;
                for (PriceTick tick : market.ticks()) {
                    if (!tick.timestamp().isBefore(from)) {
                        windowTrades++;
                        windowVolume = windowVolume.add(tick.notional());
                    }
                }
                if (windowTrades > 0) {
                    hot.add(new HotMarket(market.conditionId(), windowTrades, windowVolume,
                            market.lastPrices(), market.isResolved()));
                }
            }
            Comparator<HotMarket> primary = sortBy == HotMarketSort.TRADES
                    ? Comparator.comparingLong(HotMarket::windowTrades).reversed()
                    : Comparator.comparing(HotMarket::windowVolume, Comparator.reverseOrder());
            return hot.stream()
                    .sorted(primary.thenComparing(HotMarket::conditionId))
                    .limit(Math.max(0, limit))
                    .toList();
        });
    }

    /**
     * Everyone who traded the market, by total P&L desc then address. Resolved markets report realized P&L only;
     * empty for unknown markets.
     */
    public Optional<List<MarketPnlEntry>> marketPnl(String conditionId, int limit) {
        return read(() -> Optional.ofNullable(markets.get(conditionId)).map(market -> {
            List<MarketPnlEntry> entries = new ArrayList<>();
            for (String address : market.participants()) {
                TraderState trader = traders.get(address);
                BigDecimal realized = BigDecimal.ZERO;
                BigDecimal unrealized = BigDecimal.ZERO;
                for (int outcome = 0; outcome < market.outcomeCount(); outcome++) {
                    Position position = trader.positions().get(new PositionKey(conditionId, outcome));
                    if (position == null) {
                        continue;
                    }
                    realized = realized.add(position.realizedPnl());
                    unrealized = unrealized.add(position.unrealizedPnl(market.lastPrice(outcome)));
                }
                realized = realized.setScale(SCALE, RoundingMode.HALF_UP);
                unrealized = unrealized.setScale(SCALE, RoundingMode.HALF_UP);
                entries.add(new MarketPnlEntry(address, realized, unrealized, realized.add(unrealized),
                        trader.tradesByMarket().getOrDefault(conditionId, 0L)));
            }
            return entries.stream()
                    .sorted(Comparator.comparing(MarketPnlEntry::totalPnl, Comparator.reverseOrder())
                            .thenComparing(MarketPnlEntry::address))
                    .limit(Math.max(0, limit))
                    .toList();
        }));
    }

    public Optional<MarketSnapshot> getMarketState(String conditionId) {
        return read(() -> Optional.ofNullable(markets.get(conditionId))
                .map(m -> new MarketSnapshot(m.conditionId(), m.outcomeCount(), m.lastPrices(), m.tradeCount(),
                        m.volume(), m.lastTradeAt(), m.isResolved(), m.winningOutcomeIndex())));
    }

    public EngineStats stats() {
        return read(() -> new EngineStats(markets.size(), resolvedMarkets, appliedTrades, traders.size(),
                skippedEvents, latestTradeAt));
    }

    private void attribute(MarketState market, String address, TradeSide side, Trade trade, BigDecimal notional,
                           Instant cutoff) {
        String key = EvmAddresses.normalize(address);
        if (key == null || excludedAddresses.contains(key)) {
            return;
        }
        TradeLeg leg = new TradeLeg(key, market.conditionId(), trade.getOutcomeIndex(), side,
                trade.getPrice(), trade.getSize(), notional, trade.getTimestamp());
        TraderState trader = traders.computeIfAbsent(key, TraderState::new);
        trader.record(leg);
        market.addParticipant(key);
        if (market.isResolved()) {
            int winner = market.winningOutcomeIndex();
            boolean won = leg.wins(winner);
            trader.settle(won ? 1 : 0, won ? 0 : 1);
            trader.settlePositions(market.conditionId(), market.outcomeCount(), winner);
        } else {
            market.addUnsettledLeg(leg);
        }
        if (cutoff != null) {
            trader.pruneBefore(cutoff);
        }
    }

    private boolean isApplied(long block, String tradeId) {
        if (!appliedTradeIds.isEmpty() && block < appliedTradeIds.lastKey() - dedupHorizonBlocks) {
            log.debug("Trade {} at block {} is behind the dedup horizon; treated as applied", tradeId, block);
            return true;
        }
        Set<String> ids = appliedTradeIds.get(block);
        return ids != null && ids.contains(tradeId);
    }

    private void markApplied(long block, String tradeId) {
        appliedTradeIds.computeIfAbsent(block, b -> new HashSet<>()).add(tradeId);
        appliedTradeIds.headMap(appliedTradeIds.lastKey() - dedupHorizonBlocks).clear();
    }

    private Instant retentionCutoff() {
        return latestTradeAt == null ? null : latestTradeAt.minus(retention);
    }

    private Duration clamp(Duration window) {
        return window.compareTo(retention) > 0 ? retention : window;
    }

    /** Trims markets and traders that have not traded since their last trim. */
    private void sweep(Instant cutoff) {
        tradesSinceSweep = 0;
        markets.values().forEach(m -> m.pruneTicksBefore(cutoff));
        traders.values().forEach(t -> t.pruneBefore(cutoff));
        log.debug("Retention sweep before {}: {}", cutoff, retainedDetail());
    }

    /** Per-fill detail currently held. */
    Retained retained() {
        return read(this::retainedDetail);
    }

    private Retained retainedDetail() {
        long ticks = 0;
        long unsettled = 0;
        for (MarketState market : markets.values()) {
            ticks += market.ticks().size();
            unsettled += market.unsettledLegs().size();
        }
        long legs = 0;
        for (TraderState trader : traders.values()) {
            legs += trader.recentLegs().size();
        }
        long tradeIds = 0;
        for (Set<String> ids : appliedTradeIds.values()) {
            tradeIds += ids.size();
        }
        return new Retained(ticks, legs, unsettled, tradeIds);
    }

    record Retained(long ticks, long traderLegs, long unsettledAddresses, long tradeIds) {
    }

    private Optional<ArbitrageOpportunity> detect(MarketState market) {
        if (market.isResolved()) {
            return Optional.empty();
        }
        return arbitrageDetector.detect(market.conditionId(), market.lastPrices());
    }

    private List<OpenPosition> openPositions(TraderState trader) {
        List<OpenPosition> open = new ArrayList<>();
        for (Map.Entry<PositionKey, Position> entry : trader.positions().entrySet()) {
            Position position = entry.getValue();
            MarketState market = markets.get(entry.getKey().marketId());
            if (position.isOpen() && market != null && !market.isResolved()) {
                open.add(new OpenPosition(position.netSize().signum() > 0 ? TradeSide.BUY : TradeSide.SELL,
                        position.averageCost(), market.lastPrice(entry.getKey().outcomeIndex())));
            }
        }
        return open;
    }

    private TraderProfile toProfile(TraderState t) {
        List<OpenPosition> open = openPositions(t);
        BigDecimal realized = BigDecimal.ZERO;
        BigDecimal unrealized = BigDecimal.ZERO;
        List<PositionSummary> openSummaries = new ArrayList<>();
        for (Map.Entry<PositionKey, Position> entry : t.positions().entrySet()) {
            PositionKey key = entry.getKey();
            Position position = entry.getValue();
            realized = realized.add(position.realizedPnl());
            MarketState market = markets.get(key.marketId());
            if (!position.isOpen() || market == null || market.isResolved()) {
                continue;
            }
            BigDecimal mark = market.lastPrice(key.outcomeIndex());
            BigDecimal pnl = position.unrealizedPnl(mark);
            unrealized = unrealized.add(pnl);
            openSummaries.add(new PositionSummary(key.marketId(), key.outcomeIndex(), position.netSize(),
                    position.averageCost(), mark, pnl.setScale(SCALE, RoundingMode.HALF_UP)));
        }
        realized = realized.setScale(SCALE, RoundingMode.HALF_UP);
        unrealized = unrealized.setScale(SCALE, RoundingMode.HALF_UP);
        List<PositionSummary> largestOpen = openSummaries.stream()
                .sorted(Comparator.comparing(AnalyticsEngine::exposure, Comparator.reverseOrder())
                        .thenComparing(PositionSummary::marketId)
                        .thenComparingInt(PositionSummary::outcomeIndex))
                .limit(TOP_POSITIONS)
                .toList();
        BigDecimal total = t.buyVolume().add(t.sellVolume());
        long count = t.tradeCount();
        BigDecimal averagePrice = count == 0 ? BigDecimal.ZERO
                : t.priceSum().divide(BigDecimal.valueOf(count), SCALE, RoundingMode.HALF_UP);
        BigDecimal averageNotional = count == 0 ? BigDecimal.ZERO
                : total.divide(BigDecimal.valueOf(count), SCALE, RoundingMode.HALF_UP);
        List<String> topMarkets = t.tradesByMarket().entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue().reversed()
                        .thenComparing(Map.Entry.<String, Long>comparingByKey()))
                .limit(TOP_MARKETS)
                .map(Map.Entry::getKey)
                .toList();
        return new TraderProfile(
                t.address(),
                count,
                t.buyCount(),
                t.sellCount(),
                t.buyVolume(),
                t.sellVolume(),
                total,
                t.tradesByMarket().size(),
                t.wonCount(),
                t.lostCount(),
                open.size(),
                winRatePolicy.estimate(t.wonCount(), t.lostCount(), open).orElse(null),
                averagePrice,
                averageNotional,
                t.firstTradeAt(),
                t.lastTradeAt(),
                t.activeDays(),
                topMarkets,
                realized,
                unrealized,
                realized.add(unrealized),
                largestOpen);
    }

    private static BigDecimal exposure(PositionSummary p) {
        BigDecimal price = p.markPrice() != null ? p.markPrice() : p.averageCost();
        return p.netSize().abs().multiply(price);
    }

    private <T> T write(Supplier<T> action) {
        lock.writeLock().lock();
        try {
            return action.get();
        } finally {
            lock.writeLock().unlock();
        }
    }

    private <T> T read(Supplier<T> action) {
        lock.readLock().lock();
        try {
            return action.get();
        } finally {
            lock.readLock().unlock();
        }
    }
}
