package com.polymind.ingestion.store;

import com.polymind.config.MongoConfig;
import com.polymind.domain.Market;
import com.polymind.domain.MarketStatus;
import com.polymind.domain.Trade;
import com.polymind.domain.TradeSide;
import com.polymind.ingestion.decoder.LogFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.data.mongo.DataMongoTest;
import org.springframework.context.annotation.Import;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.IndexInfo;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DataMongoTest(properties = "spring.data.mongodb.auto-index-creation=true")
@Testcontainers(disabledWithoutDocker = true)
@Import({MongoConfig.class, MongoLedgerStore.class})
class MongoLedgerStoreIntegrationTest {

    @Container
    static MongoDBContainer mongo = new MongoDBContainer(DockerImageName.parse("mongo:7"));

    @DynamicPropertySource
    static void mongoProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.data.mongodb.uri", mongo::getReplicaSetUrl);
    }

    private static final String MARKET = LogFixtures.conditionId(1);
    private static final Instant T0 = Instant.parse("2024-06-01T00:00:00Z");

    @Autowired
    MongoLedgerStore store;
    @Autowired
    MongoTemplate mongoTemplate;

    @BeforeEach
    void clean() {
        mongoTemplate.remove(new Query(), Market.class);
        mongoTemplate.remove(new Query(), Trade.class);
    }

    @Test
    @DisplayName("saveMarket is an insert-only upsert: later saves never overwrite")
    void saveMarket_idempotent() {
        Market market = LogFixtures.market(MARKET, 2, 100);
        store.saveMarket(market);
        Market again = LogFixtures.market(MARKET, 2, 999);
        again.setOracle("0x0000000000000000000000000000000000000001");

        store.saveMarket(again);

        List<Market> markets = store.loadMarkets();
        assertThat(markets).hasSize(1);
        assertThat(markets.get(0).getCreatedBlock()).isEqualTo(100);
        assertThat(markets.get(0).getOracle()).isEqualTo(LogFixtures.ORACLE);
        assertThat(markets.get(0).getOutcomes()).hasSize(2);
        assertThat(markets.get(0).getStatus()).isEqualTo(MarketStatus.OPEN);
    }

    @Test
    void markResolved_onlyOnce() {
        store.saveMarket(LogFixtures.market(MARKET, 2, 100));

        assertThat(store.markResolved(MARKET, 1, List.of(BigInteger.ZERO, BigInteger.ONE), 200, T0)).isTrue();
        assertThat(store.markResolved(MARKET, 0, List.of(BigInteger.ONE, BigInteger.ZERO), 201, T0)).isFalse();
        assertThat(store.markResolved(LogFixtures.conditionId(9), 0, List.of(BigInteger.ONE), 201, T0)).isFalse();

        Market market = store.loadMarkets().get(0);
        assertThat(market.isResolved()).isTrue();
        assertThat(market.getWinningOutcomeIndex()).isEqualTo(1);
        assertThat(market.getPayoutNumerators()).containsExactly("0", "1");
        assertThat(market.getResolvedBlock()).isEqualTo(200L);
    }

    @Test
    @DisplayName("saveTrades upserts by txHash:logIndex and keeps Decimal128 precision")
    void saveTrades_idempotentUpsert() {
        List<Trade> batch = List.of(trade(10, 1, "0.623456"), trade(10, 0, "0.5"), trade(9, 3, "0.1"));

        store.saveTrades(batch);
        store.saveTrades(batch);

        assertThat(mongoTemplate.count(new Query(), Trade.class))
                .isEqualTo(3);
        List<Trade> ordered = new ArrayList<>();
        store.forEachTradeInChainOrder(ordered::add);
        assertThat(ordered).extracting(Trade::getId).containsExactly("0xtx9:3", "0xtx10:0", "0xtx10:1");
        assertThat(ordered.get(2).getPrice()).isEqualByComparingTo("0.623456");
        assertThat(ordered.get(2).getNotional()).isEqualByComparingTo("6.23456");
        assertThat(ordered.get(2).getSide()).isEqualTo(TradeSide.BUY);
    }

    @Test
    void tradeChainOrderIndexCreated() {
        store.saveTrades(List.of(trade(1, 0, "0.5")));

        List<IndexInfo> indexes = mongoTemplate.indexOps(Trade.class).getIndexInfo();

        assertThat(indexes).extracting(IndexInfo::getName).contains("chain_order", "market_chain_order");
    }

    private static Trade trade(long block, int logIndex, String price) {
        Trade trade = new Trade();
        trade.setTxHash("0xtx" + block);
        trade.setLogIndex(logIndex);
        trade.setBlockNumber(block);
        trade.setMarketId(MARKET);
        trade.setOutcomeIndex(0);
        trade.setSide(TradeSide.BUY);
        trade.setMaker(LogFixtures.ALICE);
        trade.setTaker(LogFixtures.BOB);
        trade.setPrice(new BigDecimal(price));
        trade.setSize(BigDecimal.TEN);
        trade.setNotional(new BigDecimal(price).multiply(BigDecimal.TEN));
        trade.setFee(BigDecimal.ZERO);
        trade.setTimestamp(T0);
        return trade;
    }
}
