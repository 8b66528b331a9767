package com.polymind.api.controller;

import com.polymind.analytics.engine.AnalyticsEngine;
import com.polymind.domain.Market;
import com.polymind.domain.Trade;
import com.polymind.domain.TradeSide;
import com.polymind.ingestion.decoder.LogFixtures;
import com.polymind.ingestion.registry.TokenRegistry;
import com.polymind.ingestion.store.LedgerStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.AutoConfigureWebTestClient;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.reactive.server.WebTestClient;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.List;

import static com.polymind.ingestion.decoder.LogFixtures.ALICE;
import static com.polymind.ingestion.decoder.LogFixtures.BOB;
import static com.polymind.ingestion.decoder.LogFixtures.CAROL;

/**
 * Read endpoints over a seeded ledger; the indexer and metadata job are off.
 */
@SpringBootTest(properties = {
        "polymind.ingestion.indexer.enabled=false",
        "polymind.ingestion.metadata.enabled=false"
})
@AutoConfigureWebTestClient
@Testcontainers(disabledWithoutDocker = true)
class ReadApiIntegrationTest {

    @Container
    static MongoDBContainer mongo = new MongoDBContainer(DockerImageName.parse("mongo:7"));

    @DynamicPropertySource
    static void mongoProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.data.mongodb.uri", mongo::getReplicaSetUrl);
    }

    private static final String MARKET = LogFixtures.conditionId(1);
    private static final String UNKNOWN_MARKET = LogFixtures.conditionId(2);
    private static final Instant T0 = Instant.parse("2024-06-01T00:00:00Z");

    @Autowired
    WebTestClient webTestClient;
    @Autowired
    LedgerStore ledgerStore;
    @Autowired
    TokenRegistry tokenRegistry;
    @Autowired
    AnalyticsEngine analyticsEngine;
    @Autowired
    MongoTemplate mongoTemplate;

    @BeforeEach
    void seed() {
        Market market = LogFixtures.market(MARKET, 2, 100);
        ledgerStore.saveMarket(market);
        mongoTemplate.updateFirst(Query.query(Criteria.where("_id").is(MARKET)),
                new Update().set("slug", "will-it-rain-in-june").set("question", "Will it rain in June?"), Market.class);
        tokenRegistry.register(market);
        analyticsEngine.applyMarketCreated(market);

        List<Trade> trades = List.of(
                trade(101, 0, ALICE, 0, "0.62"),
                trade(102, 0, CAROL, 1, "0.45"));
        ledgerStore.saveTrades(trades);
        trades.forEach(analyticsEngine::applyTrade);
    }

    @Test
    @DisplayName("GET market returns outcomes and live price state")
    void getMarket() {
        webTestClient.get().uri("/api/v1/markets/" + MARKET)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.conditionId").isEqualTo(MARKET)
                .jsonPath("$.slug").isEqualTo("will-it-rain-in-june")
                .jsonPath("$.outcomes.length()").isEqualTo(2)
                .jsonPath("$.tradeCount").isEqualTo(2)
                .jsonPath("$.status").isEqualTo("OPEN");
    }

    @Test
    void getMarket_invalidId_400() {
        webTestClient.get().uri("/api/v1/markets/0x1234")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("INVALID_CONDITION_ID");
    }

    @Test
    void getMarket_unknown_404() {
        webTestClient.get().uri("/api/v1/markets/" + UNKNOWN_MARKET)
                .exchange()
                .expectStatus().isNotFound()
                .expectBody()
                .jsonPath("$.error").isEqualTo("MARKET_NOT_FOUND");
    }

    @Test
    void searchMarkets_bySlugFragment() {
        webTestClient.get().uri("/api/v1/markets?query=rain")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$[0].conditionId").isEqualTo(MARKET);
    }

    @Test
    void marketTradesAndPriceHistory() {
        webTestClient.get().uri("/api/v1/markets/" + MARKET + "/trades")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.length()").isEqualTo(2)
                .jsonPath("$[0].blockNumber").isEqualTo(102);

        webTestClient.get().uri("/api/v1/markets/" + MARKET + "/price-history?outcomeIndex=0")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.length()").isEqualTo(1);
    }

    @Test
    @DisplayName("YES 0.62 + NO 0.45: arbitrage endpoint reports SELL_ALL")
    void arbitrage() {
        webTestClient.get().uri("/api/v1/markets/" + MARKET + "/arbitrage")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.direction").isEqualTo("SELL_ALL")
                .jsonPath("$.slug").isEqualTo("will-it-rain-in-june");

        webTestClient.get().uri("/api/v1/arbitrage")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$[0].conditionId").isEqualTo(MARKET);
    }

    @Test
    void hotMarkets_invalidSort_400() {
        webTestClient.get().uri("/api/v1/markets/hot?sortBy=price")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("INVALID_SORT");

        webTestClient.get().uri("/api/v1/markets/hot?sortBy=trades")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$[0].conditionId").isEqualTo(MARKET)
                .jsonPath("$[0].windowTrades").isEqualTo(2);
    }

    @Test
    @DisplayName("trader profile: 200 with labels, 400 for a malformed address, 404 without fills")
    void traderProfile() {
        webTestClient.get().uri("/api/v1/traders/" + ALICE)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.address").isEqualTo(ALICE)
                .jsonPath("$.tradeCount").isEqualTo(1)
                .jsonPath("$.labels").isArray()
                .jsonPath("$.tradingStyle").isEqualTo("INSUFFICIENT_DATA")
                .jsonPath("$.realizedPnl").isNumber()
                .jsonPath("$.openPositions.length()").isEqualTo(1)
                .jsonPath("$.openPositions[0].netSize").isEqualTo(10)
                .jsonPath("$.riskLevel").exists();

        webTestClient.get().uri("/api/v1/traders/not-an-address")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("INVALID_ADDRESS");

        webTestClient.get().uri("/api/v1/traders/0x0000000000000000000000000000000000000001")
                .exchange()
                .expectStatus().isNotFound()
                .expectBody()
                .jsonPath("$.error").isEqualTo("TRADER_NOT_FOUND");
    }

    @Test
    @DisplayName("market P&L lists every participant; unknown market 404")
    void marketPnlLeaderboard() {
        webTestClient.get().uri("/api/v1/markets/" + MARKET + "/pnl")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.length()").isEqualTo(3)
                .jsonPath("$[0].rank").isEqualTo(1)
                .jsonPath("$[0].totalPnl").exists();

        webTestClient.get().uri("/api/v1/markets/" + UNKNOWN_MARKET + "/pnl")
                .exchange()
                .expectStatus().isNotFound();
    }

    @Test
    void windowBeyondRetention_400() {
        webTestClient.get().uri("/api/v1/smart-money?windowHours=10000")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("INVALID_WINDOW");

        webTestClient.get().uri("/api/v1/markets/hot?windowHours=169")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("INVALID_WINDOW");
    }

    @Test
    void traderTrades_makerOrTaker() {
        webTestClient.get().uri("/api/v1/traders/" + BOB + "/trades")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.length()").isEqualTo(2);
    }

    @Test
    void largeTrades_negativeThreshold_400() {
        webTestClient.get().uri("/api/v1/trades/large?minNotional=-1")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("INVALID_NOTIONAL");
    }

    @Test
    void smartMoney_belowMinimumTrades_empty() {
        webTestClient.get().uri("/api/v1/smart-money?windowHours=24")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.windowHours").isEqualTo(24)
                .jsonPath("$.entries.length()").isEqualTo(0);
    }

    @Test
    void statsAndIndexerStatus() {
        webTestClient.get().uri("/api/v1/stats")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.markets").isEqualTo(1)
                .jsonPath("$.storedTrades").isEqualTo(2)
                .jsonPath("$.registeredTokens").isEqualTo(2)
                .jsonPath("$.indexerState").isEqualTo("IDLE");

        webTestClient.get().uri("/api/v1/indexer/status")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.state").isEqualTo("IDLE")
                .jsonPath("$.cursorBlock").isEqualTo(-1);
    }

    private static Trade trade(long block, int logIndex, String maker, int outcome, String price) {
        Trade trade = new Trade();
        trade.setTxHash(LogFixtures.txHash(block, logIndex));
        trade.setLogIndex(logIndex);
        trade.setId(Trade.idOf(trade.getTxHash(), logIndex));
        trade.setBlockNumber(block);
        trade.setExchange(LogFixtures.CTF_EXCHANGE);
        trade.setMarketId(MARKET);
        trade.setOutcomeIndex(outcome);
        trade.setTokenId(LogFixtures.tokenId(MARKET, outcome).toString());
        trade.setSide(TradeSide.BUY);
        trade.setMaker(maker);
        trade.setTaker(BOB);
        trade.setPrice(new BigDecimal(price));
        trade.setSize(BigDecimal.TEN);
        trade.setNotional(new BigDecimal(price).multiply(BigDecimal.TEN).setScale(6, RoundingMode.HALF_UP));
        trade.setFee(BigDecimal.ZERO);
        trade.setTimestamp(T0.plusSeconds(block));
        return trade;
    }
}
