package com.polymind.ingestion.decoder;

import com.polymind.domain.OutcomeToken;
import com.polymind.domain.TradeSide;
import com.polymind.ingestion.adapter.RawLog;
import com.polymind.ingestion.registry.TokenRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.time.Instant;
import java.util.List;
import java.util.Random;

import static com.polymind.ingestion.decoder.LogFixtures.ALICE;
import static com.polymind.ingestion.decoder.LogFixtures.BOB;
import static org.assertj.core.api.Assertions.assertThat;

class EventDecoderTest {

    private static final Instant T0 = Instant.parse("2024-03-01T12:00:00Z");
    private static final String MARKET = LogFixtures.conditionId(1);

    private TokenRegistry registry;
    private EventDecoder decoder;

    @BeforeEach
    void setUp() {
        registry = new TokenRegistry();
        decoder = new EventDecoder(registry, LogFixtures.TOKEN_IDS);
    }

    @Test
    @DisplayName("BUY fill: maker pays collateral, price is collateral per token")
    void buyFill_decodesSidePriceAndParties() {
        registry.register(LogFixtures.market(MARKET, 2, 10));

        DecodeResult result = decoder.decode(LogFixtures.buy(11, 3, ALICE, BOB, MARKET, 0, 620_000, 1_000_000, T0));

        assertThat(result.isSuccess()).isTrue();
        TradeFilled fill = (TradeFilled) result.getEvent().orElseThrow();
        assertThat(fill.side()).isEqualTo(TradeSide.BUY);
        assertThat(fill.price()).isEqualByComparingTo("0.62");
        assertThat(fill.size()).isEqualByComparingTo("1");
        assertThat(fill.maker()).isEqualTo(ALICE);
        assertThat(fill.taker()).isEqualTo(BOB);
        assertThat(fill.token().getConditionId()).isEqualTo(MARKET);
        assertThat(fill.token().getOutcomeIndex()).isZero();
        assertThat(fill.exchange()).isEqualTo(LogFixtures.CTF_EXCHANGE);
        assertThat(fill.timestamp()).isEqualTo(T0);
    }

    @Test
    @DisplayName("SELL fill: maker gives tokens, price derived from taker collateral")
    void sellFill_decodesSide() {
        registry.register(LogFixtures.market(MARKET, 2, 10));

        TradeFilled fill = (TradeFilled) decoder.decode(
                LogFixtures.sell(11, 0, ALICE, BOB, MARKET, 1, 1_250_000, 5_000_000, T0)).getEvent().orElseThrow();

        assertThat(fill.side()).isEqualTo(TradeSide.SELL);
        assertThat(fill.price()).isEqualByComparingTo("0.25");
        assertThat(fill.size()).isEqualByComparingTo("5");
        assertThat(fill.token().getOutcomeIndex()).isEqualTo(1);
    }

    @Test
    void price_roundsHalfUpToSixDecimals() {
        assertThat(EventDecoder.toPrice(BigInteger.ONE, BigInteger.valueOf(3)))
                .isEqualTo(new BigDecimal("0.333333"));
        assertThat(EventDecoder.toPrice(BigInteger.TWO, BigInteger.valueOf(3)))
                .isEqualTo(new BigDecimal("0.666667"));
    }

    @Test
    @DisplayName("decoded price re-encodes to the on-chain ratio within one fixed-point unit")
    void price_reencodesWithinOneUnitOfChainRatio() {
        registry.register(LogFixtures.market(MARKET, 2, 10));
        Random random = new Random(20240301L);
        BigDecimal oneUnit = BigDecimal.ONE;

        for (int i = 0; i < 500; i++) {
            // up to ten million outcome tokens in 6-decimal units
            long tokenUnits = random.nextLong(1_000_000L, 10_000_000_000_000L);
            long collateralUnits = random.nextLong(Math.max(1L, tokenUnits / 1_000_000L + 1), tokenUnits - tokenUnits / 1_000_000L);
            boolean buy = random.nextBoolean();
            int outcome = random.nextInt(2);
            RawLog log = buy
                    ? LogFixtures.buy(11, i, ALICE, BOB, MARKET, outcome, collateralUnits, tokenUnits, T0)
                    : LogFixtures.sell(11, i, ALICE, BOB, MARKET, outcome, collateralUnits, tokenUnits, T0);

            DecodeResult result = decoder.decode(log);

            assertThat(result.isSuccess()).as("fill %d: %d / %d", i, collateralUnits, tokenUnits).isTrue();
            TradeFilled fill = (TradeFilled) result.getEvent().orElseThrow();
            assertThat(fill.side()).isEqualTo(buy ? TradeSide.BUY : TradeSide.SELL);
            BigDecimal chainRatio = new BigDecimal(collateralUnits).movePointRight(EventDecoder.PRICE_SCALE)
                    .divide(new BigDecimal(tokenUnits), MathContext.DECIMAL128);
            BigDecimal reencoded = fill.price().movePointRight(EventDecoder.PRICE_SCALE);
            assertThat(reencoded.stripTrailingZeros().scale()).isLessThanOrEqualTo(0);
            assertThat(reencoded.subtract(chainRatio).abs())
                    .as("fill %d: %d / %d", i, collateralUnits, tokenUnits)
                    .isLessThanOrEqualTo(oneUnit);
            assertThat(fill.size().movePointRight(EventDecoder.AMOUNT_DECIMALS))
                    .isEqualByComparingTo(new BigDecimal(tokenUnits));
        }
    }

    @Test
    @DisplayName("every event kind has exactly one permitted event record")
    void domainEvent_closedOverEventKinds() {
        assertThat(DomainEvent.class.isSealed()).isTrue();
        assertThat(DomainEvent.class.getPermittedSubclasses())
                .containsExactlyInAnyOrder(MarketCreated.class, MarketResolved.class, TradeFilled.class,
                        Unrecognized.class)
                .hasSize(EventKind.values().length)
                .allMatch(Class::isRecord);
    }

    @Test
    @DisplayName("price of 1 or more is INVALID_PRICE")
    void priceAtOrAboveOne_invalidPrice() {
        registry.register(LogFixtures.market(MARKET, 2, 10));

        DecodeResult result = decoder.decode(LogFixtures.buy(11, 0, ALICE, BOB, MARKET, 0, 1_000_000, 1_000_000, T0));

        assertThat(result.getError()).contains(DecodeError.INVALID_PRICE);
    }

    @Test
    void zeroTokenAmount_invalidPrice() {
        registry.register(LogFixtures.market(MARKET, 2, 10));

        DecodeResult result = decoder.decode(LogFixtures.buy(11, 0, ALICE, BOB, MARKET, 0, 100, 0, T0));

        assertThat(result.getError()).contains(DecodeError.INVALID_PRICE);
    }

    @Test
    @DisplayName("token-for-token fill has no collateral leg")
    void noCollateralLeg_invalidPrice() {
        registry.register(LogFixtures.market(MARKET, 2, 10));
        RawLog log = LogFixtures.orderFilled(11, 0, ALICE, BOB,
                LogFixtures.tokenId(MARKET, 0), LogFixtures.tokenId(MARKET, 1), 10, 20, T0);

        assertThat(decoder.decode(log).getError()).contains(DecodeError.INVALID_PRICE);
    }

    @Test
    void unregisteredToken_unknownToken() {
        DecodeResult result = decoder.decode(LogFixtures.buy(11, 0, ALICE, BOB, MARKET, 0, 500_000, 1_000_000, T0));

        assertThat(result.getError()).contains(DecodeError.UNKNOWN_TOKEN);
        assertThat(result.getDetail()).isEqualTo(LogFixtures.tokenId(MARKET, 0).toString());
    }

    @Test
    void missingTopic_malformed() {
        RawLog full = LogFixtures.buy(11, 0, ALICE, BOB, MARKET, 0, 500_000, 1_000_000, T0);
        RawLog truncated = new RawLog(full.address(), full.topics().subList(0, 3), full.data(),
                full.blockNumber(), full.logIndex(), full.transactionHash(), T0);

        assertThat(decoder.decode(truncated).getError()).contains(DecodeError.MALFORMED_LOG);
    }

    @Test
    void shortData_malformed() {
        RawLog full = LogFixtures.buy(11, 0, ALICE, BOB, MARKET, 0, 500_000, 1_000_000, T0);
        RawLog shortData = new RawLog(full.address(), full.topics(), full.data().substring(0, 2 + 64 * 4),
                11, 0, full.transactionHash(), T0);

        assertThat(decoder.decode(shortData).getError()).contains(DecodeError.MALFORMED_LOG);
    }

    @Test
    @DisplayName("ConditionPreparation derives one token per outcome slot")
    void conditionPreparation_marketCreated() {
        MarketCreated created = (MarketCreated) decoder.decode(
                LogFixtures.conditionPreparation(10, 0, MARKET, 3, T0)).getEvent().orElseThrow();

        assertThat(created.conditionId()).isEqualTo(MARKET);
        assertThat(created.oracle()).isEqualTo(LogFixtures.ORACLE);
        assertThat(created.outcomeSlotCount()).isEqualTo(3);
        assertThat(created.outcomes()).extracting(OutcomeToken::getOutcomeIndex).containsExactly(0, 1, 2);
        assertThat(created.outcomes()).extracting(OutcomeToken::getOutcomeLabel)
                .containsExactly("OUTCOME_0", "OUTCOME_1", "OUTCOME_2");
        assertThat(created.outcomes().get(1).getTokenId()).isEqualTo(LogFixtures.tokenId(MARKET, 1).toString());
    }

    @Test
    void conditionPreparation_uppercaseConditionIdNormalised() {
        MarketCreated created = (MarketCreated) decoder.decode(
                LogFixtures.conditionPreparation(10, 0, MARKET.toUpperCase().replace("0X", "0x"), 2, T0))
                .getEvent().orElseThrow();

        assertThat(created.conditionId()).isEqualTo(MARKET);
        assertThat(created.outcomes()).extracting(OutcomeToken::getOutcomeLabel).containsExactly("YES", "NO");
    }

    @Test
    void conditionPreparation_singleSlot_malformed() {
        assertThat(decoder.decode(LogFixtures.conditionPreparation(10, 0, MARKET, 1, T0)).getError())
                .contains(DecodeError.MALFORMED_LOG);
    }

    @Test
    @DisplayName("ConditionResolution picks the outcome with the largest payout")
    void conditionResolution_winnerIsArgMax() {
        MarketResolved resolved = (MarketResolved) decoder.decode(
                LogFixtures.conditionResolution(20, 1, MARKET, List.of(0L, 1L), T0)).getEvent().orElseThrow();

        assertThat(resolved.conditionId()).isEqualTo(MARKET);
        assertThat(resolved.winningOutcomeIndex()).isEqualTo(1);
        assertThat(resolved.payoutNumerators()).containsExactly(BigInteger.ZERO, BigInteger.ONE);
    }

    @Test
    @DisplayName("split payout has no single winner")
    void conditionResolution_tie_malformed() {
        assertThat(decoder.decode(LogFixtures.conditionResolution(20, 1, MARKET, List.of(1L, 1L), T0)).getError())
                .contains(DecodeError.MALFORMED_LOG);
        assertThat(decoder.decode(LogFixtures.conditionResolution(20, 1, MARKET, List.of(0L, 0L), T0)).getError())
                .contains(DecodeError.MALFORMED_LOG);
    }

    @Test
    void unknownTopic_unrecognized() {
        RawLog log = new RawLog(LogFixtures.CTF_EXCHANGE, List.of(LogFixtures.bytes32(42)), "0x", 5, 0, "0xabc", T0);

        DecodeResult result = decoder.decode(log);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getEvent().orElseThrow().kind()).isEqualTo(EventKind.UNRECOGNIZED);
        assertThat(decoder.kindOf(log)).isEqualTo(EventKind.UNRECOGNIZED);
    }

    @Test
    void kindOf_topicCaseInsensitive() {
        RawLog log = new RawLog(LogFixtures.CTF_EXCHANGE, List.of(EventSignatures.ORDER_FILLED_TOPIC.toUpperCase()
                .replace("0X", "0x")), "0x", 5, 0, "0xabc", T0);

        assertThat(decoder.kindOf(log)).isEqualTo(EventKind.TRADE_FILLED);
    }
}
