package com.polymind.analytics.profile;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.polymind.analytics.profile.ProfileFixtures.profile;
import static org.assertj.core.api.Assertions.assertThat;

class TradingStyleClassifierTest {

    private final TradingStyleClassifier classifier = new TradingStyleClassifier();

    @Test
    void fewerThanThreeTrades_insufficientData() {
        assertThat(classifier.classify(profile().trades(2, 1, 1).build())).isEqualTo(TradingStyle.INSUFFICIENT_DATA);
        assertThat(classifier.classify(null)).isEqualTo(TradingStyle.INSUFFICIENT_DATA);
    }

    @Test
    @DisplayName("more than five small fills per active day is scalping")
    void scalper_manySmallFillsPerDay() {
        assertThat(classifier.classify(profile().trades(30, 15, 15).activeDays(5).averageNotional("50").build()))
                .isEqualTo(TradingStyle.SCALPER);
        // exactly five per day does not qualify
        assertThat(classifier.classify(profile().trades(25, 20, 5).activeDays(5).averageNotional("50").build()))
                .isEqualTo(TradingStyle.MIXED);
    }

    @Test
    void valueInvestor_fewLargeFills() {
        assertThat(classifier.classify(profile().trades(10, 8, 2).averageNotional("800").build()))
                .isEqualTo(TradingStyle.VALUE_INVESTOR);
        assertThat(classifier.classify(profile().trades(20, 18, 2).averageNotional("800").build()))
                .isEqualTo(TradingStyle.MIXED);
    }

    @Test
    void focused_fewMarketsHighWinRate() {
        assertThat(classifier.classify(profile().trades(20, 16, 4).markets(2).winRate("0.7").build()))
                .isEqualTo(TradingStyle.FOCUSED);
        assertThat(classifier.classify(profile().trades(20, 16, 4).markets(2).winRate("0.55").build()))
                .isEqualTo(TradingStyle.MIXED);
    }

    @Test
    void diversified_moreThanFiveMarkets() {
        assertThat(classifier.classify(profile().markets(6).build())).isEqualTo(TradingStyle.DIVERSIFIED);
    }

    @Test
    @DisplayName("balanced buy/sell counts read as arbitrage, skewed ones as mixed")
    void buyRatio_balancedOrMixed() {
        assertThat(classifier.classify(profile().trades(20, 10, 10).build())).isEqualTo(TradingStyle.ARBITRAGEUR);
        assertThat(classifier.classify(profile().trades(20, 12, 8).build())).isEqualTo(TradingStyle.ARBITRAGEUR);
        assertThat(classifier.classify(profile().trades(20, 13, 7).build())).isEqualTo(TradingStyle.MIXED);
    }

    @Test
    void firstMatchingRuleWins() {
        // small frequent fills across many markets: scalper before diversified
        TraderProfile p = profile().trades(60, 30, 30).markets(8).activeDays(4).averageNotional("20").build();

        assertThat(classifier.classify(p)).isEqualTo(TradingStyle.SCALPER);
    }
}
