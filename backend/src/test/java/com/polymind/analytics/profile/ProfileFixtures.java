package com.polymind.analytics.profile;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/** Builder-style factory for {@link TraderProfile} in label, style and risk tests. */
final class ProfileFixtures {

    long tradeCount = 20;
    long buyCount = 10;
    long sellCount = 10;
    BigDecimal totalVolume = new BigDecimal("2000");
    int distinctMarkets = 3;
    long won;
    long lost;
    BigDecimal winRate;
    BigDecimal averagePrice = new BigDecimal("0.5");
    BigDecimal averageNotional = new BigDecimal("100");
    int activeDays = 4;

    static ProfileFixtures profile() {
        return new ProfileFixtures();
    }

    ProfileFixtures trades(long total, long buys, long sells) {
        this.tradeCount = total;
        this.buyCount = buys;
        this.sellCount = sells;
        return this;
    }

    ProfileFixtures volume(String volume) {
        this.totalVolume = new BigDecimal(volume);
        return this;
    }

    ProfileFixtures markets(int markets) {
        this.distinctMarkets = markets;
        return this;
    }

    ProfileFixtures winRate(String rate) {
        this.winRate = rate == null ? null : new BigDecimal(rate);
        return this;
    }

    ProfileFixtures averagePrice(String price) {
        this.averagePrice = new BigDecimal(price);
        return this;
    }

    ProfileFixtures averageNotional(String notional) {
        this.averageNotional = new BigDecimal(notional);
        return this;
    }

    ProfileFixtures activeDays(int days) {
        this.activeDays = days;
        return this;
    }

    TraderProfile build() {
        BigDecimal half = totalVolume.divide(BigDecimal.valueOf(2));
        return new TraderProfile("0x00000000000000000000000000000000000a11ce", tradeCount, buyCount, sellCount,
                half, half, totalVolume, distinctMarkets, won, lost, 0, winRate, averagePrice, averageNotional,
                Instant.parse("2024-01-01T00:00:00Z"), Instant.parse("2024-01-04T00:00:00Z"), activeDays, List.of(),
                BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, List.of());
    }
}
