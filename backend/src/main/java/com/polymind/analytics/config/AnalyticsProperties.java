package com.polymind.analytics.config;

import com.polymind.analytics.profile.WinRatePolicy;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Analytics engine settings (polymind.analytics).
 */
@ConfigurationProperties(prefix = "polymind.analytics")
@Getter
@Setter
public class AnalyticsProperties {

    /** Flag a market when |1 - sum(outcome prices)| is strictly greater than this. */
    private BigDecimal arbitrageThreshold = new BigDecimal("0.02");
    private BigDecimal arbitrageHighConfidenceThreshold = new BigDecimal("0.05");
    private WinRatePolicy winRatePolicy = WinRatePolicy.MARK_TO_LAST_PRICE;
    /**
     * Counterparties that are contracts, not traders (the exchanges fill as taker in matched orders).
     * Fills are not attributed to these addresses.
     */
    private List<String> excludedAddresses = new ArrayList<>(List.of(
            "0x4bfb41d5b3570defd03c39a9a4d8de6bd8b8982e",
            "0xc5d563a36ae78145c45a50134d48a1215220f80a"));
    private SmartMoney smartMoney = new SmartMoney();
    private int defaultHotWindowHours = 24;
    /**
     * How far behind the latest trade dated fills are kept for windowed rankings. Raised to the largest default
     * window when set below it; wider requested windows are cut to this.
     */
    private int retentionHours = 168;
    /** Trade ids are remembered for this many blocks behind the newest applied block; must exceed one fetch batch. */
    private long dedupHorizonBlocks = 50_000;

    @Getter
    @Setter
    public static class SmartMoney {
        /** Minimum fills inside the window to be ranked. */
        private int minTrades = 5;
        private BigDecimal winRateWeight = new BigDecimal("0.5");
        private BigDecimal volumeWeight = new BigDecimal("0.3");
        private BigDecimal recencyWeight = new BigDecimal("0.2");
        private int defaultWindowHours = 168;
    }
}
