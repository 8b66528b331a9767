package com.polymind.ingestion.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Gamma API: slug/question enrichment and the active-market catalogue (polymind.ingestion.metadata).
 */
@ConfigurationProperties(prefix = "polymind.ingestion.metadata")
@Getter
@Setter
public class MarketMetadataProperties {

    private boolean enabled = true;
    private String gammaBaseUrl = "https://gamma-api.polymarket.com";
    private int batchSize = 20;
    private long requestTimeoutMs = 10_000L;
    /** Read by the enrichment job's @Scheduled placeholders. */
    private long scheduleIntervalMs = 60_000L;
    private long initialDelayMs = 30_000L;

    /** Seeds markets and their token ids from the Gamma catalogue, so fills of markets created before the indexed range resolve. */
    private boolean catalogEnabled = true;
    private int catalogPageSize = 100;
    private int catalogMaxMarkets = 2_000;
    private long catalogIntervalMs = 900_000L;
    private long catalogInitialDelayMs = 900_000L;
}
