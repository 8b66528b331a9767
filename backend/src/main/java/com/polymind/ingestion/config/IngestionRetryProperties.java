package com.polymind.ingestion.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Indexer backoff for transient fetch failures (polymind.ingestion.retry). Retries are unbounded.
 */
@ConfigurationProperties(prefix = "polymind.ingestion.retry")
@Getter
@Setter
public class IngestionRetryProperties {

    private long baseDelayMs = 1_000L;
    private double jitterFactor = 0.2;
    private long maxDelayMs = 60_000L;
}
