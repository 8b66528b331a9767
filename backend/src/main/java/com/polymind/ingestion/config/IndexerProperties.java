package com.polymind.ingestion.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Block-range indexer settings (polymind.ingestion.indexer).
 */
@ConfigurationProperties(prefix = "polymind.ingestion.indexer")
@Getter
@Setter
public class IndexerProperties {

    private boolean enabled = true;
    private String cursorId = "polygon-ctf-exchange";
    private int batchSize = 1_000;
    /** First block to index when no cursor is persisted. Null means head - initialLookbackBlocks. */
    private Long startBlock;
    private long initialLookbackBlocks = 1_000L;
    private long pollIntervalMs = 12_000L;
    private long maxPollIntervalMs = 120_000L;
}
