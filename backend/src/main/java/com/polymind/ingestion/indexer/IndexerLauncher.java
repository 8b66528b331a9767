package com.polymind.ingestion.indexer;

import com.polymind.config.AsyncConfig;
import com.polymind.ingestion.config.IndexerProperties;
import com.polymind.ingestion.metadata.MarketCatalogSyncJob;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * On startup: replay the ledger, then on the indexer's single-thread executor seed the market catalogue and run the loop.
 * Replay runs even with the indexer disabled so the read API serves persisted data.
 */
@Component
@Slf4j
public class IndexerLauncher {

    private final AtomicBoolean started = new AtomicBoolean(false);

    private final LedgerReplayService ledgerReplayService;
    private final BlockRangeIndexer indexer;
    private final MarketCatalogSyncJob catalogSyncJob;
    private final IndexerProperties properties;
    private final Executor indexerExecutor;

    public IndexerLauncher(LedgerReplayService ledgerReplayService,
                           BlockRangeIndexer indexer,
                           MarketCatalogSyncJob catalogSyncJob,
                           IndexerProperties properties,
                           @Qualifier(AsyncConfig.INDEXER_EXECUTOR) Executor indexerExecutor) {
        this.ledgerReplayService = ledgerReplayService;
        this.indexer = indexer;
        this.catalogSyncJob = catalogSyncJob;
        this.properties = properties;
        this.indexerExecutor = indexerExecutor;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        ledgerReplayService.rebuild();
        if (!properties.isEnabled()) {
            log.info("Indexer disabled (polymind.ingestion.indexer.enabled=false)");
            return;
        }
        indexerExecutor.execute(() -> {
            catalogSyncJob.syncCatalog();
            indexer.runLoop();
        });
    }

    @PreDestroy
    public void shutdown() {
        indexer.stop();
    }
}
