package com.polymind.ingestion.metadata;

import com.polymind.domain.Market;
import com.polymind.domain.OutcomeToken;
import com.polymind.ingestion.config.IndexerProperties;
import com.polymind.ingestion.config.MarketMetadataProperties;
import com.polymind.ingestion.registry.CatalogMarketQueue;
import com.polymind.ingestion.store.LedgerStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Seeds markets from the Gamma active-market catalogue with the token ids the exchange trades, so fills of markets
 * prepared before the indexed range decode instead of failing as unknown tokens.
 * <p>
 * Markets are persisted here (insert-only, never overwriting chain data) and queued for the indexer thread, which
 * registers them before its next fetch. With the indexer disabled they are only persisted; the next startup replay
 * loads them. The first run happens on the indexer thread before its loop starts.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class MarketCatalogSyncJob {

    private final MarketMetadataClient metadataClient;
    private final LedgerStore ledgerStore;
    private final CatalogMarketQueue catalogQueue;
    private final MarketMetadataProperties properties;
    private final IndexerProperties indexerProperties;

    @Scheduled(fixedDelayString = "${polymind.ingestion.metadata.catalog-interval-ms:900000}",
            initialDelayString = "${polymind.ingestion.metadata.catalog-initial-delay-ms:900000}")
    public void runScheduled() {
        syncCatalog();
    }

    /**
     * Pages through the catalogue up to the configured maximum. A failed page ends the run; markets already
     * seeded stay seeded.
     *
     * @return markets persisted
     */
    public int syncCatalog() {
        if (!properties.isEnabled() || !properties.isCatalogEnabled()) {
            return 0;
        }
        int pageSize = Math.max(1, properties.getCatalogPageSize());
        int max = Math.max(0, properties.getCatalogMaxMarkets());
        int seeded = 0;
        int offset = 0;
        while (offset < max) {
            List<GammaMarket> page;
            try {
                page = metadataClient.fetchActivePage(offset, Math.min(pageSize, max - offset));
            } catch (MarketMetadataException e) {
                log.warn("Market catalogue sync stopped at offset {}: {}", offset, e.getMessage());
                break;
            }
            for (GammaMarket gamma : page) {
                Market market = toMarket(gamma);
                ledgerStore.saveMarket(market);
                if (indexerProperties.isEnabled()) {
                    catalogQueue.offer(market);
                }
                seeded++;
            }
            if (page.size() < pageSize) {
                break;
            }
            offset += pageSize;
        }
        if (seeded > 0) {
            log.info("Market catalogue: seeded {} market(s) from Gamma", seeded);
        }
        return seeded;
    }

    /** createdBlock stays 0: the preparation block is not known from the catalogue. */
    public static Market toMarket(GammaMarket gamma) {
        int slots = gamma.tokenIds().size();
        List<OutcomeToken> outcomes = new ArrayList<>(slots);
        for (int i = 0; i < slots; i++) {
            String label = gamma.outcomeLabels().get(i);
            outcomes.add(new OutcomeToken(gamma.tokenIds().get(i), gamma.conditionId(), i,
                    label == null || label.isBlank()
                            ? OutcomeToken.labelFor(i, slots)
                            : label.trim().toUpperCase(Locale.ROOT)));
        }
        Market market = new Market();
        market.setConditionId(gamma.conditionId());
        market.setSlug(gamma.slug());
        market.setQuestion(gamma.question());
        market.setOutcomeSlotCount(slots);
        market.setOutcomes(outcomes);
        market.setMetadataFetchedAt(Instant.now());
        return market;
    }
}
