package com.polymind.ingestion.metadata;

import com.polymind.domain.Market;
import com.polymind.domain.OutcomeToken;
import com.polymind.ingestion.config.IndexerProperties;
import com.polymind.ingestion.config.MarketMetadataProperties;
import com.polymind.ingestion.registry.CatalogMarketQueue;
import com.polymind.ingestion.store.LedgerStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MarketCatalogSyncJobTest {

    @Mock
    MarketMetadataClient metadataClient;
    @Mock
    LedgerStore ledgerStore;

    private MarketMetadataProperties properties;
    private IndexerProperties indexerProperties;
    private CatalogMarketQueue queue;
    private MarketCatalogSyncJob job;

    @BeforeEach
    void setUp() {
        properties = new MarketMetadataProperties();
        properties.setCatalogPageSize(2);
        properties.setCatalogMaxMarkets(10);
        indexerProperties = new IndexerProperties();
        queue = new CatalogMarketQueue();
        job = new MarketCatalogSyncJob(metadataClient, ledgerStore, queue, properties, indexerProperties);
    }

    @Test
    void syncCatalog_pagesUntilShortPage_persistsAndQueues() {
        when(metadataClient.fetchActivePage(0, 2)).thenReturn(List.of(gamma(1), gamma(2)));
        when(metadataClient.fetchActivePage(2, 2)).thenReturn(List.of(gamma(3)));

        assertThat(job.syncCatalog()).isEqualTo(3);

        ArgumentCaptor<Market> saved = ArgumentCaptor.forClass(Market.class);
        verify(ledgerStore, times(3)).saveMarket(saved.capture());
        Market first = saved.getAllValues().get(0);
        assertThat(first.getConditionId()).isEqualTo(conditionId(1));
        assertThat(first.getSlug()).isEqualTo("market-1");
        assertThat(first.getOutcomeSlotCount()).isEqualTo(2);
        assertThat(first.getOutcomes()).extracting(OutcomeToken::getTokenId).containsExactly("101", "102");
        assertThat(first.getOutcomes()).extracting(OutcomeToken::getOutcomeLabel).containsExactly("YES", "NO");
        assertThat(first.getMetadataFetchedAt()).isNotNull();
        List<Market> queued = new ArrayList<>();
        queue.drain(queued::add);
        assertThat(queued).extracting(Market::getConditionId)
                .containsExactly(conditionId(1), conditionId(2), conditionId(3));
    }

    @Test
    void syncCatalog_stopsAtMaxMarkets() {
        properties.setCatalogMaxMarkets(3);
        when(metadataClient.fetchActivePage(0, 2)).thenReturn(List.of(gamma(1), gamma(2)));
        when(metadataClient.fetchActivePage(2, 1)).thenReturn(List.of(gamma(3)));

        assertThat(job.syncCatalog()).isEqualTo(3);
        verify(metadataClient, never()).fetchActivePage(4, 2);
    }

    @Test
    void syncCatalog_failedPage_keepsEarlierPages() {
        when(metadataClient.fetchActivePage(0, 2)).thenReturn(List.of(gamma(1), gamma(2)));
        when(metadataClient.fetchActivePage(2, 2))
                .thenThrow(new MarketMetadataException("Gamma down", new IllegalStateException()));

        assertThat(job.syncCatalog()).isEqualTo(2);
        assertThat(queue.size()).isEqualTo(2);
    }

    @Test
    void syncCatalog_indexerDisabled_persistsWithoutQueueing() {
        indexerProperties.setEnabled(false);
        when(metadataClient.fetchActivePage(0, 2)).thenReturn(List.of(gamma(1)));

        assertThat(job.syncCatalog()).isEqualTo(1);
        verify(ledgerStore).saveMarket(any(Market.class));
        assertThat(queue.size()).isZero();
    }

    @Test
    void syncCatalog_disabled_noCalls() {
        properties.setCatalogEnabled(false);

        assertThat(job.syncCatalog()).isZero();
        verifyNoInteractions(metadataClient, ledgerStore);
    }

    @Test
    void toMarket_multiOutcomeWithoutLabels_usesSlotLabels() {
        Market market = MarketCatalogSyncJob.toMarket(new GammaMarket(conditionId(4), null, null,
                List.of("1", "2", "3"), List.of("", "", "")));

        assertThat(market.getOutcomes()).extracting(OutcomeToken::getOutcomeLabel)
                .containsExactly("OUTCOME_0", "OUTCOME_1", "OUTCOME_2");
        assertThat(market.getOutcomes()).extracting(OutcomeToken::getOutcomeIndex).containsExactly(0, 1, 2);
        assertThat(market.getCreatedBlock()).isZero();
    }

    private static GammaMarket gamma(int n) {
        return new GammaMarket(conditionId(n), "market-" + n, "Question " + n + "?",
                List.of(n + "01", n + "02"), List.of("Yes", "No"));
    }

    private static String conditionId(int n) {
        return "0x" + String.format("%064x", n);
    }
}
