package com.polymind.ingestion.metadata;

import com.polymind.domain.Market;
import com.polymind.domain.MarketRepository;
import com.polymind.ingestion.config.MarketMetadataProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Fills slug and question for markets discovered on chain. Only metadata fields are written;
 * identity and resolution are never touched. A market Gamma does not know is marked fetched and not retried.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class MarketMetadataEnrichmentJob {

    private final MarketRepository marketRepository;
    private final MarketMetadataClient metadataClient;
    private final MongoTemplate mongoTemplate;
    private final MarketMetadataProperties properties;

    @Scheduled(fixedDelayString = "${polymind.ingestion.metadata.schedule-interval-ms:60000}",
            initialDelayString = "${polymind.ingestion.metadata.initial-delay-ms:30000}")
    public void runScheduled() {
        if (!properties.isEnabled()) {
            return;
        }
        int enriched = enrichPending();
        if (enriched > 0) {
            log.info("Market metadata: enriched {} market(s)", enriched);
        }
    }

    int enrichPending() {
        List<Market> pending = marketRepository.findByMetadataFetchedAtIsNullOrderByCreatedBlockAsc(
                PageRequest.of(0, Math.max(1, properties.getBatchSize())));
        int enriched = 0;
        for (Market market : pending) {
            try {
                Optional<MarketMetadata> metadata = metadataClient.fetch(market.getConditionId());
                apply(market.getConditionId(), metadata.orElse(null));
                if (metadata.isPresent()) {
                    enriched++;
                }
            } catch (MarketMetadataException e) {
                log.warn("Metadata lookup failed for {}, will retry: {}", market.getConditionId(), e.getMessage());
                break;
            }
        }
        return enriched;
    }

    private void apply(String conditionId, MarketMetadata metadata) {
        Update update = new Update().set("metadataFetchedAt", Instant.now());
        if (metadata != null) {
            if (metadata.slug() != null) {
                update.set("slug", metadata.slug());
            }
            if (metadata.question() != null) {
                update.set("question", metadata.question());
            }
        }
        mongoTemplate.updateFirst(Query.query(Criteria.where("_id").is(conditionId)), update, Market.class);
    }
}
