package com.polymind.ingestion.metadata;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.polymind.config.CaffeineConfig;
import com.polymind.ingestion.config.MarketMetadataProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Gamma API reads. {@link #fetch} looks up slug and question by condition id (hits cached, misses and failures
 * not); {@link #fetchActivePage} pages through the active-market catalogue with outcome token ids.
 */
@Component
@Slf4j
public class MarketMetadataClient {

    private final MarketMetadataProperties properties;
    private final WebClient webClient;
    private final ObjectMapper objectMapper;

    public MarketMetadataClient(MarketMetadataProperties properties, WebClient.Builder webClientBuilder,
                                ObjectMapper objectMapper) {
        this.properties = properties;
        this.webClient = webClientBuilder.baseUrl(properties.getGammaBaseUrl()).build();
        this.objectMapper = objectMapper;
    }

    /**
     * @return metadata, or empty when Gamma does not know the condition
     * @throws MarketMetadataException on transport or parse failure
     */
    @Cacheable(cacheNames = CaffeineConfig.MARKET_METADATA_CACHE, key = "#conditionId", unless = "#result == null")
    public Optional<MarketMetadata> fetch(String conditionId) {
        String body;
        try {
            body = webClient.get()
                    .uri(uri -> uri.path("/markets").queryParam("condition_ids", conditionId).build())
                    .retrieve()
                    .bodyToMono(String.class)
                    .block(Duration.ofMillis(properties.getRequestTimeoutMs()));
        } catch (RuntimeException e) {
            throw new MarketMetadataException("Gamma lookup failed for " + conditionId, e);
        }
        return parse(conditionId, body);
    }

    /**
     * One page of open markets: GET /markets?active=true&closed=false&limit={limit}&offset={offset}.
     *
     * @throws MarketMetadataException on transport or parse failure
     */
    public List<GammaMarket> fetchActivePage(int offset, int limit) {
        String body;
        try {
            body = webClient.get()
                    .uri(uri -> uri.path("/markets")
                            .queryParam("active", true)
                            .queryParam("closed", false)
                            .queryParam("limit", limit)
                            .queryParam("offset", offset)
                            .build())
                    .retrieve()
                    .bodyToMono(String.class)
                    .block(Duration.ofMillis(properties.getRequestTimeoutMs()));
        } catch (RuntimeException e) {
            throw new MarketMetadataException("Gamma catalogue page at offset " + offset + " failed", e);
        }
        return parseCatalog(body);
    }

    /**
     * Entries without a condition id or with fewer than two token ids are dropped. Token ids come from
     * {@code tokens[].token_id} or, in the newer shape, from the JSON-encoded {@code clobTokenIds}/{@code outcomes} strings.
     */
    List<GammaMarket> parseCatalog(String body) {
        if (body == null || body.isBlank()) {
            return List.of();
        }
        try {
            JsonNode root = objectMapper.readTree(body);
            if (!root.isArray()) {
                log.debug("Unexpected Gamma catalogue shape");
                return List.of();
            }
            List<GammaMarket> out = new ArrayList<>();
            for (JsonNode market : root) {
                String conditionId = market.path("conditionId").asText(null);
                if (conditionId == null || conditionId.isBlank()) {
                    continue;
                }
                List<String> tokenIds = new ArrayList<>();
                List<String> labels = new ArrayList<>();
                if (market.path("tokens").isArray()) {
                    for (JsonNode token : market.path("tokens")) {
                        tokenIds.add(token.path("token_id").asText(""));
                        labels.add(token.path("outcome").asText(""));
                    }
                } else {
                    tokenIds.addAll(textArray(market.path("clobTokenIds")));
                    labels.addAll(textArray(market.path("outcomes")));
                }
                if (tokenIds.size() < 2 || tokenIds.stream().anyMatch(String::isBlank)) {
                    log.debug("Gamma market {} has no usable token ids", conditionId);
                    continue;
                }
                while (labels.size() < tokenIds.size()) {
                    labels.add("");
                }
                out.add(new GammaMarket(conditionId.trim().toLowerCase(Locale.ROOT),
                        market.path("slug").asText(null),
                        market.path("question").asText(null),
                        tokenIds,
                        labels.subList(0, tokenIds.size())));
            }
            return out;
        } catch (IOException e) {
            throw new MarketMetadataException("Unparseable Gamma catalogue page", e);
        }
    }

    /** Gamma sends some arrays as JSON-encoded strings. */
    private List<String> textArray(JsonNode node) throws IOException {
        JsonNode array = node.isTextual() ? objectMapper.readTree(node.asText()) : node;
        List<String> out = new ArrayList<>();
        if (array != null && array.isArray()) {
            array.forEach(item -> out.add(item.asText("")));
        }
        return out;
    }

    Optional<MarketMetadata> parse(String conditionId, String body) {
        if (body == null || body.isBlank()) {
            return Optional.empty();
        }
        try {
            JsonNode root = objectMapper.readTree(body);
            if (!root.isArray()) {
                log.debug("Unexpected Gamma response shape for {}", conditionId);
                return Optional.empty();
            }
            for (JsonNode market : root) {
                String id = market.path("conditionId").asText(null);
                if (id == null || id.equalsIgnoreCase(conditionId)) {
                    return Optional.of(new MarketMetadata(conditionId,
                            market.path("slug").asText(null),
                            market.path("question").asText(null)));
                }
            }
            return Optional.empty();
        } catch (IOException e) {
            throw new MarketMetadataException("Unparseable Gamma response for " + conditionId, e);
        }
    }
}
