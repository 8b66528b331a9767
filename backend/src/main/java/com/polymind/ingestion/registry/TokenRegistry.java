package com.polymind.ingestion.registry;

import com.polymind.domain.Market;
import com.polymind.domain.OutcomeToken;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Outcome token id to (market, outcome index). Written only by the indexer thread; read by the decoder and queries.
 * Rebuilt at startup from persisted markets.
 */
@Component
@Slf4j
public class TokenRegistry {

    private final Map<String, OutcomeToken> tokens = new ConcurrentHashMap<>();

    /**
     * Registers every outcome token of the market. Idempotent; a token already mapped to another market keeps its first owner.
     */
    public void register(Market market) {
        if (market == null || market.getOutcomes() == null) {
            return;
        }
        for (OutcomeToken token : market.getOutcomes()) {
            OutcomeToken existing = tokens.putIfAbsent(token.getTokenId(), token);
            if (existing != null && !existing.getConditionId().equals(token.getConditionId())) {
                log.warn("Token {} already registered for market {}, ignoring mapping to {}",
                        token.getTokenId(), existing.getConditionId(), token.getConditionId());
            }
        }
    }

    public Optional<OutcomeToken> resolve(String tokenId) {
        return tokenId == null ? Optional.empty() : Optional.ofNullable(tokens.get(tokenId));
    }

    public int size() {
        return tokens.size();
    }
}
