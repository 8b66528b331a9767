package com.polymind.ingestion.registry;

import com.polymind.domain.Market;
import com.polymind.domain.OutcomeToken;
import com.polymind.ingestion.decoder.LogFixtures;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TokenRegistryTest {

    private final TokenRegistry registry = new TokenRegistry();

    @Test
    void register_resolvesEveryOutcome() {
        Market market = LogFixtures.market(LogFixtures.conditionId(1), 3, 5);

        registry.register(market);

        assertThat(registry.size()).isEqualTo(3);
        for (OutcomeToken token : market.getOutcomes()) {
            assertThat(registry.resolve(token.getTokenId())).get()
                    .extracting(OutcomeToken::getOutcomeIndex).isEqualTo(token.getOutcomeIndex());
        }
    }

    @Test
    void register_idempotent() {
        Market market = LogFixtures.market(LogFixtures.conditionId(1), 2, 5);

        registry.register(market);
        registry.register(market);

        assertThat(registry.size()).isEqualTo(2);
    }

    @Test
    void register_conflictingOwnerKeepsFirst() {
        String first = LogFixtures.conditionId(1);
        registry.register(singleToken(first, "123"));

        registry.register(singleToken(LogFixtures.conditionId(2), "123"));

        assertThat(registry.resolve("123")).get().extracting(OutcomeToken::getConditionId).isEqualTo(first);
    }

    @Test
    void resolve_unknownOrNull_empty() {
        assertThat(registry.resolve("999")).isEmpty();
        assertThat(registry.resolve(null)).isEmpty();
    }

    @Test
    void register_nullIgnored() {
        registry.register(null);
        assertThat(registry.size()).isZero();
    }

    private static Market singleToken(String conditionId, String tokenId) {
        Market market = new Market();
        market.setConditionId(conditionId);
        market.setOutcomes(List.of(new OutcomeToken(tokenId, conditionId, 0, "YES")));
        return market;
    }
}
