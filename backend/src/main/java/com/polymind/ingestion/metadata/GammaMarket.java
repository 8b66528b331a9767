package com.polymind.ingestion.metadata;

import java.util.List;

/**
 * Active market as listed by Gamma. Token ids are decimal strings in outcome order; labels line up with them.
 */
public record GammaMarket(String conditionId, String slug, String question, List<String> tokenIds,
                          List<String> outcomeLabels) {

    public GammaMarket {
        tokenIds = List.copyOf(tokenIds);
        outcomeLabels = List.copyOf(outcomeLabels);
    }
}
