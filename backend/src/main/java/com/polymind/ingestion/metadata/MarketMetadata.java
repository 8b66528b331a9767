package com.polymind.ingestion.metadata;

/**
 * Gamma fields copied onto a market. Either may be null.
 */
public record MarketMetadata(String conditionId, String slug, String question) {
}
