package com.polymind.ingestion.adapter.evm;

import com.fasterxml.jackson.databind.JsonNode;
import com.polymind.config.CaffeineConfig;
import com.polymind.ingestion.adapter.ChainFetchException;
import com.polymind.ingestion.adapter.FetchFailure;
import lombok.RequiredArgsConstructor;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;

/**
 * Resolves block timestamp via eth_getBlockByNumber. Cached per block number.
 */
@Component
@RequiredArgsConstructor
public class EvmBlockTimestampResolver {

    private final EvmJsonRpcGateway gateway;

    @Cacheable(cacheNames = CaffeineConfig.BLOCK_TIMESTAMP_CACHE, key = "#blockNumber")
    public Instant getBlockTimestamp(long blockNumber) {
        JsonNode block = gateway.call("eth_getBlockByNumber", List.of(HexQuantities.toHex(blockNumber), false));
        if (block == null || block.isMissingNode() || block.isNull()) {
            // node has not seen the block yet; a later attempt may succeed
            throw new ChainFetchException(FetchFailure.TIMEOUT, "eth_getBlockByNumber no result for block " + blockNumber);
        }
        String timestampHex = block.path("timestamp").asText(null);
        if (!HexQuantities.isHex(timestampHex)) {
            throw new ChainFetchException(FetchFailure.INVALID, "eth_getBlockByNumber invalid timestamp: " + timestampHex);
        }
        return Instant.ofEpochSecond(HexQuantities.parseLong(timestampHex));
    }
}
