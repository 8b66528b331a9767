package com.polymind.ingestion.adapter.evm;

import com.fasterxml.jackson.databind.JsonNode;
import com.polymind.ingestion.adapter.ChainFetchException;
import com.polymind.ingestion.adapter.ChainLogSource;
import com.polymind.ingestion.adapter.FetchFailure;
import com.polymind.ingestion.adapter.RawLog;
import com.polymind.ingestion.config.ContractProperties;
import com.polymind.ingestion.decoder.EventSignatures;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * {@link ChainLogSource} over Polygon JSON-RPC. Fetches logs of the exchange and ConditionalTokens contracts
 * filtered to the decodable event topics. Ranges rejected as too wide are halved until they fit.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class EvmChainLogSource implements ChainLogSource {

    private final EvmJsonRpcGateway gateway;
    private final EvmBlockTimestampResolver timestampResolver;
    private final ContractProperties contractProperties;

    @Override
    public List<RawLog> fetchLogs(long fromBlock, long toBlock) {
        if (fromBlock > toBlock) {
            throw new ChainFetchException(FetchFailure.INVALID, "Invalid range " + fromBlock + ".." + toBlock);
        }
        List<RawLog> logs = new ArrayList<>();
        fetchRange(fromBlock, toBlock, logs);
        logs.sort(Comparator.comparingLong(RawLog::blockNumber).thenComparingInt(RawLog::logIndex));
        return logs;
    }

    @Override
    public long headBlock() {
        JsonNode result = gateway.call("eth_blockNumber", Collections.emptyList());
        String hex = result.asText(null);
        if (!HexQuantities.isHex(hex)) {
            throw new ChainFetchException(FetchFailure.TIMEOUT, "eth_blockNumber returned " + result);
        }
        return HexQuantities.parseLong(hex);
    }

    @Override
    public Instant blockTimestamp(long blockNumber) {
        return timestampResolver.getBlockTimestamp(blockNumber);
    }

    private void fetchRange(long fromBlock, long toBlock, List<RawLog> sink) {
        try {
            JsonNode result = gateway.call("eth_getLogs", Collections.singletonList(buildLogFilter(fromBlock, toBlock)));
            if (!result.isArray()) {
                throw new ChainFetchException(FetchFailure.TIMEOUT, "eth_getLogs returned non-array result for "
                        + fromBlock + ".." + toBlock);
            }
            for (JsonNode node : result) {
                if (node.path("removed").asBoolean(false)) {
                    continue;
                }
                sink.add(toRawLog(node));
            }
        } catch (RangeTooWideException e) {
            if (fromBlock >= toBlock) {
                throw new ChainFetchException(FetchFailure.INVALID,
                        "Provider rejects single block " + fromBlock + ": " + e.getMessage(), e);
            }
            long mid = fromBlock + (toBlock - fromBlock) / 2;
            log.debug("Range {}..{} too wide, splitting at {}", fromBlock, toBlock, mid);
            fetchRange(fromBlock, mid, sink);
            fetchRange(mid + 1, toBlock, sink);
        }
    }

    Map<String, Object> buildLogFilter(long fromBlock, long toBlock) {
        Map<String, Object> filter = new HashMap<>();
        filter.put("fromBlock", HexQuantities.toHex(fromBlock));
        filter.put("toBlock", HexQuantities.toHex(toBlock));
        filter.put("address", contractProperties.watchedAddresses().stream()
                .map(a -> a.toLowerCase(Locale.ROOT))
                .toList());
        // topic0 OR-list
        filter.put("topics", List.of(EventSignatures.watchedTopics()));
        return filter;
    }

    private static RawLog toRawLog(JsonNode node) {
        String blockHex = node.path("blockNumber").asText(null);
        String logIndexHex = node.path("logIndex").asText(null);
        if (!HexQuantities.isHex(blockHex) || !HexQuantities.isHex(logIndexHex)) {
            throw new ChainFetchException(FetchFailure.TIMEOUT, "eth_getLogs entry without block/log index: " + node);
        }
        List<String> topics = new ArrayList<>();
        node.path("topics").forEach(t -> topics.add(t.asText().toLowerCase(Locale.ROOT)));
        String timestampHex = node.path("blockTimestamp").asText(null);
        Instant blockTimestamp = HexQuantities.isHex(timestampHex)
                ? Instant.ofEpochSecond(HexQuantities.parseLong(timestampHex))
                : null;
        return new RawLog(
                node.path("address").asText("").toLowerCase(Locale.ROOT),
                topics,
                node.path("data").asText("0x"),
                HexQuantities.parseLong(blockHex),
                HexQuantities.parseInt(logIndexHex),
                node.path("transactionHash").asText("").toLowerCase(Locale.ROOT),
                blockTimestamp);
    }
}
