package com.polymind.ingestion.adapter.evm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.polymind.ingestion.adapter.ChainFetchException;
import com.polymind.ingestion.adapter.FetchFailure;
import com.polymind.ingestion.adapter.RpcEndpointRotator;
import com.polymind.ingestion.config.ChainRpcProperties;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Single JSON-RPC call with local rate limiting, bounded timeout and failover across endpoints.
 * Each endpoint is tried at most once per call; the indexer owns the retry schedule.
 */
@Component
@Slf4j
public class EvmJsonRpcGateway {

    private final EvmRpcClient rpcClient;
    private final RpcEndpointRotator rotator;
    private final RateLimiter evmRpcRateLimiter;
    private final ChainRpcProperties rpcProperties;
    private final ObjectMapper objectMapper;

    public EvmJsonRpcGateway(EvmRpcClient rpcClient,
                             RpcEndpointRotator rotator,
                             @Qualifier("evmRpcRateLimiter") RateLimiter evmRpcRateLimiter,
                             ChainRpcProperties rpcProperties,
                             ObjectMapper objectMapper) {
        this.rpcClient = rpcClient;
        this.rotator = rotator;
        this.evmRpcRateLimiter = evmRpcRateLimiter;
        this.rpcProperties = rpcProperties;
        this.objectMapper = objectMapper;
    }

    /**
     * Returns the {@code result} node of the response.
     *
     * @throws ChainFetchException when every endpoint failed transiently, or on the first non-retryable failure
     */
    public JsonNode call(String method, Object params) {
        int attempts = Math.max(1, rotator.getEndpoints().size());
        ChainFetchException last = null;
        for (int attempt = 0; attempt < attempts; attempt++) {
            String endpoint = rotator.getNextEndpoint();
            try {
                return callOnce(endpoint, method, params);
            } catch (ChainFetchException e) {
                if (!e.isRetryable()) {
                    throw e;
                }
                last = e;
                rotator.markCoolingDown(endpoint, rpcProperties.getEndpointCooldownMs());
                log.debug("{} failed on {} ({}), trying next endpoint", method, endpoint, e.getFailure());
            }
        }
        throw last;
    }

    private JsonNode callOnce(String endpoint, String method, Object params) {
        acquirePermit(endpoint, method);
        String json;
        try {
            json = rpcClient.call(endpoint, method, params)
                    .timeout(Duration.ofMillis(Math.max(1L, rpcProperties.getRequestTimeoutMs())))
                    .block();
        } catch (RuntimeException e) {
            throw RpcErrorClassifier.fromThrowable(method, endpoint, e);
        }
        if (json == null) {
            throw new ChainFetchException(FetchFailure.TIMEOUT, method + " on " + endpoint + " returned empty body");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new ChainFetchException(FetchFailure.TIMEOUT, "Unreadable " + method + " response from " + endpoint, e);
        }
        JsonNode error = root.path("error");
        if (!error.isMissingNode() && !error.isNull()) {
            throw RpcErrorClassifier.fromRpcError(method, error.path("code").asInt(0), error.path("message").asText(error.toString()));
        }
        return root.path("result");
    }

    private void acquirePermit(String endpoint, String method) {
        long acquireStart = System.nanoTime();
        boolean permitted = evmRpcRateLimiter.acquirePermission();
        long waitedMs = (System.nanoTime() - acquireStart) / 1_000_000L;
        if (!permitted) {
            throw new ChainFetchException(FetchFailure.RATE_LIMITED, "Local limiter timeout before " + method + " on " + endpoint);
        }
        if (waitedMs >= Math.max(1L, rpcProperties.getLocalLimiterLogThresholdMs())) {
            log.info("Local EVM RPC limiter delayed {} ms before {} on {}", waitedMs, method, endpoint);
        }
    }
}
