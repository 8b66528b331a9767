package com.polymind.ingestion.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Polygon JSON-RPC endpoints and client limits (polymind.ingestion.rpc).
 */
@ConfigurationProperties(prefix = "polymind.ingestion.rpc")
@Getter
@Setter
public class ChainRpcProperties {

    private List<String> urls = new ArrayList<>(List.of("https://polygon-rpc.com"));
    /** Bounded timeout for a single JSON-RPC request. */
    private long requestTimeoutMs = 15_000L;
    private int maxRequestsPerSecond = 10;
    /** Max wait for a local limiter permit before the call counts as rate limited. */
    private long localLimiterTimeoutMs = 5_000L;
    private long localLimiterLogThresholdMs = 500L;
    private long endpointCooldownMs = 10_000L;
    /** eth_getLogs over a busy block range can return tens of megabytes. */
    private int maxResponseBytes = 32 * 1024 * 1024;
}
