package com.polymind.ingestion.config;

import com.polymind.common.RetryPolicy;
import com.polymind.ingestion.adapter.RpcEndpointRotator;
import com.polymind.ingestion.adapter.evm.EvmRpcClient;
import com.polymind.ingestion.adapter.evm.WebClientEvmRpcClient;
import com.polymind.ingestion.decoder.OutcomeTokenIds;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.List;

/**
 * Wires the Polygon RPC client, endpoint rotation, local rate limiter, token id derivation and the indexer retry policy.
 */
@Configuration
@EnableConfigurationProperties({ ChainRpcProperties.class, IngestionRetryProperties.class, IndexerProperties.class,
        ContractProperties.class, MarketMetadataProperties.class })
public class IngestionAdapterConfig {

    /** Used when polymind.ingestion.rpc.urls is empty so the context still starts. */
    private static final List<String> DEFAULT_FALLBACK_URLS = List.of("https://polygon-rpc.com");

    @Bean
    public RpcEndpointRotator polygonRpcEndpointRotator(ChainRpcProperties properties) {
        List<String> urls = properties.getUrls() == null || properties.getUrls().isEmpty()
                ? DEFAULT_FALLBACK_URLS
                : properties.getUrls();
        return new RpcEndpointRotator(urls);
    }

    @Bean
    public EvmRpcClient evmRpcClient(WebClient.Builder webClientBuilder, ChainRpcProperties rpcProperties) {
        return new WebClientEvmRpcClient(webClientBuilder, rpcProperties.getMaxResponseBytes());
    }

    @Bean(name = "evmRpcRateLimiter")
    public RateLimiter evmRpcRateLimiter(ChainRpcProperties rpcProperties) {
        int rps = Math.max(1, rpcProperties.getMaxRequestsPerSecond());
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(rps)
                .timeoutDuration(Duration.ofMillis(Math.max(0L, rpcProperties.getLocalLimiterTimeoutMs())))
                .build();
        return RateLimiter.of("polygon-rpc", config);
    }

    @Bean
    public OutcomeTokenIds outcomeTokenIds(ContractProperties contractProperties) {
        return new OutcomeTokenIds(contractProperties.getCollateral());
    }

    @Bean(name = "indexerRetryPolicy")
    public RetryPolicy indexerRetryPolicy(IngestionRetryProperties retryProperties) {
        return new RetryPolicy(
                retryProperties.getBaseDelayMs(),
                retryProperties.getJitterFactor(),
                retryProperties.getMaxDelayMs());
    }
}
