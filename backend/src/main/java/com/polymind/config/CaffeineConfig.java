package com.polymind.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Caffeine in-process caches for chain and Gamma lookups.
 */
@Configuration
@EnableCaching
public class CaffeineConfig {

    public static final String BLOCK_TIMESTAMP_CACHE = "blockTimestampCache";
    public static final String MARKET_METADATA_CACHE = "marketMetadataCache";

    @Bean
    public CacheManager caffeineCacheManager() {
        CaffeineCacheManager manager = new CaffeineCacheManager();
        // block timestamps never change once the block is final
        manager.registerCustomCache(BLOCK_TIMESTAMP_CACHE, Caffeine.newBuilder()
                .maximumSize(20_000)
                .build());
        manager.registerCustomCache(MARKET_METADATA_CACHE, Caffeine.newBuilder()
                .expireAfterWrite(6, TimeUnit.HOURS)
                .maximumSize(5_000)
                .build());
        return manager;
    }
}
