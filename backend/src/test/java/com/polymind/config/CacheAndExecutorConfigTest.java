package com.polymind.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.cache.CacheManager;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.concurrent.Executor;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(classes = {
        CaffeineConfig.class,
        AsyncConfig.class,
        SchedulerConfig.class
})
class CacheAndExecutorConfigTest {

    @Autowired
    CacheManager cacheManager;

    @Autowired
    @Qualifier(AsyncConfig.INDEXER_EXECUTOR)
    Executor indexerExecutor;

    @Autowired
    @Qualifier(SchedulerConfig.SCHEDULER_POOL)
    ThreadPoolTaskScheduler schedulerPool;

    @Test
    @DisplayName("block timestamp and market metadata caches are created and usable")
    void cachesCreatedAndUsed() {
        assertThat(cacheManager.getCache(CaffeineConfig.BLOCK_TIMESTAMP_CACHE)).isNotNull();
        assertThat(cacheManager.getCache(CaffeineConfig.MARKET_METADATA_CACHE)).isNotNull();

        cacheManager.getCache(CaffeineConfig.BLOCK_TIMESTAMP_CACHE).put(42L, "ts");
        assertThat(cacheManager.getCache(CaffeineConfig.BLOCK_TIMESTAMP_CACHE).get(42L).get()).isEqualTo("ts");
    }

    @Test
    @DisplayName("indexer executor is a single thread")
    void indexerExecutorSingleThread() {
        assertThat(indexerExecutor).isInstanceOf(ThreadPoolTaskExecutor.class);
        ThreadPoolTaskExecutor e = (ThreadPoolTaskExecutor) indexerExecutor;
        assertThat(e.getCorePoolSize()).isEqualTo(1);
        assertThat(e.getMaxPoolSize()).isEqualTo(1);
        assertThat(e.getThreadNamePrefix()).isEqualTo("indexer-");
    }

    @Test
    void schedulerPoolCreated() {
        assertThat(schedulerPool.getThreadNamePrefix()).isEqualTo("polymind-sched-");
        assertThat(schedulerPool.getPoolSize()).isLessThanOrEqualTo(1);
    }
}
