package com.polymind.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Named thread pools. The indexer owns a single thread: fetch, decode, apply and cursor save never run concurrently.
 */
@Configuration
public class AsyncConfig {

    public static final String INDEXER_EXECUTOR = "indexer-executor";

    @Bean(name = INDEXER_EXECUTOR)
    public Executor indexerExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(1);
        e.setMaxPoolSize(1);
        e.setQueueCapacity(1);
        e.setThreadNamePrefix("indexer-");
        e.setWaitForTasksToCompleteOnShutdown(true);
        e.setAwaitTerminationSeconds(30);
        e.initialize();
        return e;
    }
}
