package com.coinledger.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Named thread pools: analysis-executor runs pipeline steps, chain-fetch-executor runs per (chain, address)
 * wallet fetches so a slow explorer never blocks a pipeline slot.
 */
@Configuration
@EnableAsync
public class AsyncConfig {

    public static final String ANALYSIS_EXECUTOR = "analysis-executor";
    public static final String CHAIN_FETCH_EXECUTOR = "chain-fetch-executor";

    @Bean(name = ANALYSIS_EXECUTOR)
    public Executor analysisExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(2);
        e.setMaxPoolSize(4);
        e.setQueueCapacity(100);
        e.setThreadNamePrefix("analysis-");
        e.initialize();
        return e;
    }

    @Bean(name = CHAIN_FETCH_EXECUTOR)
    public Executor chainFetchExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(4);
        e.setMaxPoolSize(8);
        e.setThreadNamePrefix("chain-fetch-");
        e.initialize();
        return e;
    }
}
