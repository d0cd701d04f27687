package com.coinledger.ingestion.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.coinledger.common.RetryPolicy;
import com.coinledger.ingestion.adapter.IndexerHttpClient;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

/**
 * Wallet indexer plumbing: HTTP client with retry policy and client-side rate limiters.
 */
@Configuration
@EnableConfigurationProperties({ IngestionChainProperties.class, CsvImportProperties.class, IngestionRetryProperties.class })
public class IngestionAdapterConfig {

    public static final String EXPLORER_RATE_LIMITER = "explorerRateLimiter";
    public static final String BLOCKSTREAM_RATE_LIMITER = "blockstreamRateLimiter";

    @Bean
    public RetryPolicy chainFetchRetryPolicy(IngestionRetryProperties retryProperties) {
        return new RetryPolicy(
                retryProperties.getBaseDelayMs(),
                retryProperties.getJitterFactor(),
                retryProperties.getMaxAttempts());
    }

    @Bean
    public IndexerHttpClient indexerHttpClient(WebClient.Builder webClientBuilder, ObjectMapper objectMapper,
                                               RetryPolicy chainFetchRetryPolicy) {
        return new IndexerHttpClient(webClientBuilder, objectMapper, chainFetchRetryPolicy);
    }

    @Bean(name = EXPLORER_RATE_LIMITER)
    public RateLimiter explorerRateLimiter(IngestionChainProperties properties) {
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(Math.max(1, properties.getExplorerRequestsPerSecond()))
                .timeoutDuration(Duration.ofMillis(Math.max(0L, properties.getExplorerLimiterTimeoutMs())))
                .build();
        return RateLimiter.of("explorer", config);
    }

    /** Blockstream has no published quota; stay polite at 5 req/s. */
    @Bean(name = BLOCKSTREAM_RATE_LIMITER)
    public RateLimiter blockstreamRateLimiter(IngestionChainProperties properties) {
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(5)
                .timeoutDuration(Duration.ofMillis(Math.max(0L, properties.getExplorerLimiterTimeoutMs())))
                .build();
        return RateLimiter.of("blockstream", config);
    }
}
