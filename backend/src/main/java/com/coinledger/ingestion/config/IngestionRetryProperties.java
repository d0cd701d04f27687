package com.coinledger.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Retry policy for wallet indexer calls (exponential backoff with jitter). Documented in application.yml.
 */
@ConfigurationProperties(prefix = "coinledger.ingestion.retry")
@NoArgsConstructor
@Getter
@Setter
public class IngestionRetryProperties {

    /** Base delay in ms for first retry; doubles each attempt. Default 1000. */
    private long baseDelayMs = 1000L;

    /** Jitter factor 0..1 (e.g. 0.2 = ±20%). Default 0.2. */
    private double jitterFactor = 0.2;

    /** Total attempts including the first call. Default 3. */
    private int maxAttempts = 3;
}
