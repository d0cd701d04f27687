package com.coinledger.pricing.config;

import com.coinledger.common.RateLimiter;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Pricing module configuration: properties and the shared CoinGecko rate limiter.
 */
@Configuration
@EnableConfigurationProperties(PricingProperties.class)
public class PricingConfig {

    @Bean
    public RateLimiter coingeckoRateLimiter(PricingProperties pricingProperties) {
        return new RateLimiter(pricingProperties.getCoingeckoRequestsPerMinute());
    }
}
