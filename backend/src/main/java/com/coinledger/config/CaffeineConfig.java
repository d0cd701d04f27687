package com.coinledger.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Caffeine in-process caches. Historical prices never change, so that cache is bounded by size only
 * and lives as long as the process.
 */
@Configuration
@EnableCaching
public class CaffeineConfig {

    public static final String SPOT_PRICE_CACHE = "spotPriceCache";
    public static final String HISTORICAL_PRICE_CACHE = "historicalPriceCache";

    @Bean
    public CacheManager caffeineCacheManager() {
        CaffeineCacheManager manager = new CaffeineCacheManager();
        manager.registerCustomCache(SPOT_PRICE_CACHE, Caffeine.newBuilder()
                .expireAfterWrite(5, TimeUnit.MINUTES)
                .maximumSize(500)
                .build());
        manager.registerCustomCache(HISTORICAL_PRICE_CACHE, Caffeine.newBuilder()
                .maximumSize(50_000)
                .build());
        return manager;
    }
}
