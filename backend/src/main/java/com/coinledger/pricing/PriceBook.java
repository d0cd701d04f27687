package com.coinledger.pricing;

import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Price lookups for one analysis run. Memoizes every (asset, day) answer, misses included, so an asset
 * without a price is requested once per day per run, and collects the assets that could not be priced.
 * Not thread-safe: one book belongs to one run, whose steps execute one after another.
 */
@Slf4j
public class PriceBook {

    private final HistoricalPriceResolver historicalPriceResolver;
    private final SpotPriceResolver spotPriceResolver;
    private final String reportingCurrency;
    private final Clock clock;
    private final Map<String, PriceResolutionResult> memo = new HashMap<>();
    private final Map<String, Optional<BigDecimal>> latest = new HashMap<>();
    private final SortedSet<String> missing = new TreeSet<>();

    public PriceBook(HistoricalPriceResolver historicalPriceResolver, SpotPriceResolver spotPriceResolver,
                     String reportingCurrency, Clock clock) {
        this.historicalPriceResolver = historicalPriceResolver;
        this.spotPriceResolver = spotPriceResolver;
        this.reportingCurrency = reportingCurrency.strip().toUpperCase(Locale.ROOT);
        this.clock = clock;
    }

    public String reportingCurrency() {
        return reportingCurrency;
    }

    public boolean isReportingCurrency(String asset) {
        return reportingCurrency.equalsIgnoreCase(asset);
    }

    /**
     * Price of {@code asset} on the UTC day of {@code timestamp}; empty (and recorded as missing) when unresolved.
     */
    public Optional<BigDecimal> priceAt(String asset, Instant timestamp) {
        Optional<BigDecimal> price = lookup(asset, timestamp);
        if (price.isEmpty()) {
            markMissing(asset);
        }
        return price;
    }

    /**
     * Same as {@link #priceAt} but leaves the missing set alone, for callers with a fallback.
     */
    public Optional<BigDecimal> lookup(String asset, Instant timestamp) {
        if (isReportingCurrency(asset)) {
            return Optional.of(BigDecimal.ONE);
        }
        HistoricalPriceRequest request = HistoricalPriceRequest.of(asset, timestamp);
        String key = request.getAsset() + "|" + request.getDate();
        PriceResolutionResult result = memo.get(key);
        if (result == null) {
            result = historicalPriceResolver.resolve(request);
            memo.put(key, result);
            if (result.isUnknown()) {
                log.warn("No {} price for {} on {}", reportingCurrency, request.getAsset(), request.getDate());
            }
        }
        return result.getPrice();
    }

    /**
     * Current price: spot first, then the historical price for today.
     */
    public Optional<BigDecimal> latestPrice(String asset) {
        if (isReportingCurrency(asset)) {
            return Optional.of(BigDecimal.ONE);
        }
        String symbol = asset.strip().toUpperCase(Locale.ROOT);
        Optional<BigDecimal> cached = latest.get(symbol);
        if (cached != null) {
            return cached;
        }
        Optional<BigDecimal> price = spotPriceResolver.resolve(symbol);
        if (price == null || price.isEmpty()) {
            price = priceAt(symbol, clock.instant());
        }
        latest.put(symbol, price);
        return price;
    }

    public void markMissing(String asset) {
        missing.add(asset.strip().toUpperCase(Locale.ROOT));
    }

    public SortedSet<String> missingPrices() {
        return Collections.unmodifiableSortedSet(new TreeSet<>(missing));
    }
}
