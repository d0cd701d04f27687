package com.coinledger.domain;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Portfolio valuation at one point of the ledger. {@code deposited} and {@code withdrawn} are cumulative
 * acquisition and disposal values up to {@code timestamp}.
 */
public record PortfolioSnapshot(
        Instant timestamp,
        BigDecimal totalValue,
        Map<String, BigDecimal> assetValues,
        Map<String, BigDecimal> assetQuantities,
        BigDecimal deposited,
        BigDecimal withdrawn
) {

    public PortfolioSnapshot {
        assetValues = assetValues == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(assetValues));
        assetQuantities = assetQuantities == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(assetQuantities));
    }
}
