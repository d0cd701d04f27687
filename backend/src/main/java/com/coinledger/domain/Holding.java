package com.coinledger.domain;

import java.math.BigDecimal;

/**
 * Open position of one asset derived from its open lots and valued at the latest known price.
 * When no price is known the market value and unrealized gain are zero and {@code priceMissing} is set.
 */
public record Holding(
        String asset,
        BigDecimal quantity,
        BigDecimal averageCost,
        BigDecimal costBasis,
        BigDecimal price,
        BigDecimal marketValue,
        BigDecimal unrealizedGain,
        boolean priceMissing
) {
}
