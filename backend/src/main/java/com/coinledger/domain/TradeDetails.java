package com.coinledger.domain;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Quote side of an exchange trade: the counter asset, the unit price expressed in it and the total exchanged.
 */
public record TradeDetails(String quoteAsset, BigDecimal quotePrice, BigDecimal quoteAmount) {

    public TradeDetails {
        if (quoteAsset == null || quoteAsset.isBlank()) {
            throw new IllegalArgumentException("Quote asset is required");
        }
        quoteAsset = quoteAsset.strip().toUpperCase();
        Objects.requireNonNull(quotePrice, "quotePrice");
        Objects.requireNonNull(quoteAmount, "quoteAmount");
    }
}
