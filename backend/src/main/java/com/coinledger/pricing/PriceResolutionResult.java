package com.coinledger.pricing;

import com.coinledger.domain.PriceSource;
import lombok.Getter;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Result of historical or spot price resolution. Either a price with source or UNKNOWN.
 */
@Getter
public class PriceResolutionResult {

    private static final PriceResolutionResult UNKNOWN = new PriceResolutionResult(null, PriceSource.UNKNOWN);

    private final BigDecimal price;
    private final PriceSource priceSource;

    private PriceResolutionResult(BigDecimal price, PriceSource priceSource) {
        this.price = price;
        this.priceSource = priceSource;
    }

    public static PriceResolutionResult known(BigDecimal price, PriceSource source) {
        if (price == null || source == null || source == PriceSource.UNKNOWN) {
            return UNKNOWN;
        }
        return new PriceResolutionResult(price, source);
    }

    public static PriceResolutionResult unknown() {
        return UNKNOWN;
    }

    public boolean isUnknown() {
        return price == null;
    }

    public Optional<BigDecimal> getPrice() {
        return Optional.ofNullable(price);
    }
}
