package com.coinledger.pricing;

import com.coinledger.pricing.config.PricingProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Opens a fresh {@link PriceBook} per analysis run in the configured reporting currency.
 */
@Component
@RequiredArgsConstructor
public class PriceBookFactory {

    private final HistoricalPriceResolver historicalPriceResolver;
    private final SpotPriceResolver spotPriceResolver;
    private final PricingProperties pricingProperties;

    public PriceBook open() {
        return new PriceBook(historicalPriceResolver, spotPriceResolver,
                pricingProperties.reportingCurrencySymbol(), Clock.systemUTC());
    }
}
