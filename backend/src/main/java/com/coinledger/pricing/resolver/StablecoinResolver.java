package com.coinledger.pricing.resolver;

import com.coinledger.common.StablecoinRegistry;
import com.coinledger.domain.PriceSource;
import com.coinledger.pricing.HistoricalPriceRequest;
import com.coinledger.pricing.PriceResolutionResult;
import com.coinledger.pricing.config.PricingProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Resolves USD stablecoins to 1.00 when reporting in USD. For any other reporting currency the peg
 * does not give the price, so the request falls through to CoinGecko.
 */
@Component
@RequiredArgsConstructor
public class StablecoinResolver {

    private static final String USD = "USD";

    private final StablecoinRegistry stablecoinRegistry;
    private final PricingProperties pricingProperties;

    public PriceResolutionResult resolve(HistoricalPriceRequest request) {
        if (request == null || request.getAsset() == null) {
            return PriceResolutionResult.unknown();
        }
        if (USD.equals(pricingProperties.reportingCurrencySymbol()) && stablecoinRegistry.isUsdStablecoin(request.getAsset())) {
            return PriceResolutionResult.known(BigDecimal.ONE, PriceSource.STABLECOIN);
        }
        return PriceResolutionResult.unknown();
    }
}
