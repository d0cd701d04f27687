package com.coinledger.pricing.resolver;

import com.coinledger.domain.PriceSource;
import com.coinledger.pricing.HistoricalPriceRequest;
import com.coinledger.pricing.PriceResolutionResult;
import com.coinledger.pricing.config.PricingProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * The reporting currency is worth exactly 1 of itself.
 */
@Component
@RequiredArgsConstructor
public class ReportingCurrencyResolver {

    private final PricingProperties pricingProperties;

    public PriceResolutionResult resolve(HistoricalPriceRequest request) {
        if (request == null || request.getAsset() == null) {
            return PriceResolutionResult.unknown();
        }
        if (pricingProperties.reportingCurrencySymbol().equalsIgnoreCase(request.getAsset())) {
            return PriceResolutionResult.known(BigDecimal.ONE, PriceSource.REPORTING_CURRENCY);
        }
        return PriceResolutionResult.unknown();
    }
}
