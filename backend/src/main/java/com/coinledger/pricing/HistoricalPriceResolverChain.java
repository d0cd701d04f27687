package com.coinledger.pricing;

import com.coinledger.pricing.resolver.CoinGeckoHistoricalResolver;
import com.coinledger.pricing.resolver.ReportingCurrencyResolver;
import com.coinledger.pricing.resolver.StablecoinResolver;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Chain: ReportingCurrency → Stablecoin → CoinGecko → UNKNOWN. The first known price wins.
 */
@Component
@Slf4j
public class HistoricalPriceResolverChain implements HistoricalPriceResolver {

    private final List<HistoricalPriceResolver> resolvers;

    public HistoricalPriceResolverChain(ReportingCurrencyResolver reportingCurrencyResolver,
                                        StablecoinResolver stablecoinResolver,
                                        CoinGeckoHistoricalResolver coinGeckoHistoricalResolver) {
        this.resolvers = List.of(reportingCurrencyResolver::resolve, stablecoinResolver::resolve,
                coinGeckoHistoricalResolver::resolve);
    }

    @Override
    public PriceResolutionResult resolve(HistoricalPriceRequest request) {
        for (HistoricalPriceResolver resolver : resolvers) {
            PriceResolutionResult result = resolver.resolve(request);
            if (!result.isUnknown()) {
                return result;
            }
        }
        log.debug("No historical price for {} on {}", request.getAsset(), request.getDate());
        return PriceResolutionResult.unknown();
    }
}
