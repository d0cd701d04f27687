package com.coinledger.pricing;

/**
 * Resolves the historical price of an asset in the reporting currency.
 * Chain: reporting currency → stablecoin → CoinGecko → UNKNOWN.
 */
public interface HistoricalPriceResolver {

    /**
     * Returns UNKNOWN when every resolver in the chain fails; never throws for provider errors.
     */
    PriceResolutionResult resolve(HistoricalPriceRequest request);
}
