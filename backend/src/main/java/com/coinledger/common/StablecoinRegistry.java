package com.coinledger.common;

import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Set;

/**
 * Symbols of USD-pegged stablecoins, valued at 1 when the reporting currency is USD.
 */
@Component
public class StablecoinRegistry {

    private static final Set<String> USD_STABLECOINS = Set.of(
            "USDT", "USDC", "BUSD", "DAI", "TUSD", "FDUSD", "USDP", "GHO", "USDE", "FRAX", "PYUSD");

    public boolean isUsdStablecoin(String symbol) {
        if (symbol == null || symbol.isBlank()) {
            return false;
        }
        return USD_STABLECOINS.contains(symbol.strip().toUpperCase(Locale.ROOT));
    }
}
