package com.coinledger.pricing.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Pricing configuration. Documented in application.yml under coinledger.pricing.
 */
@ConfigurationProperties(prefix = "coinledger.pricing")
@Getter
@Setter
public class PricingProperties {

    /**
     * Currency every value is reported in (CoinGecko vs_currency, e.g. eur, usd).
     */
    private String reportingCurrency = "eur";

    /**
     * CoinGecko API base URL (free: https://api.coingecko.com/api/v3).
     */
    private String coingeckoBaseUrl = "https://api.coingecko.com/api/v3";

    /**
     * Optional CoinGecko demo API key, sent as x-cg-demo-api-key when set.
     */
    private String coingeckoApiKey = "";

    /**
     * Token bucket: requests per minute for CoinGecko (free tier allows ~30).
     */
    private int coingeckoRequestsPerMinute = 25;

    /**
     * Symbol (upper case) -> CoinGecko coin id. Symbols not listed fall back to the lower-cased symbol.
     */
    private Map<String, String> symbolToCoinGeckoId = new HashMap<>(Map.of(
            "BTC", "bitcoin",
            "ETH", "ethereum",
            "BNB", "binancecoin",
            "USDT", "tether",
            "BUSD", "binance-usd",
            "USDC", "usd-coin",
            "ADA", "cardano",
            "XRP", "ripple",
            "DOT", "polkadot",
            "SOL", "solana"
    ));

    public void setSymbolToCoinGeckoId(Map<String, String> symbolToCoinGeckoId) {
        this.symbolToCoinGeckoId = symbolToCoinGeckoId != null ? new HashMap<>(symbolToCoinGeckoId) : new HashMap<>();
    }

    public String coinIdFor(String symbol) {
        String upper = symbol.strip().toUpperCase(Locale.ROOT);
        String configured = symbolToCoinGeckoId.get(upper);
        return configured != null && !configured.isBlank() ? configured : upper.toLowerCase(Locale.ROOT);
    }

    /** Reporting currency as an asset symbol (upper case). */
    public String reportingCurrencySymbol() {
        return reportingCurrency.strip().toUpperCase(Locale.ROOT);
    }

    /** Reporting currency as CoinGecko vs_currency (lower case). */
    public String vsCurrency() {
        return reportingCurrency.strip().toLowerCase(Locale.ROOT);
    }
}
