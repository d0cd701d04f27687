package com.coinledger.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Exchange CSV import settings.
 */
@ConfigurationProperties(prefix = "coinledger.ingestion.csv")
@NoArgsConstructor
@Getter
@Setter
public class CsvImportProperties {

    /** Name recorded as the source location of imported trades. */
    private String exchangeName = "binance";

    /** Quote assets used to split concatenated pairs such as BTCEUR; the longest matching suffix wins. */
    private List<String> quoteAssets = new ArrayList<>(List.of(
            "USDT", "BUSD", "USDC", "FDUSD", "EUR", "USD", "GBP", "TRY", "BNB", "BTC", "ETH"));

    /** Assets treated as fiat when rebuilding trades from an account statement: receiving one is a sale. */
    private List<String> fiatAssets = new ArrayList<>(List.of("EUR", "USD", "USDT", "BUSD", "USDC", "GBP", "TRY"));

    public void setQuoteAssets(List<String> quoteAssets) {
        this.quoteAssets = quoteAssets != null ? quoteAssets : new ArrayList<>();
    }

    public void setFiatAssets(List<String> fiatAssets) {
        this.fiatAssets = fiatAssets != null ? fiatAssets : new ArrayList<>();
    }
}
