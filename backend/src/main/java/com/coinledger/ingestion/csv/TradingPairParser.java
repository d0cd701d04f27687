package com.coinledger.ingestion.csv;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Splits exchange pair symbols. Explicit separators ({@code BTC/EUR}, {@code BTC-EUR}) are honoured;
 * concatenated symbols are split on the longest known quote suffix so BTCUSDT never reads as BTCUSD + T.
 */
public class TradingPairParser {

    private final List<String> quotesLongestFirst;

    public TradingPairParser(List<String> quoteAssets) {
        this.quotesLongestFirst = quoteAssets.stream()
                .filter(q -> q != null && !q.isBlank())
                .map(q -> q.strip().toUpperCase(Locale.ROOT))
                .distinct()
                .sorted(Comparator.comparingInt(String::length).reversed().thenComparing(Comparator.naturalOrder()))
                .toList();
    }

    public Optional<TradingPair> parse(String pair) {
        if (pair == null || pair.isBlank()) {
            return Optional.empty();
        }
        String symbol = pair.strip().toUpperCase(Locale.ROOT);
        int separator = indexOfSeparator(symbol);
        if (separator >= 0) {
            String base = symbol.substring(0, separator).strip();
            String quote = symbol.substring(separator + 1).strip();
            return base.isEmpty() || quote.isEmpty() ? Optional.empty() : Optional.of(new TradingPair(base, quote));
        }
        for (String quote : quotesLongestFirst) {
            if (symbol.length() > quote.length() && symbol.endsWith(quote)) {
                return Optional.of(new TradingPair(symbol.substring(0, symbol.length() - quote.length()), quote));
            }
        }
        return Optional.empty();
    }

    private static int indexOfSeparator(String symbol) {
        int slash = symbol.indexOf('/');
        return slash >= 0 ? slash : symbol.indexOf('-');
    }

    public record TradingPair(String base, String quote) {
    }
}
