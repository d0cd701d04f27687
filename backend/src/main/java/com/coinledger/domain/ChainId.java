package com.coinledger.domain;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Supported chains with their source family, native asset symbol and native decimals.
 */
public enum ChainId {
    BITCOIN(SourceType.UTXO_WALLET, "BTC", 8),
    ETHEREUM(SourceType.ACCOUNT_WALLET, "ETH", 18),
    ARBITRUM(SourceType.ACCOUNT_WALLET, "ETH", 18),
    BASE(SourceType.ACCOUNT_WALLET, "ETH", 18),
    POLYGON(SourceType.ACCOUNT_WALLET, "MATIC", 18),
    OPTIMISM(SourceType.ACCOUNT_WALLET, "ETH", 18),
    BSC(SourceType.ACCOUNT_WALLET, "BNB", 18),
    AVALANCHE(SourceType.ACCOUNT_WALLET, "AVAX", 18);

    private final SourceType sourceType;
    private final String nativeSymbol;
    private final int nativeDecimals;

    ChainId(SourceType sourceType, String nativeSymbol, int nativeDecimals) {
        this.sourceType = sourceType;
        this.nativeSymbol = nativeSymbol;
        this.nativeDecimals = nativeDecimals;
    }

    public SourceType getSourceType() {
        return sourceType;
    }

    public String getNativeSymbol() {
        return nativeSymbol;
    }

    public int getNativeDecimals() {
        return nativeDecimals;
    }

    public boolean isAccountBased() {
        return sourceType == SourceType.ACCOUNT_WALLET;
    }

    /** Lower-case identifier used in locations, ids and request parameters. */
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<ChainId> fromId(String id) {
        if (id == null || id.isBlank()) {
            return Optional.empty();
        }
        String normalized = id.strip().toUpperCase(Locale.ROOT);
        return Arrays.stream(values()).filter(c -> c.name().equals(normalized)).findFirst();
    }
}
