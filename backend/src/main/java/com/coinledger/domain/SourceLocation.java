package com.coinledger.domain;

import java.util.Objects;

/**
 * Where a transaction was observed: an exchange export, or a chain plus wallet address.
 */
public record SourceLocation(SourceType type, String name, String address) {

    public SourceLocation {
        Objects.requireNonNull(type, "type");
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Source location name is required");
        }
    }

    public static SourceLocation exchange(String exchangeName) {
        return new SourceLocation(SourceType.EXCHANGE, exchangeName, null);
    }

    public static SourceLocation wallet(ChainId chain, String address) {
        return new SourceLocation(chain.getSourceType(), chain.id(), address);
    }

    /**
     * {@code exchange} for exchange exports, {@code chain:address} for wallets.
     */
    public String label() {
        return address == null ? name : name + ":" + address;
    }
}
