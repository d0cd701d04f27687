package com.coinledger.domain;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Per-asset flow totals with the contributing ledger entries. {@code net = totalIn - totalOut - fees}.
 */
public record AssetBreakdown(
        String asset,
        BigDecimal totalIn,
        BigDecimal totalOut,
        BigDecimal net,
        BigDecimal fees,
        List<Entry> entries
) {

    public AssetBreakdown {
        entries = entries == null ? List.of() : List.copyOf(entries);
    }

    /**
     * @param leg    BASE for the transaction's own asset, QUOTE for the counter asset of a trade, FEE for a trade fee
     * @param amount signed quantity of this asset
     */
    public record Entry(String transactionId, Instant date, String type, String leg, BigDecimal amount) {
    }
}
