package com.coinledger.domain;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Flat row per ledger transaction for the operations table and CSV export.
 *
 * @param amount signed quantity
 * @param price  effective unit price in the reporting currency (zero when unresolved)
 * @param fee    fee value in the reporting currency
 * @param total  gross value, |amount| x price
 */
public record OperationView(
        String id,
        Instant date,
        String asset,
        String type,
        BigDecimal amount,
        BigDecimal price,
        BigDecimal fee,
        BigDecimal total,
        String source
) {
}
