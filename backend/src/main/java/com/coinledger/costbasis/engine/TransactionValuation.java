package com.coinledger.costbasis.engine;

import java.math.BigDecimal;

/**
 * Reporting-currency valuation of one transaction as used by the engine.
 *
 * @param price        effective unit price, zero when unresolved
 * @param grossValue   amount x price
 * @param feeValue     fee in the reporting currency; for a matched transfer the value lost in transit
 * @param priceMissing no price could be resolved
 */
public record TransactionValuation(
        String transactionId,
        BigDecimal price,
        BigDecimal grossValue,
        BigDecimal feeValue,
        boolean priceMissing
) {
}
