package com.coinledger.domain;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One lot-consumption step of a disposal. A disposal spanning several lots yields several entries sharing
 * {@code transactionId}. {@code proceeds} are net of {@code feeShare}.
 */
public record RealizedGain(
        String asset,
        BigDecimal quantity,
        BigDecimal proceeds,
        BigDecimal costBasis,
        BigDecimal feeShare,
        BigDecimal gain,
        Instant closedAt,
        String transactionId,
        String lotId,
        Instant lotOpenedAt,
        boolean synthetic
) {
}
