package com.coinledger.costbasis.engine;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Held quantities after one transaction, with cumulative acquisition and disposal values up to it.
 * Internal transfers do not count as acquisitions or disposals.
 */
public record PositionCheckpoint(
        Instant timestamp,
        String transactionId,
        Map<String, BigDecimal> quantities,
        BigDecimal acquiredValue,
        BigDecimal disposedValue
) {

    public PositionCheckpoint {
        quantities = Collections.unmodifiableMap(new TreeMap<>(quantities));
    }
}
