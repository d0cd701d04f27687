package com.coinledger.domain;

import lombok.Getter;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;

/**
 * FIFO lot: a quantity of one asset acquired at a fixed unit cost. Remaining quantity only decreases;
 * fully consumed lots stay around with zero remaining for audit.
 */
@Getter
public class Lot {

    private static final int SCALE = 18;
    private static final RoundingMode ROUNDING = RoundingMode.HALF_UP;

    private final String id;
    private final String asset;
    private final String transactionId;
    private final Instant openedAt;
    private final BigDecimal originalQuantity;
    private final BigDecimal costBasis;
    private final BigDecimal unitCost;
    private final boolean synthetic;
    private BigDecimal remainingQuantity;
    private BigDecimal remainingCost;

    public Lot(String id, String asset, String transactionId, Instant openedAt, BigDecimal originalQuantity,
               BigDecimal costBasis, BigDecimal unitCost, boolean synthetic,
               BigDecimal remainingQuantity, BigDecimal remainingCost) {
        this.id = id;
        this.asset = asset;
        this.transactionId = transactionId;
        this.openedAt = openedAt;
        this.originalQuantity = originalQuantity;
        this.costBasis = costBasis;
        this.unitCost = unitCost;
        this.synthetic = synthetic;
        this.remainingQuantity = remainingQuantity;
        this.remainingCost = remainingCost;
    }

    /**
     * Opens a lot for {@code quantity} at total {@code costBasis}. Unit cost is fixed here.
     */
    public static Lot open(String id, String asset, String transactionId, Instant openedAt,
                           BigDecimal quantity, BigDecimal costBasis, boolean synthetic) {
        if (quantity == null || quantity.signum() <= 0) {
            throw new IllegalArgumentException("Lot quantity must be positive, got: " + quantity);
        }
        BigDecimal cost = costBasis == null ? BigDecimal.ZERO : costBasis;
        BigDecimal unitCost = cost.divide(quantity, SCALE, ROUNDING);
        return new Lot(id, asset, transactionId, openedAt, quantity, cost, unitCost, synthetic, quantity, cost);
    }

    /**
     * Takes {@code quantity} out of the lot and returns the cost basis consumed. Consuming the whole remainder
     * returns the whole remaining cost so a lot never leaves rounding residue.
     */
    public BigDecimal consume(BigDecimal quantity) {
        if (quantity == null || quantity.signum() <= 0) {
            throw new IllegalArgumentException("Consumed quantity must be positive, got: " + quantity);
        }
        int cmp = quantity.compareTo(remainingQuantity);
        if (cmp > 0) {
            throw new IllegalStateException("Lot " + id + " has " + remainingQuantity.toPlainString()
                    + " remaining, cannot consume " + quantity.toPlainString());
        }
        BigDecimal consumedCost;
        if (cmp == 0) {
            consumedCost = remainingCost;
            remainingQuantity = BigDecimal.ZERO;
            remainingCost = BigDecimal.ZERO;
        } else {
            consumedCost = unitCost.multiply(quantity).setScale(SCALE, ROUNDING);
            remainingQuantity = remainingQuantity.subtract(quantity);
            remainingCost = remainingCost.subtract(consumedCost);
        }
        return consumedCost;
    }

    /**
     * Detached copy with the current remaining quantity and cost.
     */
    public Lot copy() {
        return new Lot(id, asset, transactionId, openedAt, originalQuantity, costBasis, unitCost, synthetic,
                remainingQuantity, remainingCost);
    }

    public boolean isOpen() {
        return remainingQuantity.signum() > 0;
    }
}
