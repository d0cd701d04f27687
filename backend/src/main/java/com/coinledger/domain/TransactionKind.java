package com.coinledger.domain;

/**
 * Canonical transaction kinds. Direction of the amount is implied by the kind.
 */
public enum TransactionKind {
    BUY,
    SELL,
    DEPOSIT,
    WITHDRAWAL,
    FEE_ONLY;

    public boolean isAcquisition() {
        return this == BUY || this == DEPOSIT;
    }

    public boolean isDisposal() {
        return this == SELL || this == WITHDRAWAL;
    }

    public boolean isTrade() {
        return this == BUY || this == SELL;
    }
}
