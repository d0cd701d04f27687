package com.coinledger.costbasis.engine;

/**
 * What the engine did with one ledger transaction. Every transaction gets exactly one outcome.
 */
public enum TransactionOutcome {
    OPENED_LOT,
    CLOSED_LOTS,
    FEE_CONSUMED,
    TRANSFER_MATCHED,
    /** Movement of the reporting currency itself, which is never held as lots. */
    CURRENCY_MOVEMENT
}
