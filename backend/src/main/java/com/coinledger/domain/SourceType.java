package com.coinledger.domain;

/**
 * Origin family of a transaction. Declaration order is the ledger tie-break priority for equal timestamps.
 */
public enum SourceType {
    EXCHANGE,
    UTXO_WALLET,
    ACCOUNT_WALLET
}
