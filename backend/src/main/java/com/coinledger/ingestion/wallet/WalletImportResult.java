package com.coinledger.ingestion.wallet;

import com.coinledger.domain.Transaction;

import java.util.List;

/**
 * Transactions of all reachable wallets plus one warning per wallet that could not be imported.
 */
public record WalletImportResult(List<Transaction> transactions, List<String> warnings) {

    public WalletImportResult {
        transactions = List.copyOf(transactions);
        warnings = List.copyOf(warnings);
    }

    public static WalletImportResult empty() {
        return new WalletImportResult(List.of(), List.of());
    }
}
