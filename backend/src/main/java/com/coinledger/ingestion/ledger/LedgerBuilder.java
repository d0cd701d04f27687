package com.coinledger.ingestion.ledger;

import com.coinledger.domain.Transaction;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Merges normalized transactions of all sources into one chronological ledger.
 */
@Component
@Slf4j
public class LedgerBuilder {

    /** Timestamp, then source type (exchange before UTXO before account wallets), then id. */
    public static final Comparator<Transaction> LEDGER_ORDER = Comparator
            .comparing(Transaction::timestamp)
            .thenComparing(t -> t.location().type().ordinal())
            .thenComparing(Transaction::id);

    /**
     * Collapses duplicate ids (first occurrence wins) and sorts by {@link #LEDGER_ORDER}.
     */
    public List<Transaction> build(Collection<Transaction> transactions) {
        Map<String, Transaction> byId = new LinkedHashMap<>();
        for (Transaction tx : transactions) {
            Transaction previous = byId.putIfAbsent(tx.id(), tx);
            if (previous != null) {
                log.debug("Dropping duplicate transaction {}", tx.id());
            }
        }
        List<Transaction> ledger = new ArrayList<>(byId.values());
        ledger.sort(LEDGER_ORDER);
        return List.copyOf(ledger);
    }
}
