package com.coinledger.ingestion.ledger;

import com.coinledger.domain.Transaction;
import com.coinledger.domain.TransactionKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Pairs a WITHDRAWAL on one own source with the DEPOSIT of the same asset on another own source, so moving
 * coins between accounts is not booked as a sale and a purchase. Both sides get each other's id as
 * {@code transferPeerId}.
 */
@Component
@Slf4j
public class TransferReconciler {

    static final Duration MAX_DELAY = Duration.ofMinutes(15);
    static final BigDecimal MAX_RELATIVE_DIFFERENCE = new BigDecimal("0.02");
    static final BigDecimal ABSOLUTE_TOLERANCE = new BigDecimal("0.00000001");

    /**
     * Greedy in ledger order: each withdrawal takes the closest-in-time unpaired deposit that qualifies.
     *
     * @param ledger transactions in ledger order
     * @return the ledger in the same order with matched pairs linked
     */
    public List<Transaction> reconcile(List<Transaction> ledger) {
        Set<String> paired = new HashSet<>();
        Map<String, String> peers = new HashMap<>();
        for (Transaction withdrawal : ledger) {
            if (withdrawal.kind() != TransactionKind.WITHDRAWAL || paired.contains(withdrawal.id())) {
                continue;
            }
            Transaction best = null;
            long bestDistance = Long.MAX_VALUE;
            for (Transaction deposit : ledger) {
                if (!matches(withdrawal, deposit) || paired.contains(deposit.id())) {
                    continue;
                }
                long distance = Math.abs(Duration.between(withdrawal.timestamp(), deposit.timestamp()).toMillis());
                if (distance < bestDistance) {
                    best = deposit;
                    bestDistance = distance;
                }
            }
            if (best != null) {
                paired.add(withdrawal.id());
                paired.add(best.id());
                peers.put(withdrawal.id(), best.id());
                peers.put(best.id(), withdrawal.id());
                log.debug("Matched transfer {} -> {} ({} {})", withdrawal.id(), best.id(), withdrawal.amount(), withdrawal.asset());
            }
        }
        if (peers.isEmpty()) {
            return ledger;
        }
        log.info("Reconciled {} internal transfer(s)", peers.size() / 2);
        List<Transaction> out = new ArrayList<>(ledger.size());
        for (Transaction tx : ledger) {
            String peer = peers.get(tx.id());
            out.add(peer == null ? tx : tx.toBuilder().transferPeerId(peer).build());
        }
        return List.copyOf(out);
    }

    static boolean matches(Transaction withdrawal, Transaction deposit) {
        if (deposit.kind() != TransactionKind.DEPOSIT || !deposit.asset().equals(withdrawal.asset())) {
            return false;
        }
        if (deposit.location().label().equalsIgnoreCase(withdrawal.location().label())) {
            return false;
        }
        Duration delay = Duration.between(withdrawal.timestamp(), deposit.timestamp()).abs();
        if (delay.compareTo(MAX_DELAY) > 0) {
            return false;
        }
        BigDecimal larger = withdrawal.amount().max(deposit.amount());
        BigDecimal tolerance = larger.multiply(MAX_RELATIVE_DIFFERENCE).add(ABSOLUTE_TOLERANCE);
        return withdrawal.amount().subtract(deposit.amount()).abs().compareTo(tolerance) <= 0;
    }
}
