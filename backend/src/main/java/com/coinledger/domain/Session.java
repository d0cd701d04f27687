package com.coinledger.domain;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * Complete result of one analysis run. Owns its ledger, lots and realized gains; never modified once READY.
 * Lots are mutable, so the session keeps its own copies and hands out fresh ones.
 */
@Document(collection = "sessions")
public record Session(
        @Id String id,
        Instant createdAt,
        SessionStatus status,
        String reportingCurrency,
        List<Transaction> ledger,
        List<Lot> lots,
        List<RealizedGain> realizedGains,
        List<Holding> holdings,
        List<OperationView> operations,
        List<PortfolioSnapshot> snapshots,
        List<AssetBreakdown> assetBreakdown,
        PortfolioSummary summary,
        Set<String> missingPrices
) {

    public Session {
        ledger = ledger == null ? List.of() : List.copyOf(ledger);
        lots = lots == null ? List.of() : copies(lots);
        realizedGains = realizedGains == null ? List.of() : List.copyOf(realizedGains);
        holdings = holdings == null ? List.of() : List.copyOf(holdings);
        operations = operations == null ? List.of() : List.copyOf(operations);
        snapshots = snapshots == null ? List.of() : List.copyOf(snapshots);
        assetBreakdown = assetBreakdown == null ? List.of() : List.copyOf(assetBreakdown);
        missingPrices = missingPrices == null ? Set.of() : Set.copyOf(missingPrices);
        summary = summary == null ? PortfolioSummary.empty() : summary;
    }

    @Override
    public List<Lot> lots() {
        return copies(lots);
    }

    private static List<Lot> copies(List<Lot> lots) {
        return lots.stream().map(Lot::copy).toList();
    }
}
