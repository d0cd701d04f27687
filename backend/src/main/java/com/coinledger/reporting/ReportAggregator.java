package com.coinledger.reporting;

import com.coinledger.costbasis.engine.FifoResult;
import com.coinledger.costbasis.engine.TransactionValuation;
import com.coinledger.domain.AssetBreakdown;
import com.coinledger.domain.Holding;
import com.coinledger.domain.OperationView;
import com.coinledger.domain.PortfolioSummary;
import com.coinledger.domain.RealizedGain;
import com.coinledger.domain.TradeDetails;
import com.coinledger.domain.Transaction;
import com.coinledger.domain.TransactionKind;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Derives the report views of a session from the ledger and the engine output.
 */
@Component
public class ReportAggregator {

    static final String LEG_BASE = "BASE";
    static final String LEG_QUOTE = "QUOTE";
    static final String LEG_FEE = "FEE";

    public List<OperationView> operations(List<Transaction> ledger, FifoResult result) {
        List<OperationView> rows = new ArrayList<>(ledger.size());
        for (Transaction tx : ledger) {
            TransactionValuation v = valuation(result, tx);
            rows.add(new OperationView(tx.id(), tx.timestamp(), tx.asset(), tx.kind().name(), tx.signedAmount(),
                    v.price(), v.feeValue(), v.grossValue(), tx.location().label()));
        }
        return rows;
    }

    /**
     * Invested and withdrawn count external movements only; matched internal transfers contribute their
     * in-transit loss to fees.
     */
    public PortfolioSummary summary(List<Transaction> ledger, FifoResult result, List<Holding> holdings) {
        BigDecimal invested = BigDecimal.ZERO;
        BigDecimal withdrawn = BigDecimal.ZERO;
        BigDecimal fees = BigDecimal.ZERO;
        for (Transaction tx : ledger) {
            TransactionValuation v = valuation(result, tx);
            fees = fees.add(v.feeValue());
            if (tx.kind() == TransactionKind.FEE_ONLY) {
                fees = fees.add(v.grossValue());
            } else if (!tx.isInternalTransfer() && tx.kind().isAcquisition()) {
                invested = invested.add(v.grossValue());
            } else if (!tx.isInternalTransfer() && tx.kind().isDisposal()) {
                withdrawn = withdrawn.add(v.grossValue());
            }
        }
        BigDecimal realized = result.realizedGains().stream().map(RealizedGain::gain).reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal balance = holdings.stream().map(Holding::marketValue).reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal unrealized = holdings.stream().map(Holding::unrealizedGain).reduce(BigDecimal.ZERO, BigDecimal::add);
        return new PortfolioSummary(invested, withdrawn, balance, fees, realized, unrealized);
    }

    /**
     * Per-asset flows sorted by asset. The reporting currency is not broken down.
     */
    public List<AssetBreakdown> breakdown(List<Transaction> ledger, String reportingCurrency) {
        Map<String, Flows> byAsset = new TreeMap<>();
        for (Transaction tx : ledger) {
            String type = tx.kind().name();
            if (tx.kind() == TransactionKind.FEE_ONLY) {
                flows(byAsset, tx.asset()).fee(tx, type, LEG_BASE, tx.amount());
            } else {
                flows(byAsset, tx.asset()).move(tx, type, LEG_BASE, tx.signedAmount());
            }
            TradeDetails trade = tx.trade();
            if (tx.kind().isTrade() && trade != null && trade.quoteAmount() != null) {
                BigDecimal quoteAmount = tx.kind() == TransactionKind.BUY ? trade.quoteAmount().negate() : trade.quoteAmount();
                flows(byAsset, trade.quoteAsset()).move(tx, type, LEG_QUOTE, quoteAmount);
            }
            if (tx.fee().signum() > 0 && tx.hasKnownFeeAsset()) {
                flows(byAsset, tx.feeAsset()).fee(tx, type, LEG_FEE, tx.fee());
            }
        }
        byAsset.remove(reportingCurrency.toUpperCase(Locale.ROOT));
        List<AssetBreakdown> out = new ArrayList<>(byAsset.size());
        byAsset.forEach((asset, f) -> out.add(new AssetBreakdown(asset, f.in, f.out,
                f.in.subtract(f.out).subtract(f.fees), f.fees, f.entries)));
        return out;
    }

    /**
     * Buckets realized gains by the period of their closing date, ascending.
     */
    public List<GainsPeriod> gainsByPeriod(List<RealizedGain> gains, GroupBy groupBy) {
        Map<LocalDate, List<RealizedGain>> buckets = new TreeMap<>();
        for (RealizedGain gain : gains) {
            LocalDate start = groupBy.periodStart(gain.closedAt().atZone(ZoneOffset.UTC).toLocalDate());
            buckets.computeIfAbsent(start, s -> new ArrayList<>()).add(gain);
        }
        List<GainsPeriod> periods = new ArrayList<>(buckets.size());
        buckets.forEach((start, entries) -> periods.add(new GainsPeriod(groupBy.label(start), start,
                entries.stream().map(RealizedGain::gain).reduce(BigDecimal.ZERO, BigDecimal::add), entries)));
        return periods;
    }

    private static TransactionValuation valuation(FifoResult result, Transaction tx) {
        TransactionValuation v = result.valuations().get(tx.id());
        if (v == null) {
            throw new IllegalStateException("No valuation for transaction " + tx.id());
        }
        return v;
    }

    private static Flows flows(Map<String, Flows> byAsset, String asset) {
        return byAsset.computeIfAbsent(asset, a -> new Flows());
    }

    private static final class Flows {

        private BigDecimal in = BigDecimal.ZERO;
        private BigDecimal out = BigDecimal.ZERO;
        private BigDecimal fees = BigDecimal.ZERO;
        private final List<AssetBreakdown.Entry> entries = new ArrayList<>();

        void move(Transaction tx, String type, String leg, BigDecimal signed) {
            if (signed.signum() >= 0) {
                in = in.add(signed);
            } else {
                out = out.add(signed.negate());
            }
            entries.add(new AssetBreakdown.Entry(tx.id(), tx.timestamp(), type, leg, signed));
        }

        void fee(Transaction tx, String type, String leg, BigDecimal amount) {
            fees = fees.add(amount);
            entries.add(new AssetBreakdown.Entry(tx.id(), tx.timestamp(), type, leg, amount.negate()));
        }
    }
}
