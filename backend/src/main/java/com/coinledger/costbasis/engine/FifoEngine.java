package com.coinledger.costbasis.engine;

import com.coinledger.domain.Lot;
import com.coinledger.domain.RealizedGain;
import com.coinledger.domain.TradeDetails;
import com.coinledger.domain.Transaction;
import com.coinledger.domain.TransactionKind;
import com.coinledger.pricing.PriceBook;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * FIFO cost-basis engine. Walks the ledger once in order, opening a lot per acquisition and consuming the
 * oldest open lots of the asset per disposal. Trades quoted in an asset other than the reporting currency
 * are swaps and move the quote asset too. Stateless: every {@link #run} starts from an empty position.
 */
@Service
@Slf4j
public class FifoEngine {

    private static final int SCALE = 18;
    private static final RoundingMode ROUNDING = RoundingMode.HALF_UP;

    public FifoResult run(List<Transaction> ledger, PriceBook priceBook) {
        Run run = new Run(priceBook);
        Map<String, Transaction> byId = new HashMap<>();
        for (Transaction tx : ledger) {
            byId.put(tx.id(), tx);
        }
        for (Transaction tx : ledger) {
            run.apply(tx, tx.isInternalTransfer() ? byId.get(tx.transferPeerId()) : null);
        }
        log.info("FIFO run over {} transactions: {} lots, {} realized gains", ledger.size(), run.lots.size(), run.gains.size());
        return new FifoResult(List.copyOf(run.lots), List.copyOf(run.gains),
                Collections.unmodifiableMap(run.outcomes), Collections.unmodifiableMap(run.valuations),
                List.copyOf(run.checkpoints));
    }

    /** Mutable state of one run. */
    private static final class Run {

        private final PriceBook priceBook;
        private final Map<String, Deque<Lot>> openLots = new HashMap<>();
        private final Map<String, BigDecimal> quantities = new HashMap<>();
        private final List<Lot> lots = new ArrayList<>();
        private final List<RealizedGain> gains = new ArrayList<>();
        private final Map<String, TransactionOutcome> outcomes = new LinkedHashMap<>();
        private final Map<String, TransactionValuation> valuations = new LinkedHashMap<>();
        private final List<PositionCheckpoint> checkpoints = new ArrayList<>();
        private BigDecimal acquired = BigDecimal.ZERO;
        private BigDecimal disposed = BigDecimal.ZERO;

        Run(PriceBook priceBook) {
            this.priceBook = priceBook;
        }

        void apply(Transaction tx, Transaction peer) {
            Optional<BigDecimal> resolved = effectivePrice(tx);
            BigDecimal price = resolved.orElse(BigDecimal.ZERO);
            BigDecimal gross = scaled(tx.amount().multiply(price));
            BigDecimal feeValue = feeValue(tx, price);
            TransactionOutcome outcome;

            if (peer != null) {
                feeValue = feeValue.add(applyTransfer(tx, peer, price));
                outcome = TransactionOutcome.TRANSFER_MATCHED;
            } else if (priceBook.isReportingCurrency(tx.asset())) {
                outcome = TransactionOutcome.CURRENCY_MOVEMENT;
            } else if (tx.kind().isAcquisition()) {
                openLot(tx, tx.asset(), tx.amount(), gross.add(feeValue), "lot", false);
                if (tx.kind() == TransactionKind.BUY && hasForeignQuote(tx)) {
                    TradeDetails trade = tx.trade();
                    close(tx, trade.quoteAsset(), trade.quoteAmount(), gross, BigDecimal.ZERO);
                }
                outcome = TransactionOutcome.OPENED_LOT;
            } else if (tx.kind().isDisposal()) {
                close(tx, tx.asset(), tx.amount(), gross.subtract(feeValue), feeValue);
                if (tx.kind() == TransactionKind.SELL && hasForeignQuote(tx)) {
                    TradeDetails trade = tx.trade();
                    openLot(tx, trade.quoteAsset(), trade.quoteAmount(), gross, "quote", false);
                }
                outcome = TransactionOutcome.CLOSED_LOTS;
            } else {
                close(tx, tx.asset(), tx.amount(), BigDecimal.ZERO, BigDecimal.ZERO);
                outcome = TransactionOutcome.FEE_CONSUMED;
            }

            if (peer == null && tx.kind().isAcquisition()) {
                acquired = acquired.add(gross);
            } else if (peer == null && tx.kind().isDisposal()) {
                disposed = disposed.add(gross);
            }
            outcomes.put(tx.id(), outcome);
            valuations.put(tx.id(), new TransactionValuation(tx.id(), price, gross, feeValue, resolved.isEmpty()));
            checkpoints.add(new PositionCheckpoint(tx.timestamp(), tx.id(), heldQuantities(), acquired, disposed));
        }

        /**
         * A matched transfer only books the difference between both sides: more withdrawn than deposited is
         * consumed like a fee, more deposited than withdrawn opens a lot at the current price.
         *
         * @return value lost in transit, charged to the withdrawal side
         */
        private BigDecimal applyTransfer(Transaction tx, Transaction peer, BigDecimal price) {
            if (priceBook.isReportingCurrency(tx.asset())) {
                return BigDecimal.ZERO;
            }
            BigDecimal difference = tx.amount().subtract(peer.amount());
            if (difference.signum() <= 0) {
                return BigDecimal.ZERO;
            }
            if (tx.kind() == TransactionKind.WITHDRAWAL) {
                close(tx, tx.asset(), difference, BigDecimal.ZERO, BigDecimal.ZERO);
                return scaled(difference.multiply(price));
            }
            openLot(tx, tx.asset(), difference, scaled(difference.multiply(price)), "transfer", false);
            return BigDecimal.ZERO;
        }

        private Optional<BigDecimal> effectivePrice(Transaction tx) {
            if (tx.unitPrice() != null) {
                return Optional.of(tx.unitPrice());
            }
            if (priceBook.isReportingCurrency(tx.asset())) {
                return Optional.of(BigDecimal.ONE);
            }
            TradeDetails trade = tx.trade();
            if (trade == null || trade.quotePrice() == null) {
                return priceBook.priceAt(tx.asset(), tx.timestamp());
            }
            Optional<BigDecimal> viaQuote = priceBook.lookup(trade.quoteAsset(), tx.timestamp())
                    .map(q -> scaled(trade.quotePrice().multiply(q)));
            if (viaQuote.isPresent()) {
                return viaQuote;
            }
            Optional<BigDecimal> direct = priceBook.lookup(tx.asset(), tx.timestamp());
            if (direct.isEmpty()) {
                priceBook.markMissing(trade.quoteAsset());
                priceBook.markMissing(tx.asset());
            }
            return direct;
        }

        private BigDecimal feeValue(Transaction tx, BigDecimal price) {
            if (tx.fee().signum() <= 0 || !tx.hasKnownFeeAsset()) {
                return BigDecimal.ZERO;
            }
            String feeAsset = tx.feeAsset();
            if (priceBook.isReportingCurrency(feeAsset)) {
                return tx.fee();
            }
            if (feeAsset.equals(tx.asset())) {
                return scaled(tx.fee().multiply(price));
            }
            return priceBook.priceAt(feeAsset, tx.timestamp())
                    .map(p -> scaled(tx.fee().multiply(p)))
                    .orElse(BigDecimal.ZERO);
        }

        private boolean hasForeignQuote(Transaction tx) {
            TradeDetails trade = tx.trade();
            return trade != null && trade.quoteAmount() != null && trade.quoteAmount().signum() > 0
                    && !priceBook.isReportingCurrency(trade.quoteAsset());
        }

        private void openLot(Transaction tx, String asset, BigDecimal quantity, BigDecimal cost, String suffix, boolean synthetic) {
            if (priceBook.isReportingCurrency(asset)) {
                return;
            }
            Lot lot = Lot.open(tx.id() + "#" + suffix, asset, tx.id(), tx.timestamp(), quantity, cost, synthetic);
            lots.add(lot);
            openLots.computeIfAbsent(asset, a -> new ArrayDeque<>()).addLast(lot);
            quantities.merge(asset, quantity, BigDecimal::add);
        }

        /**
         * Consumes {@code quantity} of {@code asset} oldest lot first and emits one gain per consumed lot.
         * Net proceeds and fee are spread by quantity; the last step takes the remainder.
         */
        private void close(Transaction tx, String asset, BigDecimal quantity, BigDecimal netProceeds, BigDecimal fee) {
            if (priceBook.isReportingCurrency(asset)) {
                return;
            }
            Deque<Lot> queue = openLots.computeIfAbsent(asset, a -> new ArrayDeque<>());
            List<Step> steps = new ArrayList<>();
            BigDecimal remaining = quantity;
            while (remaining.signum() > 0 && !queue.isEmpty()) {
                Lot lot = queue.peekFirst();
                BigDecimal take = remaining.min(lot.getRemainingQuantity());
                steps.add(new Step(lot, take, lot.consume(take)));
                if (!lot.isOpen()) {
                    queue.pollFirst();
                }
                remaining = remaining.subtract(take);
            }
            BigDecimal consumedFromLots = quantity.subtract(remaining);
            if (remaining.signum() > 0) {
                log.warn("Shortfall of {} {} at transaction {}, closing against a zero-cost lot",
                        remaining.toPlainString(), asset, tx.id());
                Lot synthetic = Lot.open(tx.id() + "#synthetic-" + asset, asset, tx.id(), tx.timestamp(),
                        remaining, BigDecimal.ZERO, true);
                lots.add(synthetic);
                steps.add(new Step(synthetic, remaining, synthetic.consume(remaining)));
            }
            quantities.merge(asset, consumedFromLots.negate(), BigDecimal::add);

            BigDecimal allocatedProceeds = BigDecimal.ZERO;
            BigDecimal allocatedFee = BigDecimal.ZERO;
            for (int i = 0; i < steps.size(); i++) {
                Step step = steps.get(i);
                BigDecimal proceeds;
                BigDecimal feeShare;
                if (i == steps.size() - 1) {
                    proceeds = netProceeds.subtract(allocatedProceeds);
                    feeShare = fee.subtract(allocatedFee);
                } else {
                    proceeds = netProceeds.multiply(step.quantity()).divide(quantity, SCALE, ROUNDING);
                    feeShare = fee.multiply(step.quantity()).divide(quantity, SCALE, ROUNDING);
                }
                allocatedProceeds = allocatedProceeds.add(proceeds);
                allocatedFee = allocatedFee.add(feeShare);
                Lot lot = step.lot();
                gains.add(new RealizedGain(asset, step.quantity(), proceeds, step.cost(), feeShare,
                        proceeds.subtract(step.cost()), tx.timestamp(), tx.id(), lot.getId(), lot.getOpenedAt(),
                        lot.isSynthetic()));
            }
        }

        private Map<String, BigDecimal> heldQuantities() {
            Map<String, BigDecimal> held = new HashMap<>();
            quantities.forEach((asset, qty) -> {
                if (qty.signum() > 0) {
                    held.put(asset, qty);
                }
            });
            return held;
        }

        private static BigDecimal scaled(BigDecimal value) {
            return value.setScale(SCALE, ROUNDING);
        }
    }

    private record Step(Lot lot, BigDecimal quantity, BigDecimal cost) {
    }
}
