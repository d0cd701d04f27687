package com.coinledger.costbasis.engine;

import com.coinledger.domain.Lot;
import com.coinledger.domain.RealizedGain;

import java.util.List;
import java.util.Map;

/**
 * Output of one engine run over a ledger.
 *
 * @param lots         every lot ever opened, synthetic ones included, in opening order
 * @param outcomes     keyed by transaction id, in ledger order
 * @param valuations   keyed by transaction id, in ledger order
 * @param checkpoints  one per ledger transaction
 */
public record FifoResult(
        List<Lot> lots,
        List<RealizedGain> realizedGains,
        Map<String, TransactionOutcome> outcomes,
        Map<String, TransactionValuation> valuations,
        List<PositionCheckpoint> checkpoints
) {

    public List<Lot> openLots() {
        return lots.stream().filter(Lot::isOpen).toList();
    }
}
