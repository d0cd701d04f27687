package com.coinledger.analysis;

import com.coinledger.costbasis.engine.FifoResult;
import com.coinledger.domain.Holding;
import com.coinledger.domain.PortfolioSnapshot;
import com.coinledger.domain.Transaction;
import com.coinledger.pricing.PriceBook;

import java.util.List;

/**
 * Intermediate results handed from one pipeline step to the next. Confined to the run: steps execute one
 * after another, each completion happening-before the next step starts.
 */
class PipelineState {

    final AnalysisRequest request;
    final PriceBook priceBook;
    List<Transaction> transactions = List.of();
    List<Transaction> ledger = List.of();
    FifoResult fifoResult;
    List<Holding> holdings = List.of();
    List<PortfolioSnapshot> snapshots = List.of();
    String sessionId;

    PipelineState(AnalysisRequest request, PriceBook priceBook) {
        this.request = request;
        this.priceBook = priceBook;
    }
}
