package com.coinledger.analysis;

import com.coinledger.config.AsyncConfig;
import com.coinledger.costbasis.engine.FifoEngine;
import com.coinledger.costbasis.valuation.HoldingValuator;
import com.coinledger.domain.AnalysisJob;
import com.coinledger.domain.AnalysisStep;
import com.coinledger.domain.ChainId;
import com.coinledger.domain.Lot;
import com.coinledger.domain.Session;
import com.coinledger.domain.SessionStatus;
import com.coinledger.domain.Transaction;
import com.coinledger.ingestion.csv.BinanceTradeCsvNormalizer;
import com.coinledger.ingestion.ledger.LedgerBuilder;
import com.coinledger.ingestion.ledger.TransferReconciler;
import com.coinledger.ingestion.wallet.WalletChainNormalizer;
import com.coinledger.ingestion.wallet.WalletImportResult;
import com.coinledger.ingestion.wallet.WalletTarget;
import com.coinledger.pricing.PriceBookFactory;
import com.coinledger.reporting.PortfolioHistoryBuilder;
import com.coinledger.reporting.ReportAggregator;
import com.coinledger.session.SessionService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Runs an analysis as a chain of steps (upload, normalize, compute, pricing, aggregate) on the analysis
 * executor. Each step is its own task started when the previous one completes; the first failure marks the
 * job ERROR and the partial results are dropped.
 */
@Component
@Slf4j
public class AnalysisPipelineRunner {

    private final BinanceTradeCsvNormalizer csvNormalizer;
    private final WalletChainNormalizer walletChainNormalizer;
    private final LedgerBuilder ledgerBuilder;
    private final TransferReconciler transferReconciler;
    private final FifoEngine fifoEngine;
    private final HoldingValuator holdingValuator;
    private final PortfolioHistoryBuilder portfolioHistoryBuilder;
    private final ReportAggregator reportAggregator;
    private final PriceBookFactory priceBookFactory;
    private final SessionService sessionService;
    private final PipelineProperties pipelineProperties;
    private final Executor analysisExecutor;

    public AnalysisPipelineRunner(
            BinanceTradeCsvNormalizer csvNormalizer,
            WalletChainNormalizer walletChainNormalizer,
            LedgerBuilder ledgerBuilder,
            TransferReconciler transferReconciler,
            FifoEngine fifoEngine,
            HoldingValuator holdingValuator,
            PortfolioHistoryBuilder portfolioHistoryBuilder,
            ReportAggregator reportAggregator,
            PriceBookFactory priceBookFactory,
            SessionService sessionService,
            PipelineProperties pipelineProperties,
            @Qualifier(AsyncConfig.ANALYSIS_EXECUTOR) Executor analysisExecutor
    ) {
        this.csvNormalizer = csvNormalizer;
        this.walletChainNormalizer = walletChainNormalizer;
        this.ledgerBuilder = ledgerBuilder;
        this.transferReconciler = transferReconciler;
        this.fifoEngine = fifoEngine;
        this.holdingValuator = holdingValuator;
        this.portfolioHistoryBuilder = portfolioHistoryBuilder;
        this.reportAggregator = reportAggregator;
        this.priceBookFactory = priceBookFactory;
        this.sessionService = sessionService;
        this.pipelineProperties = pipelineProperties;
        this.analysisExecutor = analysisExecutor;
    }

    @EventListener
    public void onAnalysisRequested(AnalysisRequestedEvent event) {
        run(event.job(), event.request());
    }

    /**
     * @return completes when the job reached COMPLETED or ERROR; never completes exceptionally
     */
    CompletableFuture<Void> run(AnalysisJob job, AnalysisRequest request) {
        CompletableFuture<PipelineState> chain = CompletableFuture.completedFuture(null);
        for (AnalysisStep step : AnalysisStep.values()) {
            chain = chain.thenApplyAsync(state -> execute(job, step, state, request), analysisExecutor);
        }
        return chain.handle((state, error) -> {
            if (error != null) {
                Throwable cause = rootCause(error);
                String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
                log.error("Analysis job {} failed: {}", job.getId(), message, cause);
                job.fail(message);
            } else {
                job.complete(state.sessionId);
                log.info("Analysis job {} completed with session {}", job.getId(), state.sessionId);
            }
            return null;
        });
    }

    private PipelineState execute(AnalysisJob job, AnalysisStep step, PipelineState state, AnalysisRequest request) {
        job.startStep(step);
        log.info("Job {} step {} started", job.getId(), step.key());
        PipelineState next = switch (step) {
            case UPLOAD -> upload(job, request);
            case NORMALIZE -> normalize(job, state);
            case COMPUTE -> compute(job, state);
            case PRICING -> pricing(job, state);
            case AGGREGATE -> aggregate(job, state);
        };
        job.completeStep(step);
        log.info("Job {} step {} completed", job.getId(), step.key());
        return next;
    }

    private PipelineState upload(AnalysisJob job, AnalysisRequest request) {
        if (!request.hasAnySource()) {
            throw new IllegalArgumentException("At least one of CSV file, BTC addresses or EVM addresses is required");
        }
        PipelineState state = new PipelineState(request, priceBookFactory.open());
        if (request.hasCsv()) {
            job.addMessage("Received trade export (" + request.csvContent().length() + " characters)");
        }
        if (!request.btcAddresses().isEmpty()) {
            job.addMessage("Received " + request.btcAddresses().size() + " BTC address(es)");
        }
        if (!request.evmAddresses().isEmpty()) {
            job.addMessage("Received " + request.evmAddresses().size() + " EVM address(es) for "
                    + request.chains().stream().map(ChainId::id).toList());
        }
        return state;
    }

    private PipelineState normalize(AnalysisJob job, PipelineState state) {
        AnalysisRequest request = state.request;
        List<Transaction> transactions = new ArrayList<>();
        if (request.hasCsv()) {
            List<Transaction> exported = csvNormalizer.normalize(request.csvContent(), state.priceBook.reportingCurrency());
            job.addMessage("Parsed " + exported.size() + " exchange transactions");
            transactions.addAll(exported);
        }
        List<WalletTarget> targets = walletTargets(request);
        if (!targets.isEmpty()) {
            WalletImportResult result = walletChainNormalizer.importWallets(targets, job::addMessage);
            result.warnings().forEach(job::addWarning);
            transactions.addAll(result.transactions());
        }
        state.transactions = transactions;
        return state;
    }

    private PipelineState compute(AnalysisJob job, PipelineState state) {
        List<Transaction> ledger = transferReconciler.reconcile(ledgerBuilder.build(state.transactions));
        state.ledger = ledger;
        state.fifoResult = fifoEngine.run(ledger, state.priceBook);
        long synthetic = state.fifoResult.lots().stream().filter(Lot::isSynthetic).count();
        if (synthetic > 0) {
            job.addWarning(synthetic + " disposal(s) exceeded the known holdings and were closed against zero-cost lots");
        }
        job.addMessage("Ledger has " + ledger.size() + " transactions, " + state.fifoResult.realizedGains().size()
                + " realized gain entries");
        return state;
    }

    private PipelineState pricing(AnalysisJob job, PipelineState state) {
        state.holdings = holdingValuator.value(state.fifoResult.lots(), state.priceBook);
        state.snapshots = portfolioHistoryBuilder.build(state.fifoResult.checkpoints(), state.priceBook,
                pipelineProperties.getMaxHistoryPoints());
        Set<String> missing = state.priceBook.missingPrices();
        if (!missing.isEmpty()) {
            job.addWarning("No price available for " + String.join(", ", missing) + "; valued at 0");
        }
        return state;
    }

    private PipelineState aggregate(AnalysisJob job, PipelineState state) {
        String reportingCurrency = state.priceBook.reportingCurrency();
        Session session = new Session(
                UUID.randomUUID().toString(),
                Instant.now(),
                SessionStatus.READY,
                reportingCurrency,
                state.ledger,
                state.fifoResult.lots(),
                state.fifoResult.realizedGains(),
                state.holdings,
                reportAggregator.operations(state.ledger, state.fifoResult),
                state.snapshots,
                reportAggregator.breakdown(state.ledger, reportingCurrency),
                reportAggregator.summary(state.ledger, state.fifoResult, state.holdings),
                state.priceBook.missingPrices());
        sessionService.save(session);
        state.sessionId = session.id();
        return state;
    }

    static List<WalletTarget> walletTargets(AnalysisRequest request) {
        List<WalletTarget> targets = new ArrayList<>();
        for (String address : request.btcAddresses()) {
            targets.add(new WalletTarget(ChainId.BITCOIN, address));
        }
        for (String address : request.evmAddresses()) {
            for (ChainId chain : request.chains()) {
                if (chain.isAccountBased()) {
                    targets.add(new WalletTarget(chain, address));
                }
            }
        }
        return targets;
    }

    private static Throwable rootCause(Throwable error) {
        Throwable t = error;
        while (t instanceof CompletionException && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }
}
