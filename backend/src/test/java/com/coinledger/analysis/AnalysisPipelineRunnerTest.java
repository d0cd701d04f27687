package com.coinledger.analysis;

import com.coinledger.costbasis.engine.FifoEngine;
import com.coinledger.costbasis.valuation.HoldingValuator;
import com.coinledger.domain.AnalysisJob;
import com.coinledger.domain.AnalysisJobView;
import com.coinledger.domain.AnalysisStep;
import com.coinledger.domain.ChainId;
import com.coinledger.domain.JobStatus;
import com.coinledger.domain.PriceSource;
import com.coinledger.domain.Session;
import com.coinledger.domain.SessionStatus;
import com.coinledger.domain.StepStatus;
import com.coinledger.ingestion.config.CsvImportProperties;
import com.coinledger.ingestion.csv.BinanceTradeCsvNormalizer;
import com.coinledger.ingestion.ledger.LedgerBuilder;
import com.coinledger.ingestion.ledger.TransferReconciler;
import com.coinledger.ingestion.wallet.WalletChainNormalizer;
import com.coinledger.ingestion.wallet.WalletImportResult;
import com.coinledger.ingestion.wallet.WalletTarget;
import com.coinledger.pricing.PriceBook;
import com.coinledger.pricing.PriceBookFactory;
import com.coinledger.pricing.PriceResolutionResult;
import com.coinledger.pricing.SpotPriceResolver;
import com.coinledger.reporting.PortfolioHistoryBuilder;
import com.coinledger.reporting.ReportAggregator;
import com.coinledger.session.SessionService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AnalysisPipelineRunnerTest {

    private static final String CSV = """
            Date(UTC),Pair,Side,Price,Executed,Amount,Fee,Fee Asset
            2024-01-05 10:00:00,BTCEUR,BUY,20000,1,20000,0,EUR
            2024-02-05 10:00:00,BTCEUR,SELL,25000,0.4,10000,0,EUR
            """;

    @Mock
    WalletChainNormalizer walletChainNormalizer;

    @Mock
    PriceBookFactory priceBookFactory;

    @Mock
    SpotPriceResolver spotPriceResolver;

    @Mock
    SessionService sessionService;

    private AnalysisPipelineRunner runner;

    @BeforeEach
    void setUp() {
        lenient().when(priceBookFactory.open()).thenAnswer(inv -> new PriceBook(
                request -> PriceResolutionResult.known(new BigDecimal("30000"), PriceSource.COINGECKO),
                spotPriceResolver, "EUR", Clock.systemUTC()));
        runner = runnerWith(new FifoEngine());
    }

    private AnalysisPipelineRunner runnerWith(FifoEngine fifoEngine) {
        return new AnalysisPipelineRunner(
                new BinanceTradeCsvNormalizer(new CsvImportProperties()),
                walletChainNormalizer,
                new LedgerBuilder(),
                new TransferReconciler(),
                fifoEngine,
                new HoldingValuator(),
                new PortfolioHistoryBuilder(),
                new ReportAggregator(),
                priceBookFactory,
                sessionService,
                new PipelineProperties(),
                Runnable::run);
    }

    @Test
    @DisplayName("CSV analysis runs every step and stores a ready session")
    void completes() {
        AnalysisJob job = new AnalysisJob("job-1");

        runner.run(job, new AnalysisRequest(CSV, List.of(), List.of(), List.of())).join();

        AnalysisJobView view = job.snapshot();
        assertThat(view.status()).isEqualTo(JobStatus.COMPLETED);
        assertThat(view.steps()).extracting(AnalysisJobView.StepView::status).containsOnly(StepStatus.COMPLETED);
        ArgumentCaptor<Session> captor = ArgumentCaptor.forClass(Session.class);
        verify(sessionService).save(captor.capture());
        Session session = captor.getValue();
        assertThat(view.sessionId()).isEqualTo(session.id());
        assertThat(session.status()).isEqualTo(SessionStatus.READY);
        assertThat(session.reportingCurrency()).isEqualTo("EUR");
        assertThat(session.ledger()).hasSize(2);
        assertThat(session.summary().realizedGains()).isEqualByComparingTo("2000");
        assertThat(session.holdings()).singleElement().satisfies(h -> {
            assertThat(h.quantity()).isEqualByComparingTo("0.6");
            assertThat(h.marketValue()).isEqualByComparingTo("18000");
        });
        assertThat(view.messages()).contains("Parsed 2 exchange transactions");
        verify(walletChainNormalizer, never()).importWallets(anyList(), any());
    }

    @Test
    @DisplayName("malformed CSV fails the job at normalize and stores nothing")
    void malformedCsvFails() {
        AnalysisJob job = new AnalysisJob("job-2");

        runner.run(job, new AnalysisRequest("Date,Pair\n2024-01-01,BTCEUR\n", List.of(), List.of(), List.of())).join();

        assertThat(job.getStatus()).isEqualTo(JobStatus.ERROR);
        assertThat(job.stepStatus(AnalysisStep.UPLOAD)).isEqualTo(StepStatus.COMPLETED);
        assertThat(job.stepStatus(AnalysisStep.NORMALIZE)).isEqualTo(StepStatus.ERROR);
        assertThat(job.stepStatus(AnalysisStep.COMPUTE)).isEqualTo(StepStatus.PENDING);
        assertThat(job.snapshot().error()).contains("CSV headers");
        assertThat(job.snapshot().sessionId()).isNull();
        verify(sessionService, never()).save(any());
    }

    @Test
    @DisplayName("request without sources fails at upload")
    void noSources() {
        AnalysisJob job = new AnalysisJob("job-3");

        runner.run(job, new AnalysisRequest(null, List.of(), List.of(), List.of())).join();

        assertThat(job.getStatus()).isEqualTo(JobStatus.ERROR);
        assertThat(job.stepStatus(AnalysisStep.UPLOAD)).isEqualTo(StepStatus.ERROR);
    }

    @Test
    @DisplayName("engine failure fails the job at compute and stores nothing")
    void computeFails() {
        FifoEngine failingEngine = mock(FifoEngine.class);
        when(failingEngine.run(anyList(), any())).thenThrow(new IllegalStateException("Lot b1#lot cannot be consumed"));
        AnalysisJob job = new AnalysisJob("job-5");

        runnerWith(failingEngine).run(job, new AnalysisRequest(CSV, List.of(), List.of(), List.of())).join();

        assertThat(job.getStatus()).isEqualTo(JobStatus.ERROR);
        assertThat(job.snapshot().error()).isEqualTo("Lot b1#lot cannot be consumed");
        assertThat(job.stepStatus(AnalysisStep.NORMALIZE)).isEqualTo(StepStatus.COMPLETED);
        assertThat(job.stepStatus(AnalysisStep.COMPUTE)).isEqualTo(StepStatus.ERROR);
        assertThat(job.stepStatus(AnalysisStep.PRICING)).isEqualTo(StepStatus.PENDING);
        assertThat(job.stepStatus(AnalysisStep.AGGREGATE)).isEqualTo(StepStatus.PENDING);
        assertThat(job.snapshot().sessionId()).isNull();
        verify(sessionService, never()).save(any());
    }

    @Test
    @DisplayName("price feed failure fails the job at pricing and stores nothing")
    void pricingFails() {
        when(spotPriceResolver.resolve("BTC")).thenThrow(new IllegalStateException("Spot price feed unavailable"));
        AnalysisJob job = new AnalysisJob("job-6");

        runner.run(job, new AnalysisRequest(CSV, List.of(), List.of(), List.of())).join();

        assertThat(job.getStatus()).isEqualTo(JobStatus.ERROR);
        assertThat(job.snapshot().error()).isEqualTo("Spot price feed unavailable");
        assertThat(job.stepStatus(AnalysisStep.COMPUTE)).isEqualTo(StepStatus.COMPLETED);
        assertThat(job.stepStatus(AnalysisStep.PRICING)).isEqualTo(StepStatus.ERROR);
        assertThat(job.stepStatus(AnalysisStep.AGGREGATE)).isEqualTo(StepStatus.PENDING);
        assertThat(job.snapshot().sessionId()).isNull();
        verify(sessionService, never()).save(any());
    }

    @Test
    @DisplayName("session store failure fails the job at aggregate without a session id")
    void aggregateFails() {
        doThrow(new IllegalStateException("Session store unavailable")).when(sessionService).save(any());
        AnalysisJob job = new AnalysisJob("job-7");

        runner.run(job, new AnalysisRequest(CSV, List.of(), List.of(), List.of())).join();

        assertThat(job.getStatus()).isEqualTo(JobStatus.ERROR);
        assertThat(job.snapshot().error()).isEqualTo("Session store unavailable");
        assertThat(job.stepStatus(AnalysisStep.PRICING)).isEqualTo(StepStatus.COMPLETED);
        assertThat(job.stepStatus(AnalysisStep.AGGREGATE)).isEqualTo(StepStatus.ERROR);
        assertThat(job.snapshot().sessionId()).isNull();
    }

    @Test
    @DisplayName("wallet warnings are surfaced and the job still completes")
    void walletWarnings() {
        when(walletChainNormalizer.importWallets(anyList(), any()))
                .thenReturn(new WalletImportResult(List.of(), List.of("Could not import bitcoin:bc1qx: HTTP 503")));
        AnalysisJob job = new AnalysisJob("job-4");

        runner.run(job, new AnalysisRequest(CSV, List.of("bc1qx"), List.of(), List.of())).join();

        assertThat(job.getStatus()).isEqualTo(JobStatus.COMPLETED);
        assertThat(job.snapshot().warnings()).containsExactly("Could not import bitcoin:bc1qx: HTTP 503");
    }

    @Test
    @DisplayName("EVM addresses expand over every requested account chain")
    void walletTargets() {
        AnalysisRequest request = new AnalysisRequest(null, List.of("bc1qa"), List.of("0xabc"),
                List.of(ChainId.ETHEREUM, ChainId.ARBITRUM));

        assertThat(AnalysisPipelineRunner.walletTargets(request)).containsExactly(
                new WalletTarget(ChainId.BITCOIN, "bc1qa"),
                new WalletTarget(ChainId.ETHEREUM, "0xabc"),
                new WalletTarget(ChainId.ARBITRUM, "0xabc"));
    }
}
