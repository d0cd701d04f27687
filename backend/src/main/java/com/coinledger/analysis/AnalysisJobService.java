package com.coinledger.analysis;

import com.coinledger.domain.AnalysisJob;
import com.coinledger.domain.AnalysisJobView;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/**
 * Accepts analysis requests and exposes job progress.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AnalysisJobService {

    private final AnalysisJobStore jobStore;
    private final ApplicationEventPublisher applicationEventPublisher;

    /**
     * Registers a job and hands it to the pipeline; returns before any step runs.
     */
    public AnalysisJobView submit(AnalysisRequest request) {
        AnalysisJob job = jobStore.create();
        log.info("Analysis job {} submitted (csv={}, btc={}, evm={}, chains={})", job.getId(), request.hasCsv(),
                request.btcAddresses().size(), request.evmAddresses().size(), request.chains());
        applicationEventPublisher.publishEvent(new AnalysisRequestedEvent(job, request));
        return job.snapshot();
    }

    public AnalysisJobView get(String jobId) {
        return jobStore.get(jobId).snapshot();
    }
}
