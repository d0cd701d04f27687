package com.coinledger.analysis;

import com.coinledger.domain.AnalysisJob;

/**
 * Published after a job is registered; the pipeline runner picks it up.
 */
public record AnalysisRequestedEvent(AnalysisJob job, AnalysisRequest request) {
}
