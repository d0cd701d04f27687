package com.coinledger.domain;

import java.time.Instant;
import java.util.List;

/**
 * Immutable point-in-time copy of an {@link AnalysisJob}, safe to hand to pollers.
 */
public record AnalysisJobView(
        String id,
        JobStatus status,
        List<StepView> steps,
        List<String> messages,
        List<String> warnings,
        String sessionId,
        String error,
        Instant createdAt,
        Instant finishedAt
) {

    public record StepView(String name, StepStatus status) {
    }
}
