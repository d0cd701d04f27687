package com.coinledger.domain;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Progress of one analysis request. Steps run strictly in {@link AnalysisStep} order; all mutators are
 * synchronized so pollers always observe a consistent state through {@link #snapshot()}.
 */
public class AnalysisJob {

    public static final int DEFAULT_MESSAGE_LIMIT = 50;

    private final String id;
    private final Instant createdAt;
    private final int messageLimit;
    private final Clock clock;
    private final Map<AnalysisStep, StepStatus> steps = new EnumMap<>(AnalysisStep.class);
    private final Deque<String> messages = new ArrayDeque<>();
    private final List<String> warnings = new ArrayList<>();
    private JobStatus status = JobStatus.PENDING;
    private String sessionId;
    private String error;
    private Instant finishedAt;

    public AnalysisJob(String id, int messageLimit, Clock clock) {
        this.id = id;
        this.messageLimit = Math.max(1, messageLimit);
        this.clock = clock;
        this.createdAt = clock.instant();
        for (AnalysisStep step : AnalysisStep.values()) {
            steps.put(step, StepStatus.PENDING);
        }
    }

    public AnalysisJob(String id) {
        this(id, DEFAULT_MESSAGE_LIMIT, Clock.systemUTC());
    }

    public String getId() {
        return id;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public synchronized JobStatus getStatus() {
        return status;
    }

    public synchronized Instant getFinishedAt() {
        return finishedAt;
    }

    public synchronized StepStatus stepStatus(AnalysisStep step) {
        return steps.get(step);
    }

    /**
     * Moves {@code step} to RUNNING. Every earlier step must already be COMPLETED.
     */
    public synchronized void startStep(AnalysisStep step) {
        if (status.isTerminal()) {
            throw new IllegalStateException("Job " + id + " already finished with " + status);
        }
        for (AnalysisStep earlier : AnalysisStep.values()) {
            if (earlier == step) {
                break;
            }
            if (steps.get(earlier) != StepStatus.COMPLETED) {
                throw new IllegalStateException("Step " + step.key() + " cannot start before " + earlier.key() + " completes");
            }
        }
        steps.put(step, StepStatus.RUNNING);
        status = JobStatus.RUNNING;
        appendMessage("Step " + step.key() + " started");
    }

    public synchronized void completeStep(AnalysisStep step) {
        if (steps.get(step) != StepStatus.RUNNING) {
            throw new IllegalStateException("Step " + step.key() + " is not running");
        }
        steps.put(step, StepStatus.COMPLETED);
        appendMessage("Step " + step.key() + " completed");
    }

    /**
     * Marks the running step ERROR (if any) and finishes the job with {@code message}.
     */
    public synchronized void fail(String message) {
        steps.replaceAll((s, st) -> st == StepStatus.RUNNING ? StepStatus.ERROR : st);
        status = JobStatus.ERROR;
        error = message;
        sessionId = null;
        finishedAt = clock.instant();
        appendMessage("Failed: " + message);
    }

    public synchronized void complete(String sessionId) {
        for (Map.Entry<AnalysisStep, StepStatus> e : steps.entrySet()) {
            if (e.getValue() != StepStatus.COMPLETED) {
                throw new IllegalStateException("Step " + e.getKey().key() + " is " + e.getValue());
            }
        }
        this.status = JobStatus.COMPLETED;
        this.sessionId = sessionId;
        this.finishedAt = clock.instant();
        appendMessage("Analysis completed, session " + sessionId);
    }

    public synchronized void addMessage(String message) {
        appendMessage(message);
    }

    public synchronized void addWarning(String warning) {
        warnings.add(warning);
        appendMessage("Warning: " + warning);
    }

    public synchronized boolean isExpired(Instant cutoff) {
        return finishedAt != null && finishedAt.isBefore(cutoff);
    }

    public synchronized AnalysisJobView snapshot() {
        List<AnalysisJobView.StepView> stepViews = steps.entrySet().stream()
                .map(e -> new AnalysisJobView.StepView(e.getKey().key(), e.getValue()))
                .toList();
        return new AnalysisJobView(id, status, stepViews, List.copyOf(messages), List.copyOf(warnings),
                sessionId, error, createdAt, finishedAt);
    }

    private void appendMessage(String message) {
        messages.addLast(message);
        while (messages.size() > messageLimit) {
            messages.removeFirst();
        }
    }
}
