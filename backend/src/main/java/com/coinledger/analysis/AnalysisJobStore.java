package com.coinledger.analysis;

import com.coinledger.config.SchedulerConfig;
import com.coinledger.domain.AnalysisJob;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of analysis jobs. Finished jobs expire {@code jobTtlHours} after they end; an hourly task
 * removes them and lookups never return an expired job.
 */
@Component
@Slf4j
public class AnalysisJobStore {

    private final Map<String, AnalysisJob> jobs = new ConcurrentHashMap<>();
    private final PipelineProperties properties;
    private final Clock clock;

    @Autowired
    public AnalysisJobStore(PipelineProperties properties) {
        this(properties, Clock.systemUTC());
    }

    AnalysisJobStore(PipelineProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    public AnalysisJob create() {
        AnalysisJob job = new AnalysisJob(UUID.randomUUID().toString(), properties.getMessageLimit(), clock);
        jobs.put(job.getId(), job);
        return job;
    }

    /**
     * @throws JobNotFoundException when the id is unknown or the job has expired
     */
    public AnalysisJob get(String jobId) {
        AnalysisJob job = jobId == null ? null : jobs.get(jobId);
        if (job == null) {
            throw new JobNotFoundException(jobId);
        }
        if (job.isExpired(cutoff())) {
            jobs.remove(jobId, job);
            throw new JobNotFoundException(jobId);
        }
        return job;
    }

    @Scheduled(fixedRate = 3_600_000, scheduler = SchedulerConfig.SCHEDULER_POOL)
    public int deleteExpiredJobs() {
        Instant cutoff = cutoff();
        int before = jobs.size();
        jobs.values().removeIf(job -> job.isExpired(cutoff));
        int removed = before - jobs.size();
        if (removed > 0) {
            log.info("Removed {} expired analysis job(s)", removed);
        }
        return removed;
    }

    int size() {
        return jobs.size();
    }

    private Instant cutoff() {
        return clock.instant().minus(Duration.ofHours(properties.getJobTtlHours()));
    }
}
