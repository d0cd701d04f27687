package com.coinledger.analysis;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Analysis pipeline settings (coinledger.pipeline.*).
 */
@ConfigurationProperties(prefix = "coinledger.pipeline")
@Getter
@Setter
public class PipelineProperties {

    /** Finished jobs are dropped this long after they end. */
    private long jobTtlHours = 24;
    /** Upper bound of portfolio history points per session. */
    private int maxHistoryPoints = 500;
    /** Progress messages kept per job; oldest are dropped first. */
    private int messageLimit = 50;
    /** Largest accepted trade export, in bytes. */
    private int maxUploadBytes = 20 * 1024 * 1024;
}
