package com.coinledger.analysis;

import lombok.Getter;

/**
 * Unknown or expired job id. API layer maps to 404 JOB_NOT_FOUND.
 */
@Getter
public class JobNotFoundException extends RuntimeException {

    public static final String ERROR_CODE = "JOB_NOT_FOUND";

    private final String jobId;

    public JobNotFoundException(String jobId) {
        super("Job not found: " + jobId);
        this.jobId = jobId;
    }
}
