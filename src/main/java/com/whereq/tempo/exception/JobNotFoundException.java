package com.whereq.tempo.exception;

import lombok.Getter;

/**
 * Exception thrown when a job id is unknown to the store
 */
@Getter
public class JobNotFoundException extends StoreException {
    private final String jobId;

    public JobNotFoundException(String jobId) {
        super("Job not found: " + jobId);
        this.jobId = jobId;
    }
}
