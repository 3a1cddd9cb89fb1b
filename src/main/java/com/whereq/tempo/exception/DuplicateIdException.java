package com.whereq.tempo.exception;

import lombok.Getter;

/**
 * Exception thrown when a job id is appended twice
 */
@Getter
public class DuplicateIdException extends StoreException {
    private final String jobId;

    public DuplicateIdException(String jobId) {
        super("Job already exists: " + jobId);
        this.jobId = jobId;
    }
}
