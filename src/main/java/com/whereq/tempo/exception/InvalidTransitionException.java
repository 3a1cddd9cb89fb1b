package com.whereq.tempo.exception;

import com.whereq.tempo.model.JobState;
import lombok.Getter;

/**
 * Exception thrown when a state change is not legal from the job's current state
 */
@Getter
public class InvalidTransitionException extends StoreException {
    private final String jobId;
    private final JobState from;
    private final JobState to;

    public InvalidTransitionException(String jobId, JobState from, JobState to) {
        this(jobId, from, to, "Illegal transition for job " + jobId + ": " + from + " → " + to);
    }

    public InvalidTransitionException(String jobId, JobState from, JobState to, String message) {
        super(message);
        this.jobId = jobId;
        this.from = from;
        this.to = to;
    }
}
