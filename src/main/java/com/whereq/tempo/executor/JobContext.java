package com.whereq.tempo.executor;

import com.whereq.tempo.model.AcceleratorClass;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Execution context of one attempt, passed to the job runner with the payload
 */
@Value
@Builder
public class JobContext {
    String jobId;

    /**
     * Attempt number, starting at 1
     */
    int attempt;

    /**
     * Lets GPU-capable job variants decide whether they may use the accelerator
     */
    AcceleratorClass acceleratorClass;

    Instant deadline;

    CancellationHandle cancellation;
}
