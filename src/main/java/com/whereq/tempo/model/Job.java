package com.whereq.tempo.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * The unit of schedulable work. The payload is opaque to the scheduler and is
 * handed to the job runner untouched.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Job {
    /**
     * Unique job identifier, immutable after enqueue
     */
    private String id;

    /**
     * Opaque input for the job runner
     */
    private JsonNode payload;

    @Builder.Default
    private JobState state = JobState.PENDING;

    /**
     * Execution attempts started so far
     */
    private int attemptCount;

    /**
     * Ceiling for attemptCount
     */
    private int maxAttempts;

    /**
     * Last captured failure reason, cleared on success
     */
    private String lastError;

    private FailureKind lastFailureKind;

    /**
     * Per-job override of the timeout retry classification (null = global default)
     */
    private Boolean retryOnTimeout;

    /**
     * Set when a cancellation was requested while the job was running
     */
    private boolean cancelRequested;

    /**
     * Enqueue time; kept across retries for FIFO fairness
     */
    private Instant createdAt;

    private Instant startedAt;

    private Instant finishedAt;

    /**
     * Earliest admission time after a retry backoff
     */
    private Instant eligibleAt;

    /**
     * Opaque success payload, set only when COMPLETED
     */
    private JsonNode result;

    @Builder.Default
    private List<FailureRecord> failures = new ArrayList<>();

    public boolean hasAttemptsRemaining() {
        return attemptCount < maxAttempts;
    }

    public boolean isEligibleAt(Instant now) {
        return state == JobState.PENDING && (eligibleAt == null || !eligibleAt.isAfter(now));
    }

    /**
     * Deep copy, so callers never share mutable state with the store
     */
    public Job copy() {
        List<FailureRecord> history = new ArrayList<>();
        if (failures != null) {
            failures.forEach(f -> history.add(new FailureRecord(f.getAttempt(), f.getKind(), f.getMessage(), f.getFailedAt())));
        }
        return Job.builder()
            .id(id)
            .payload(payload != null ? payload.deepCopy() : null)
            .state(state)
            .attemptCount(attemptCount)
            .maxAttempts(maxAttempts)
            .lastError(lastError)
            .lastFailureKind(lastFailureKind)
            .retryOnTimeout(retryOnTimeout)
            .cancelRequested(cancelRequested)
            .createdAt(createdAt)
            .startedAt(startedAt)
            .finishedAt(finishedAt)
            .eligibleAt(eligibleAt)
            .result(result != null ? result.deepCopy() : null)
            .failures(history)
            .build();
    }
}
