package com.whereq.tempo.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Job lifecycle states
 *
 * State transitions:
 * PENDING → RUNNING → {COMPLETED, FAILED}
 * FAILED → PENDING (retry, while attempt_count < max_attempts)
 * PENDING, RUNNING → CANCELLED
 */
public enum JobState {
    /**
     * Waiting for admission (new or rescheduled for retry)
     */
    PENDING,

    /**
     * Held by exactly one worker
     */
    RUNNING,

    /**
     * Completed successfully, result stored
     */
    COMPLETED,

    /**
     * Last attempt failed; terminal unless re-admitted by a retry
     */
    FAILED,

    /**
     * Cancelled on request
     */
    CANCELLED;

    /**
     * Check if this is a terminal state
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    /**
     * Check if job still needs the scheduler (waiting or executing)
     */
    public boolean isActive() {
        return this == PENDING || this == RUNNING;
    }

    /**
     * States directly reachable from this one. FAILED → PENDING is further
     * bounded by the job's remaining attempts.
     */
    public Set<JobState> successors() {
        return switch (this) {
            case PENDING -> EnumSet.of(RUNNING, CANCELLED);
            case RUNNING -> EnumSet.of(COMPLETED, FAILED, CANCELLED);
            case FAILED -> EnumSet.of(PENDING);
            case COMPLETED, CANCELLED -> EnumSet.noneOf(JobState.class);
        };
    }

    public boolean canTransitionTo(JobState target) {
        return successors().contains(target);
    }
}
