package com.whereq.tempo.scheduler;

import com.whereq.tempo.model.Job;
import com.whereq.tempo.retry.RetryDecision;

import java.time.Duration;

/**
 * Callbacks on job lifecycle events. Invoked on the scheduler's control
 * path after the state change is persisted, so implementations must return
 * quickly; exceptions are logged and otherwise ignored.
 */
public interface JobEventListener {

    /**
     * A job moved from PENDING to RUNNING
     */
    default void onJobStarted(Job job) {
    }

    /**
     * A failed job was sent back to PENDING
     */
    default void onJobRetryScheduled(Job job, RetryDecision decision) {
    }

    /**
     * A job reached a terminal state
     *
     * @param executionTime duration of the last attempt, null if the job never ran
     */
    default void onJobFinished(Job job, Duration executionTime) {
    }
}
