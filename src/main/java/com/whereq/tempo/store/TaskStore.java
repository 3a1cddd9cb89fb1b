package com.whereq.tempo.store;

import com.whereq.tempo.exception.JobNotFoundException;
import com.whereq.tempo.model.Job;
import com.whereq.tempo.model.JobState;
import com.whereq.tempo.model.QueueSnapshot;
import com.whereq.tempo.model.QueueStatistics;

import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Durable record of all jobs. The single source of truth for job state: every
 * mutating call is persisted before it returns.
 */
public interface TaskStore {
    /**
     * Reconstruct the queue from durable storage, replacing the in-memory view
     *
     * @return copy of the loaded snapshot (empty when nothing was persisted yet)
     * @throws com.whereq.tempo.exception.CorruptStateException if the persisted data cannot be used
     */
    QueueSnapshot load();

    /**
     * Atomically persist a full snapshot
     *
     * @param snapshot the snapshot to persist
     * @throws com.whereq.tempo.exception.InvalidTransitionException if it would drop a job or regress a state
     */
    void save(QueueSnapshot snapshot);

    /**
     * Add a new job in PENDING state
     *
     * @param job the job to add
     * @return stored copy
     * @throws com.whereq.tempo.exception.DuplicateIdException if the id already exists
     */
    Job append(Job job);

    /**
     * Apply a state transition together with field changes
     *
     * @param jobId job identifier
     * @param target state after the transition
     * @param mutation field changes applied to a copy before it is stored
     * @return stored copy
     * @throws com.whereq.tempo.exception.JobNotFoundException if the id is unknown
     * @throws com.whereq.tempo.exception.InvalidTransitionException if the transition is not legal
     */
    Job update(String jobId, JobState target, Consumer<Job> mutation);

    /**
     * Change fields of a job without changing its state
     *
     * @param jobId job identifier
     * @param mutation field changes; must not change the state
     * @return stored copy
     */
    Job amend(String jobId, Consumer<Job> mutation);

    Optional<Job> find(String jobId);

    /**
     * @throws JobNotFoundException if the id is unknown
     */
    default Job get(String jobId) {
        return find(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
    }

    /**
     * All jobs in insertion order
     */
    List<Job> list();

    List<Job> listByState(JobState state);

    QueueStatistics statistics();

    /**
     * Set the unreadable persisted data aside and continue with an empty queue
     */
    void quarantineAndReset();
}
