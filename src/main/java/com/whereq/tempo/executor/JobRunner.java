package com.whereq.tempo.executor;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Produces one artifact from an opaque payload. New kinds of jobs are new
 * runner implementations (or payload variants); the scheduler does not change.
 *
 * Implementations must be safe to call concurrently.
 */
@FunctionalInterface
public interface JobRunner {
    /**
     * Execute one attempt synchronously (blocking)
     *
     * @param payload the job payload, never inspected by the scheduler
     * @param context attempt metadata and the cancellation handle
     * @return result stored on the completed job
     * @throws com.whereq.tempo.exception.PermanentRunnerException if retrying cannot help
     * @throws Exception any other failure, treated as transient
     */
    JsonNode run(JsonNode payload, JobContext context) throws Exception;
}
