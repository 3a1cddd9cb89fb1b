package com.whereq.tempo.model;

/**
 * Classification of a failed attempt, drives the retry decision
 */
public enum FailureKind {
    /**
     * Rate limit, network hiccup or any unclassified error inside the job body
     */
    TRANSIENT,

    /**
     * Malformed payload, unsupported input; never retried
     */
    PERMANENT,

    /**
     * Job did not report before its deadline
     */
    TIMEOUT,

    /**
     * Job stopped after a cancellation request
     */
    CANCELLED,

    /**
     * Job was running when the previous scheduler process stopped
     */
    INTERRUPTED
}
