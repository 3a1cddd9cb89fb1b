package com.whereq.tempo.exception;

/**
 * Failure inside a job body that may succeed on a later attempt
 * (rate limit, network hiccup, busy dependency)
 */
public class TransientRunnerException extends Exception {
    public TransientRunnerException(String message) {
        super(message);
    }

    public TransientRunnerException(String message, Throwable cause) {
        super(message, cause);
    }
}
