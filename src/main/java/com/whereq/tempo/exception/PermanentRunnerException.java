package com.whereq.tempo.exception;

/**
 * Failure inside a job body that no retry can fix (malformed payload,
 * unsupported input). Never retried.
 */
public class PermanentRunnerException extends Exception {
    public PermanentRunnerException(String message) {
        super(message);
    }

    public PermanentRunnerException(String message, Throwable cause) {
        super(message, cause);
    }
}
