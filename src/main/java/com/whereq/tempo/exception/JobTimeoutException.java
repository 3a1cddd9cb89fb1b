package com.whereq.tempo.exception;

/**
 * Job body missed its deadline. Transient unless configured otherwise.
 */
public class JobTimeoutException extends TransientRunnerException {
    public JobTimeoutException(String message) {
        super(message);
    }
}
