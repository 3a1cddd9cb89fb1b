package com.whereq.tempo.exception;

/**
 * Exception thrown when scheduler settings are invalid; fatal at startup
 */
public class SchedulerConfigurationException extends RuntimeException {
    public SchedulerConfigurationException(String message) {
        super(message);
    }

    public SchedulerConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
