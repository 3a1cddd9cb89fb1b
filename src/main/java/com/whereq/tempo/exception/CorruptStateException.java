package com.whereq.tempo.exception;

/**
 * Exception thrown when the persisted queue cannot be parsed or has an incompatible schema
 */
public class CorruptStateException extends StoreException {
    public CorruptStateException(String message) {
        super(message);
    }

    public CorruptStateException(String message, Throwable cause) {
        super(message, cause);
    }
}
