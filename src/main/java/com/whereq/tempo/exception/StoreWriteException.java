package com.whereq.tempo.exception;

/**
 * Exception thrown when the queue file cannot be written
 */
public class StoreWriteException extends StoreException {
    public StoreWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
