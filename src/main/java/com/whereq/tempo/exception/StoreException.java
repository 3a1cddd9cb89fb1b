package com.whereq.tempo.exception;

/**
 * Base class for task store failures. Fatal to the operation that raised it.
 */
public abstract class StoreException extends RuntimeException {
    protected StoreException(String message) {
        super(message);
    }

    protected StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
