package com.whereq.tempo.executor;

import java.util.concurrent.CancellationException;

/**
 * Cooperative cancellation signal handed to a job body. The scheduler never
 * kills a job; a body is expected to poll this handle (or react to thread
 * interruption) and stop. A body that ignores it is only bounded by its
 * timeout.
 */
public interface CancellationHandle {

    boolean isCancelled();

    /**
     * Why the job was asked to stop, null while not cancelled
     */
    String reason();

    /**
     * Register a callback run once on cancellation, immediately if already cancelled
     */
    void onCancel(Runnable callback);

    default void throwIfCancelled() {
        if (isCancelled()) {
            throw new CancellationException(reason());
        }
    }
}
