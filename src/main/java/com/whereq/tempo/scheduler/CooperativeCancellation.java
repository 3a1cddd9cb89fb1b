package com.whereq.tempo.scheduler;

import com.whereq.tempo.executor.CancellationHandle;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Cancellation handle of one execution attempt.
 *
 * Cancelling runs the registered callbacks and interrupts the worker thread
 * bound to the attempt. Binding and interruption share the monitor, so a
 * worker that already unbound never receives a stray interrupt.
 */
@Slf4j
public class CooperativeCancellation implements CancellationHandle {

    private volatile boolean cancelled;
    private volatile String reason;

    // guarded by this
    private final List<Runnable> callbacks = new ArrayList<>();
    private Thread boundThread;

    @Override
    public boolean isCancelled() {
        return cancelled;
    }

    @Override
    public String reason() {
        return reason;
    }

    @Override
    public void onCancel(Runnable callback) {
        synchronized (this) {
            if (!cancelled) {
                callbacks.add(callback);
                return;
            }
        }
        runCallback(callback);
    }

    /**
     * Signal the attempt to stop. Only the first call has an effect.
     *
     * @return true if this call cancelled the handle
     */
    public boolean cancel(String reason) {
        List<Runnable> pending;
        synchronized (this) {
            if (cancelled) {
                return false;
            }
            this.reason = reason;
            this.cancelled = true;
            pending = new ArrayList<>(callbacks);
            callbacks.clear();
            if (boundThread != null) {
                boundThread.interrupt();
            }
        }
        pending.forEach(CooperativeCancellation::runCallback);
        return true;
    }

    synchronized void bind(Thread thread) {
        boundThread = thread;
        if (cancelled) {
            thread.interrupt();
        }
    }

    synchronized void unbind() {
        boundThread = null;
    }

    private static void runCallback(Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            log.warn("Cancellation callback failed: {}", e.getMessage(), e);
        }
    }
}
