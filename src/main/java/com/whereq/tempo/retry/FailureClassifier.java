package com.whereq.tempo.retry;

import com.whereq.tempo.exception.JobTimeoutException;
import com.whereq.tempo.exception.PermanentRunnerException;
import com.whereq.tempo.model.FailureKind;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Maps an error raised by a job body to a failure kind. Anything not
 * explicitly classified is treated as transient.
 */
public final class FailureClassifier {

    private FailureClassifier() {
    }

    public static FailureKind classify(Throwable error) {
        Throwable cause = unwrap(error);
        if (cause instanceof PermanentRunnerException) {
            return FailureKind.PERMANENT;
        }
        if (cause instanceof JobTimeoutException || cause instanceof TimeoutException) {
            return FailureKind.TIMEOUT;
        }
        if (cause instanceof CancellationException) {
            return FailureKind.CANCELLED;
        }
        // TransientRunnerException and unclassified errors
        return FailureKind.TRANSIENT;
    }

    /**
     * Human readable reason stored as the job's last error
     */
    public static String describe(Throwable error) {
        Throwable cause = unwrap(error);
        String message = cause.getMessage();
        if (message == null || message.isBlank()) {
            return cause.getClass().getSimpleName();
        }
        return cause.getClass().getSimpleName() + ": " + message;
    }

    static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
            && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
