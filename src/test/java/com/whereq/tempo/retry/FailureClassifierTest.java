package com.whereq.tempo.retry;

import com.whereq.tempo.exception.JobTimeoutException;
import com.whereq.tempo.exception.PermanentRunnerException;
import com.whereq.tempo.exception.TransientRunnerException;
import com.whereq.tempo.model.FailureKind;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;

class FailureClassifierTest {

    @Test
    void testExplicitKinds() {
        assertThat(FailureClassifier.classify(new PermanentRunnerException("unsupported codec")))
            .isEqualTo(FailureKind.PERMANENT);
        assertThat(FailureClassifier.classify(new TransientRunnerException("503")))
            .isEqualTo(FailureKind.TRANSIENT);
        assertThat(FailureClassifier.classify(new JobTimeoutException("deadline")))
            .isEqualTo(FailureKind.TIMEOUT);
        assertThat(FailureClassifier.classify(new TimeoutException()))
            .isEqualTo(FailureKind.TIMEOUT);
        assertThat(FailureClassifier.classify(new CancellationException("stop")))
            .isEqualTo(FailureKind.CANCELLED);
    }

    @Test
    void testUnclassifiedErrorsAreTransient() {
        assertThat(FailureClassifier.classify(new IOException("connection reset"))).isEqualTo(FailureKind.TRANSIENT);
        assertThat(FailureClassifier.classify(new IllegalStateException())).isEqualTo(FailureKind.TRANSIENT);
    }

    @Test
    void testWrappersAreUnwrapped() {
        Throwable wrapped = new CompletionException(new ExecutionException(new PermanentRunnerException("bad input")));

        assertThat(FailureClassifier.classify(wrapped)).isEqualTo(FailureKind.PERMANENT);
        assertThat(FailureClassifier.describe(wrapped)).isEqualTo("PermanentRunnerException: bad input");
    }

    @Test
    void testDescribeWithoutMessage() {
        assertThat(FailureClassifier.describe(new NullPointerException())).isEqualTo("NullPointerException");
    }
}
