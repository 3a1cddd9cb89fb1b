package com.whereq.tempo.config;

import com.whereq.tempo.exception.SchedulerConfigurationException;
import com.whereq.tempo.model.JobState;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.unit.DataSize;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for WhereQ Tempo.
 *
 * @author WhereQ Inc.
 */
@Configuration
@ConfigurationProperties(prefix = "tempo")
@Data
public class TempoProperties {

    private SchedulerConfig scheduler = new SchedulerConfig();

    private ResourcesConfig resources = new ResourcesConfig();

    private RetryConfig retry = new RetryConfig();

    private StoreConfig store = new StoreConfig();

    private FailureLogConfig failureLog = new FailureLogConfig();

    private NotificationsConfig notifications = new NotificationsConfig();

    private RunnerConfig runner = new RunnerConfig();

    @Data
    public static class SchedulerConfig {
        /**
         * Default attempt ceiling for jobs enqueued without one.
         */
        private int maxAttempts = 3;

        /**
         * Deadline for a single execution attempt.
         */
        private Duration jobTimeout = Duration.ofHours(1);

        /**
         * Longest idle wait before the budget is sampled again.
         */
        private Duration budgetRecheckInterval = Duration.ofSeconds(1);

        /**
         * Start the control loop with the application context.
         */
        private boolean autoStart = true;

        /**
         * How long shutdown waits for running jobs to acknowledge the stop signal.
         */
        private Duration shutdownGrace = Duration.ofSeconds(30);
    }

    @Data
    public static class ResourcesConfig {
        /**
         * Memory one job is expected to need, in MB.
         */
        private long perJobMemoryMb = 2048;

        /**
         * Absolute ceiling on concurrent jobs.
         */
        private int hardWorkerCap = 8;

        /**
         * Scale factor applied to the CPU core count.
         */
        private double cpuOversubscription = 1.0;

        /**
         * auto, none, nvidia-cuda or amd-rocm.
         */
        private String accelerator = "auto";

        /**
         * Timeout of the accelerator discovery commands.
         */
        private Duration acceleratorProbeTimeout = Duration.ofSeconds(5);

        private MonitorConfig monitor = new MonitorConfig();
    }

    @Data
    public static class MonitorConfig {
        /**
         * Warn when free host memory falls below this value, in MB.
         */
        private long memoryAlertThresholdMb = 1024;

        /**
         * Period of the alerting pass.
         */
        private Duration pollInterval = Duration.ofSeconds(5);
    }

    @Data
    public static class RetryConfig {
        /**
         * Automatic retry of transient failures.
         */
        private boolean enabled = true;

        private Duration baseBackoff = Duration.ofSeconds(1);

        private double backoffMultiplier = 2.0;

        private Duration maxBackoff = Duration.ofSeconds(60);

        /**
         * Backoff is varied by up to this fraction in both directions.
         */
        private double jitterRatio = 0.2;

        /**
         * Timeouts count as transient unless disabled here or per job.
         */
        private boolean timeoutRetryable = true;

        private BackoffBasis backoffBasis = BackoffBasis.FAILURE_TIME;
    }

    @Data
    public static class StoreConfig {
        /**
         * Queue file location.
         */
        private String path = "data/tempo-queue.json";

        private CorruptStatePolicy onCorrupt = CorruptStatePolicy.FAIL;
    }

    @Data
    public static class FailureLogConfig {
        private boolean enabled = true;

        private String directory = "output/logs";
    }

    @Data
    public static class NotificationsConfig {
        /**
         * Webhook URL; notifications are off when unset.
         */
        private String webhook;

        private List<JobState> events = new ArrayList<>(List.of(JobState.FAILED));

        private Duration timeout = Duration.ofSeconds(10);

        /**
         * Largest webhook response body buffered before it is discarded.
         */
        private DataSize maxResponseSize = DataSize.ofMegabytes(1);

        public boolean shouldNotify(JobState state) {
            return webhook != null && !webhook.isEmpty() && events != null && events.contains(state);
        }
    }

    @Data
    public static class RunnerConfig {
        /**
         * Command of the default process runner; payload JSON on stdin, result JSON on stdout.
         */
        private List<String> command = new ArrayList<>();

        /**
         * Working directory of the runner process.
         */
        private String workingDirectory;

        /**
         * Exit codes that mark a permanent failure.
         */
        private List<Integer> permanentExitCodes = new ArrayList<>(List.of(2));
    }

    public enum BackoffBasis {
        /**
         * Backoff counts from the moment the attempt failed.
         */
        FAILURE_TIME,

        /**
         * Backoff counts from the moment the scheduler processed the failure.
         */
        ELIGIBILITY_CHECK
    }

    public enum CorruptStatePolicy {
        /**
         * Abort startup.
         */
        FAIL,

        /**
         * Move the unreadable file aside and start with an empty queue.
         */
        START_EMPTY
    }

    /**
     * Reject settings the scheduler cannot run with.
     *
     * @throws SchedulerConfigurationException on the first invalid value
     */
    public void validate() {
        require(scheduler.getMaxAttempts() >= 1, "tempo.scheduler.max-attempts must be >= 1");
        require(isPositive(scheduler.getJobTimeout()), "tempo.scheduler.job-timeout must be positive");
        require(isPositive(scheduler.getBudgetRecheckInterval()),
            "tempo.scheduler.budget-recheck-interval must be positive");
        require(scheduler.getShutdownGrace() != null && !scheduler.getShutdownGrace().isNegative(),
            "tempo.scheduler.shutdown-grace must not be negative");
        require(resources.getPerJobMemoryMb() > 0, "tempo.resources.per-job-memory-mb must be > 0");
        require(resources.getHardWorkerCap() >= 1, "tempo.resources.hard-worker-cap must be >= 1");
        require(resources.getCpuOversubscription() > 0, "tempo.resources.cpu-oversubscription must be > 0");
        require(isPositive(retry.getBaseBackoff()) || Duration.ZERO.equals(retry.getBaseBackoff()),
            "tempo.retry.base-backoff must not be negative");
        require(retry.getBackoffMultiplier() >= 1.0, "tempo.retry.backoff-multiplier must be >= 1");
        require(retry.getMaxBackoff() != null && !retry.getMaxBackoff().isNegative(),
            "tempo.retry.max-backoff must not be negative");
        require(retry.getJitterRatio() >= 0 && retry.getJitterRatio() < 1,
            "tempo.retry.jitter-ratio must be in [0, 1)");
        require(store.getPath() != null && !store.getPath().isBlank(), "tempo.store.path must be set");
        require(isPositive(notifications.getTimeout()), "tempo.notifications.timeout must be positive");
        require(notifications.getMaxResponseSize() != null && notifications.getMaxResponseSize().toBytes() > 0
                && notifications.getMaxResponseSize().toBytes() <= Integer.MAX_VALUE,
            "tempo.notifications.max-response-size must be between 1 byte and 2 GB");
    }

    private static boolean isPositive(Duration duration) {
        return duration != null && !duration.isNegative() && !duration.isZero();
    }

    private static void require(boolean condition, String message) {
        if (!condition) {
            throw new SchedulerConfigurationException(message);
        }
    }
}
