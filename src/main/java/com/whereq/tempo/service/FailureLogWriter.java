package com.whereq.tempo.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.whereq.tempo.config.TempoProperties;
import com.whereq.tempo.model.FailureRecord;
import com.whereq.tempo.model.Job;
import com.whereq.tempo.model.JobState;
import com.whereq.tempo.scheduler.JobEventListener;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Optional;

/**
 * Writes one log file per job that ends FAILED, named
 * error_&lt;job id&gt;_&lt;yyyyMMdd_HHmmss&gt;.log, so operators can inspect a
 * failed batch without digging through the service log. Files are written
 * on the I/O scheduler, never on the thread reporting the job.
 */
@Slf4j
@Service
public class FailureLogWriter implements JobEventListener {

    private static final DateTimeFormatter FILE_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final TempoProperties.FailureLogConfig config;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Scheduler ioScheduler;

    @Autowired
    public FailureLogWriter(TempoProperties properties, ObjectMapper objectMapper) {
        this(properties, objectMapper, Clock.systemDefaultZone(), Schedulers.boundedElastic());
    }

    public FailureLogWriter(TempoProperties properties, ObjectMapper objectMapper, Clock clock,
                            Scheduler ioScheduler) {
        this.config = properties.getFailureLog();
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.ioScheduler = ioScheduler;
    }

    @Override
    public void onJobFinished(Job job, Duration executionTime) {
        if (!config.isEnabled() || job.getState() != JobState.FAILED) {
            return;
        }
        writeAsync(job).subscribe();
    }

    /**
     * Write the failure log of a job on the I/O scheduler
     */
    public Mono<Optional<Path>> writeAsync(Job job) {
        return Mono.fromCallable(() -> write(job))
            .subscribeOn(ioScheduler);
    }

    /**
     * Write the failure log of a job
     *
     * @return the written file, empty if writing failed
     */
    public Optional<Path> write(Job job) {
        String timestamp = FILE_TIMESTAMP.format(clock.instant().atZone(ZoneId.systemDefault()));
        Path file = Paths.get(config.getDirectory()).resolve("error_" + safeName(job.getId()) + "_" + timestamp + ".log");
        try {
            Files.createDirectories(file.getParent());
            Files.writeString(file, render(job), StandardCharsets.UTF_8);
            log.info("Wrote failure log for job {} to {}", job.getId(), file);
            return Optional.of(file);
        } catch (IOException e) {
            log.error("Failed to write failure log for job {}: {}", job.getId(), e.getMessage());
            return Optional.empty();
        }
    }

    private String render(Job job) {
        StringBuilder out = new StringBuilder();
        out.append("Job: ").append(job.getId()).append('\n');
        out.append("State: ").append(job.getState()).append('\n');
        out.append("Attempts: ").append(job.getAttemptCount()).append('/').append(job.getMaxAttempts()).append('\n');
        out.append("Created: ").append(job.getCreatedAt()).append('\n');
        out.append("Finished: ").append(job.getFinishedAt()).append('\n');
        out.append("Last error (").append(job.getLastFailureKind()).append("): ").append(job.getLastError()).append('\n');
        out.append('\n').append("Payload:").append('\n');
        try {
            out.append(objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(job.getPayload())).append('\n');
        } catch (JsonProcessingException e) {
            out.append(job.getPayload()).append('\n');
        }
        if (job.getFailures() != null && !job.getFailures().isEmpty()) {
            out.append('\n').append("Failure history:").append('\n');
            for (FailureRecord failure : job.getFailures()) {
                out.append("  #").append(failure.getAttempt())
                    .append(' ').append(failure.getFailedAt())
                    .append(' ').append(failure.getKind())
                    .append(": ").append(failure.getMessage()).append('\n');
            }
        }
        return out.toString();
    }

    private static String safeName(String jobId) {
        return jobId.replaceAll("[^A-Za-z0-9._-]", "_");
    }
}
