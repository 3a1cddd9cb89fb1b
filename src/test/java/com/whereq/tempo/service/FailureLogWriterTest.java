package com.whereq.tempo.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.whereq.tempo.config.TempoProperties;
import com.whereq.tempo.model.FailureKind;
import com.whereq.tempo.model.FailureRecord;
import com.whereq.tempo.model.Job;
import com.whereq.tempo.model.JobState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

class FailureLogWriterTest {

    @TempDir
    Path dir;

    private final ObjectMapper objectMapper = new ObjectMapper();

    private TempoProperties properties;
    private FailureLogWriter writer;
    private Clock clock;

    @BeforeEach
    void setUp() {
        properties = new TempoProperties();
        properties.getFailureLog().setDirectory(dir.resolve("logs").toString());
        Instant now = LocalDateTime.of(2024, 3, 9, 14, 5, 7).atZone(ZoneId.systemDefault()).toInstant();
        clock = Clock.fixed(now, ZoneId.systemDefault());
        writer = new FailureLogWriter(properties, objectMapper, clock, Schedulers.immediate());
    }

    @Test
    void testFailedJobGetsLogFile() throws IOException {
        Optional<Path> file = writer.write(failedJob("render/42"));

        assertThat(file).isPresent();
        assertThat(file.get().getFileName().toString()).isEqualTo("error_render_42_20240309_140507.log");
        String content = Files.readString(file.get(), StandardCharsets.UTF_8);
        assertThat(content)
            .contains("Job: render/42")
            .contains("Attempts: 3/3")
            .contains("out of memory")
            .contains("\"input\" : \"a.mov\"")
            .contains("#1")
            .contains("TRANSIENT");
    }

    @Test
    void testOnlyFailedJobsAreLogged() throws IOException {
        Job completed = failedJob("done");
        completed.setState(JobState.COMPLETED);

        writer.onJobFinished(completed, Duration.ofSeconds(1));
        writer.onJobFinished(failedJob("broken"), Duration.ofSeconds(1));

        try (Stream<Path> files = Files.list(dir.resolve("logs"))) {
            assertThat(files.map(p -> p.getFileName().toString()))
                .containsExactly("error_broken_20240309_140507.log");
        }
    }

    @Test
    void testFileIsWrittenOffTheReportingThread() throws Exception {
        Scheduler io = Schedulers.newSingle("failure-log-test");
        try {
            FailureLogWriter asyncWriter = new FailureLogWriter(properties, objectMapper, clock, io);
            CountDownLatch ioBusy = new CountDownLatch(1);
            io.schedule(() -> {
                try {
                    ioBusy.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });

            asyncWriter.onJobFinished(failedJob("slow-disk"), Duration.ofSeconds(1));

            Path expected = dir.resolve("logs").resolve("error_slow-disk_20240309_140507.log");
            assertThat(Files.exists(expected)).isFalse();

            ioBusy.countDown();
            // the single worker runs tasks in order, so the write is done once this returns
            Mono.fromRunnable(() -> { }).subscribeOn(io).block(Duration.ofSeconds(10));
            assertThat(Files.exists(expected)).isTrue();
        } finally {
            io.dispose();
        }
    }

    @Test
    void testWriteAsync() {
        StepVerifier.create(writer.writeAsync(failedJob("render-7")))
            .assertNext(file -> assertThat(file).hasValueSatisfying(path ->
                assertThat(path.getFileName().toString()).isEqualTo("error_render-7_20240309_140507.log")))
            .verifyComplete();
    }

    @Test
    void testDisabledWriterDoesNothing() {
        properties.getFailureLog().setEnabled(false);

        writer.onJobFinished(failedJob("broken"), null);

        assertThat(Files.exists(dir.resolve("logs"))).isFalse();
    }

    private Job failedJob(String id) {
        List<FailureRecord> failures = new ArrayList<>();
        for (int attempt = 1; attempt <= 3; attempt++) {
            failures.add(FailureRecord.builder()
                .attempt(attempt)
                .kind(FailureKind.TRANSIENT)
                .message("out of memory")
                .failedAt(Instant.parse("2024-03-09T13:00:00Z"))
                .build());
        }
        return Job.builder()
            .id(id)
            .state(JobState.FAILED)
            .payload(objectMapper.createObjectNode().put("input", "a.mov"))
            .attemptCount(3)
            .maxAttempts(3)
            .lastError("out of memory")
            .lastFailureKind(FailureKind.TRANSIENT)
            .createdAt(Instant.parse("2024-03-09T12:00:00Z"))
            .failures(failures)
            .build();
    }
}
