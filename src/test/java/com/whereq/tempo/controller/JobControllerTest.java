package com.whereq.tempo.controller;

import com.whereq.tempo.dto.CancellationResponse;
import com.whereq.tempo.dto.EnqueueRequest;
import com.whereq.tempo.dto.EnqueueResponse;
import com.whereq.tempo.dto.JobView;
import com.whereq.tempo.exception.DuplicateIdException;
import com.whereq.tempo.exception.InvalidTransitionException;
import com.whereq.tempo.exception.JobNotFoundException;
import com.whereq.tempo.model.JobState;
import com.whereq.tempo.model.QueueStatistics;
import com.whereq.tempo.service.JobSubmissionService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

class JobControllerTest {

    @Mock
    private JobSubmissionService jobSubmissionService;

    private WebTestClient client;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        client = WebTestClient.bindToController(new JobController(jobSubmissionService)).build();
    }

    @Test
    void testSubmitReturnsAccepted() {
        when(jobSubmissionService.submitJob(any(EnqueueRequest.class))).thenReturn(Mono.just(EnqueueResponse.builder()
            .jobId("job-1")
            .state(JobState.PENDING)
            .enqueuedAt(Instant.now())
            .build()));

        client.post().uri("/api/v1/jobs")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue("{\"payload\": {\"script\": \"render.py\"}, \"maxAttempts\": 2}")
            .exchange()
            .expectStatus().isAccepted()
            .expectHeader().location("/api/v1/jobs/job-1")
            .expectBody()
            .jsonPath("$.jobId").isEqualTo("job-1")
            .jsonPath("$.state").isEqualTo("PENDING");
    }

    @Test
    void testSubmitValidationErrorIsBadRequest() {
        when(jobSubmissionService.submitJob(any(EnqueueRequest.class)))
            .thenReturn(Mono.error(new IllegalArgumentException("Payload is required")));

        client.post().uri("/api/v1/jobs")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue("{\"payload\": {}}")
            .exchange()
            .expectStatus().isBadRequest()
            .expectBody()
            .jsonPath("$.errorMessage").isEqualTo("Payload is required");
    }

    @Test
    void testSubmitDuplicateIsConflict() {
        when(jobSubmissionService.submitJob(any(EnqueueRequest.class)))
            .thenReturn(Mono.error(new DuplicateIdException("job-1")));

        client.post().uri("/api/v1/jobs")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue("{\"jobId\": \"job-1\", \"payload\": {}}")
            .exchange()
            .expectStatus().isEqualTo(409);
    }

    @Test
    void testStatus() {
        when(jobSubmissionService.getStatus("job-1")).thenReturn(Mono.just(JobView.builder()
            .jobId("job-1")
            .state(JobState.FAILED)
            .terminal(true)
            .attemptCount(3)
            .maxAttempts(3)
            .lastError("TransientRunnerException: upstream down")
            .build()));

        client.get().uri("/api/v1/jobs/job-1")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.state").isEqualTo("FAILED")
            .jsonPath("$.attemptCount").isEqualTo(3)
            .jsonPath("$.lastError").isEqualTo("TransientRunnerException: upstream down");
    }

    @Test
    void testUnknownJobIsNotFound() {
        when(jobSubmissionService.getStatus("nope")).thenReturn(Mono.error(new JobNotFoundException("nope")));
        when(jobSubmissionService.cancelJob("nope")).thenReturn(Mono.error(new JobNotFoundException("nope")));

        client.get().uri("/api/v1/jobs/nope").exchange().expectStatus().isNotFound();
        client.delete().uri("/api/v1/jobs/nope").exchange().expectStatus().isNotFound();
    }

    @Test
    void testCancel() {
        when(jobSubmissionService.cancelJob("job-1")).thenReturn(Mono.just(CancellationResponse.builder()
            .jobId("job-1")
            .state(JobState.CANCELLED)
            .accepted(true)
            .affectedJobs(1)
            .build()));

        client.delete().uri("/api/v1/jobs/job-1")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.accepted").isEqualTo(true)
            .jsonPath("$.state").isEqualTo("CANCELLED");
    }

    @Test
    void testCancelAll() {
        when(jobSubmissionService.cancelAll()).thenReturn(Mono.just(CancellationResponse.builder()
            .accepted(true)
            .affectedJobs(3)
            .build()));

        client.post().uri("/api/v1/jobs/cancel-all")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.affectedJobs").isEqualTo(3);
    }

    @Test
    void testListFailed() {
        when(jobSubmissionService.listFailed()).thenReturn(Flux.just(
            JobView.builder().jobId("a").state(JobState.FAILED).build(),
            JobView.builder().jobId("b").state(JobState.FAILED).build()));

        client.get().uri("/api/v1/jobs/failed")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.length()").isEqualTo(2)
            .jsonPath("$[1].jobId").isEqualTo("b");
    }

    @Test
    void testRetryConflict() {
        when(jobSubmissionService.retryFailed("job-1")).thenReturn(Mono.error(
            new InvalidTransitionException("job-1", JobState.FAILED, JobState.PENDING, "Job job-1 has used all 3 attempts")));

        client.post().uri("/api/v1/jobs/job-1/retry")
            .exchange()
            .expectStatus().isEqualTo(409);
    }

    @Test
    void testRetry() {
        when(jobSubmissionService.retryFailed("job-1")).thenReturn(Mono.just(
            JobView.builder().jobId("job-1").state(JobState.PENDING).build()));

        client.post().uri("/api/v1/jobs/job-1/retry")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.state").isEqualTo("PENDING");
    }

    @Test
    void testStatistics() {
        when(jobSubmissionService.statistics()).thenReturn(Mono.just(QueueStatistics.builder()
            .total(10).pending(2).running(1).completed(5).failed(1).cancelled(1).build()));

        client.get().uri("/api/v1/jobs/statistics")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.completed").isEqualTo(5)
            .jsonPath("$.drained").isEqualTo(false);
    }
}
