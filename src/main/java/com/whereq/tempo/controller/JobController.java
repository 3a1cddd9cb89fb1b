package com.whereq.tempo.controller;

import com.whereq.tempo.dto.CancellationResponse;
import com.whereq.tempo.dto.EnqueueRequest;
import com.whereq.tempo.dto.EnqueueResponse;
import com.whereq.tempo.dto.JobView;
import com.whereq.tempo.exception.DuplicateIdException;
import com.whereq.tempo.exception.InvalidTransitionException;
import com.whereq.tempo.exception.JobNotFoundException;
import com.whereq.tempo.model.QueueStatistics;
import com.whereq.tempo.service.JobSubmissionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.util.List;

/**
 * Controller for job submission and queue administration
 *
 * @author WhereQ Inc.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/jobs")
@Tag(name = "Jobs", description = "Enqueue, inspect, cancel and retry batch jobs")
public class JobController {

    private final JobSubmissionService jobSubmissionService;

    @Autowired
    public JobController(JobSubmissionService jobSubmissionService) {
        this.jobSubmissionService = jobSubmissionService;
    }

    /**
     * Enqueue a job for async execution
     *
     * @param request job request
     * @return Mono with 202 Accepted response
     */
    @PostMapping
    @Operation(summary = "Enqueue job", description = "Persist a new PENDING job; it runs when a worker slot is free")
    public Mono<ResponseEntity<EnqueueResponse>> submitJob(@Valid @RequestBody EnqueueRequest request) {
        log.info("Received job submission: jobId={}, maxAttempts={}", request.getJobId(), request.getMaxAttempts());

        return jobSubmissionService.submitJob(request)
            .map(response -> ResponseEntity
                .status(HttpStatus.ACCEPTED)
                .location(URI.create("/api/v1/jobs/" + response.getJobId()))
                .body(response))
            .onErrorResume(IllegalArgumentException.class, e -> {
                log.error("Validation error: {}", e.getMessage());
                return Mono.just(ResponseEntity
                    .badRequest()
                    .body(EnqueueResponse.error(e.getMessage())));
            })
            .onErrorResume(DuplicateIdException.class, e -> {
                log.warn("Duplicate job id: {}", e.getJobId());
                return Mono.just(ResponseEntity
                    .status(HttpStatus.CONFLICT)
                    .body(EnqueueResponse.error(e.getMessage())));
            })
            .onErrorResume(Exception.class, e -> {
                log.error("Unexpected error during job submission", e);
                return Mono.just(ResponseEntity
                    .status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(EnqueueResponse.error("Internal server error: " + e.getMessage())));
            });
    }

    @GetMapping("/{jobId}")
    @Operation(summary = "Job status", description = "State, attempts, last error and result of one job")
    public Mono<ResponseEntity<JobView>> getJobStatus(@PathVariable String jobId) {
        return jobSubmissionService.getStatus(jobId)
            .map(ResponseEntity::ok)
            .onErrorResume(JobNotFoundException.class, e -> Mono.just(ResponseEntity.notFound().build()))
            .onErrorResume(Exception.class, e -> {
                log.error("Error reading job {}", jobId, e);
                return Mono.just(ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).build());
            });
    }

    /**
     * Cancel a job
     *
     * @param jobId job identifier
     * @return Mono with cancellation response; a terminal job is reported, not rejected
     */
    @DeleteMapping("/{jobId}")
    @Operation(summary = "Cancel job", description = "Cancel a pending job or signal a running one to stop")
    public Mono<ResponseEntity<CancellationResponse>> cancelJob(@PathVariable String jobId) {
        log.info("Job cancellation request for {}", jobId);

        return jobSubmissionService.cancelJob(jobId)
            .map(ResponseEntity::ok)
            .onErrorResume(JobNotFoundException.class, e -> Mono.just(ResponseEntity.notFound().build()))
            .onErrorResume(Exception.class, e -> {
                log.error("Error cancelling job {}", jobId, e);
                return Mono.just(ResponseEntity
                    .status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .build());
            });
    }

    @PostMapping("/cancel-all")
    @Operation(summary = "Cancel all jobs", description = "Cancel every pending job and signal every running one")
    public Mono<ResponseEntity<CancellationResponse>> cancelAll() {
        log.info("Cancel-all request");

        return jobSubmissionService.cancelAll()
            .map(ResponseEntity::ok)
            .onErrorResume(Exception.class, e -> {
                log.error("Error cancelling all jobs", e);
                return Mono.just(ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).build());
            });
    }

    @GetMapping("/failed")
    @Operation(summary = "Failed jobs", description = "Jobs that ended FAILED, with their failure history")
    public Mono<ResponseEntity<List<JobView>>> listFailed() {
        return jobSubmissionService.listFailed()
            .collectList()
            .map(ResponseEntity::ok)
            .onErrorResume(Exception.class, e -> {
                log.error("Error listing failed jobs", e);
                return Mono.just(ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).build());
            });
    }

    @PostMapping("/{jobId}/retry")
    @Operation(summary = "Retry failed job", description = "Send a FAILED job with attempts left back to PENDING")
    public Mono<ResponseEntity<JobView>> retryJob(@PathVariable String jobId) {
        log.info("Manual retry request for {}", jobId);

        return jobSubmissionService.retryFailed(jobId)
            .map(ResponseEntity::ok)
            .onErrorResume(JobNotFoundException.class, e -> Mono.just(ResponseEntity.notFound().build()))
            .onErrorResume(InvalidTransitionException.class, e -> {
                log.warn("Cannot retry job {}: {}", jobId, e.getMessage());
                return Mono.just(ResponseEntity.status(HttpStatus.CONFLICT).build());
            })
            .onErrorResume(Exception.class, e -> {
                log.error("Error retrying job {}", jobId, e);
                return Mono.just(ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).build());
            });
    }

    @GetMapping("/statistics")
    @Operation(summary = "Queue statistics", description = "Job counts per state")
    public Mono<ResponseEntity<QueueStatistics>> statistics() {
        return jobSubmissionService.statistics()
            .map(ResponseEntity::ok)
            .onErrorResume(Exception.class, e -> {
                log.error("Error reading queue statistics", e);
                return Mono.just(ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).build());
            });
    }
}
