package com.whereq.tempo.service;

import com.whereq.tempo.dto.CancellationResponse;
import com.whereq.tempo.dto.EnqueueRequest;
import com.whereq.tempo.dto.EnqueueResponse;
import com.whereq.tempo.dto.JobView;
import com.whereq.tempo.model.JobState;
import com.whereq.tempo.model.QueueStatistics;
import com.whereq.tempo.scheduler.JobScheduler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Instant;
import java.util.List;

/**
 * Service for job submission and management. Scheduler calls block on the
 * queue file, so they run on the bounded elastic scheduler.
 */
@Slf4j
@Service
public class JobSubmissionService {

    private final JobScheduler scheduler;

    @Autowired
    public JobSubmissionService(JobScheduler scheduler) {
        this.scheduler = scheduler;
    }

    /**
     * Submit a job for async execution
     *
     * @param request job request
     * @return Mono with submission response
     */
    public Mono<EnqueueResponse> submitJob(EnqueueRequest request) {
        return validateJob(request)
            .then(Mono.fromCallable(() -> scheduler.enqueue(request)))
            .subscribeOn(Schedulers.boundedElastic())
            .map(jobId -> EnqueueResponse.builder()
                .jobId(jobId)
                .state(JobState.PENDING)
                .enqueuedAt(Instant.now())
                .build())
            .doOnSuccess(response -> log.info("Job {} submitted successfully", response.getJobId()))
            .doOnError(e -> log.error("Job submission failed: {}", e.getMessage()));
    }

    public Mono<JobView> getStatus(String jobId) {
        return Mono.fromCallable(() -> scheduler.status(jobId))
            .subscribeOn(Schedulers.boundedElastic());
    }

    /**
     * Cancel a pending or running job
     *
     * @param jobId job identifier
     * @return Mono with cancellation response
     */
    public Mono<CancellationResponse> cancelJob(String jobId) {
        return Mono.fromCallable(() -> {
                boolean accepted = scheduler.cancel(jobId);
                JobView view = scheduler.status(jobId);
                return CancellationResponse.builder()
                    .jobId(jobId)
                    .state(view.getState())
                    .accepted(accepted)
                    .affectedJobs(accepted ? 1 : 0)
                    .requestedAt(Instant.now())
                    .message(cancellationMessage(accepted, view))
                    .build();
            })
            .subscribeOn(Schedulers.boundedElastic())
            .doOnSuccess(response -> log.info("Cancellation of job {}: {}", jobId, response.getMessage()));
    }

    public Mono<CancellationResponse> cancelAll() {
        return Mono.fromCallable(() -> {
                int affected = scheduler.cancelAll();
                return CancellationResponse.builder()
                    .accepted(affected > 0)
                    .affectedJobs(affected)
                    .requestedAt(Instant.now())
                    .message(affected + " jobs cancelled or signalled")
                    .build();
            })
            .subscribeOn(Schedulers.boundedElastic());
    }

    public Flux<JobView> listFailed() {
        return Mono.fromCallable(scheduler::listFailed)
            .subscribeOn(Schedulers.boundedElastic())
            .flatMapIterable(List::copyOf);
    }

    public Mono<JobView> retryFailed(String jobId) {
        return Mono.fromCallable(() -> scheduler.retryFailed(jobId))
            .subscribeOn(Schedulers.boundedElastic())
            .doOnSuccess(view -> log.info("Job {} re-queued on request", jobId));
    }

    public Mono<QueueStatistics> statistics() {
        return Mono.fromCallable(scheduler::statistics)
            .subscribeOn(Schedulers.boundedElastic());
    }

    /**
     * Validate job request
     */
    private Mono<Void> validateJob(EnqueueRequest request) {
        return Mono.fromRunnable(() -> {
            if (request.getPayload() == null || request.getPayload().isNull()) {
                throw new IllegalArgumentException("Payload is required");
            }
            if (request.getMaxAttempts() != null && request.getMaxAttempts() < 1) {
                throw new IllegalArgumentException("maxAttempts must be at least 1");
            }
            if (request.getJobId() != null && request.getJobId().isBlank()) {
                throw new IllegalArgumentException("jobId must not be blank");
            }
        });
    }

    private static String cancellationMessage(boolean accepted, JobView view) {
        if (!accepted) {
            return "Job is already " + view.getState() + ", nothing to cancel";
        }
        return switch (view.getState()) {
            case RUNNING -> "Cancellation requested, the job stops at its next checkpoint";
            case CANCELLED -> "Job cancelled successfully";
            default -> "Job is " + view.getState();
        };
    }
}
