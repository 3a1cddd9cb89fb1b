package com.whereq.tempo.scheduler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.whereq.tempo.config.TempoProperties;
import com.whereq.tempo.dto.EnqueueRequest;
import com.whereq.tempo.dto.JobView;
import com.whereq.tempo.exception.CorruptStateException;
import com.whereq.tempo.exception.InvalidTransitionException;
import com.whereq.tempo.executor.JobContext;
import com.whereq.tempo.executor.JobRunner;
import com.whereq.tempo.model.BatchReport;
import com.whereq.tempo.model.FailureKind;
import com.whereq.tempo.model.Job;
import com.whereq.tempo.model.JobState;
import com.whereq.tempo.model.QueueStatistics;
import com.whereq.tempo.model.ResourceBudget;
import com.whereq.tempo.resource.ResourceMonitor;
import com.whereq.tempo.retry.FailureClassifier;
import com.whereq.tempo.retry.RetryDecision;
import com.whereq.tempo.retry.RetryPolicy;
import com.whereq.tempo.store.TaskStore;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Dispatches persisted jobs to a bounded set of workers.
 *
 * A single control thread owns every state change: it admits eligible
 * PENDING jobs in FIFO order while the running count stays below the
 * sampled worker budget, and it turns completions reported by workers into
 * COMPLETED, FAILED, CANCELLED or (after backoff) PENDING again. Admin
 * calls take the same lock, so the store never sees two writers.
 *
 * A timed-out body that ignores its cancellation signal keeps running in
 * the background; its job id stays reserved until the body returns, so two
 * executions of the same job never overlap. The retry of such a job waits
 * for the body at most one job timeout past its due time; after that the
 * job stays FAILED.
 *
 * @author WhereQ Inc.
 */
@Slf4j
public class JobScheduler implements AutoCloseable {

    private static final String SHUTDOWN_REASON = "Scheduler shutting down";
    private static final String INTERRUPTED_MESSAGE = "Scheduler stopped while the job was running";

    private final TempoProperties properties;
    private final TaskStore store;
    private final ResourceMonitor resourceMonitor;
    private final RetryPolicy retryPolicy;
    private final JobRunner jobRunner;
    private final List<JobEventListener> listeners;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();

    // guarded by lock
    private final Map<String, Execution> inFlight = new LinkedHashMap<>();
    private final Set<String> lingering = new HashSet<>();
    private final Deque<Completion> completions = new ArrayDeque<>();
    private final Map<String, DeferredRetry> deferredRetries = new LinkedHashMap<>();
    private Lifecycle lifecycle = Lifecycle.NEW;
    private boolean loaded;
    private boolean loopActive;
    private RuntimeException fatalError;
    private Instant shutdownDeadline;
    private ResourceBudget currentBudget;
    private Instant startedAt;
    private int peakRunning;
    private int finishedJobs;
    private int executedAttempts;
    private Duration totalExecutionTime = Duration.ZERO;

    private Thread controlThread;
    private Scheduler workerScheduler;

    public JobScheduler(TempoProperties properties, TaskStore store, ResourceMonitor resourceMonitor,
                        RetryPolicy retryPolicy, JobRunner jobRunner, List<JobEventListener> listeners) {
        this(properties, store, resourceMonitor, retryPolicy, jobRunner, listeners, Clock.systemUTC());
    }

    public JobScheduler(TempoProperties properties, TaskStore store, ResourceMonitor resourceMonitor,
                        RetryPolicy retryPolicy, JobRunner jobRunner, List<JobEventListener> listeners,
                        Clock clock) {
        properties.validate();
        this.properties = properties;
        this.store = store;
        this.resourceMonitor = resourceMonitor;
        this.retryPolicy = retryPolicy;
        this.jobRunner = jobRunner;
        this.listeners = listeners != null ? List.copyOf(listeners) : List.of();
        this.clock = clock;
    }

    private enum Lifecycle {
        NEW, RUNNING, STOPPED
    }

    /**
     * Load the queue, recover jobs left RUNNING by a previous process and
     * start dispatching. Calling start on a running scheduler does nothing.
     *
     * @throws CorruptStateException if the queue file is unreadable and the
     *         corrupt-state policy is FAIL
     */
    public void start() {
        lock.lock();
        try {
            if (lifecycle == Lifecycle.RUNNING) {
                return;
            }
            if (lifecycle == Lifecycle.STOPPED) {
                throw new IllegalStateException("Scheduler has been stopped and cannot be restarted");
            }
            ensureLoaded();

            ExecutorService workerPool = Executors.newCachedThreadPool(workerThreadFactory());
            workerScheduler = Schedulers.fromExecutorService(workerPool, "tempo-workers");
            startedAt = clock.instant();

            controlThread = new Thread(this::controlLoop, "tempo-scheduler");
            controlThread.setDaemon(true);
            lifecycle = Lifecycle.RUNNING;
            loopActive = true;
            controlThread.start();

            QueueStatistics stats = store.statistics();
            log.info("Scheduler started: {} pending, {} completed, {} failed, {} cancelled",
                stats.getPending(), stats.getCompleted(), stats.getFailed(), stats.getCancelled());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stop admitting jobs, ask running jobs to stop and wait up to the
     * shutdown grace for them to acknowledge. Jobs that stop in time are
     * recorded as interrupted and retried on the next start; jobs that do
     * not are recovered from the queue file.
     */
    @Override
    public void close() {
        Thread loop;
        lock.lock();
        try {
            if (lifecycle != Lifecycle.RUNNING) {
                lifecycle = Lifecycle.STOPPED;
                return;
            }
            lifecycle = Lifecycle.STOPPED;
            shutdownDeadline = clock.instant().plus(properties.getScheduler().getShutdownGrace());
            if (!inFlight.isEmpty()) {
                log.info("Stopping scheduler, signalling {} running jobs", inFlight.size());
            }
            inFlight.values().forEach(execution -> execution.interruptForShutdown(SHUTDOWN_REASON));
            changed.signalAll();
            loop = controlThread;
        } finally {
            lock.unlock();
        }

        try {
            loop.join(properties.getScheduler().getShutdownGrace().toMillis() + 5000);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for the scheduler to stop");
        }
        workerScheduler.dispose();
        log.info("Scheduler stopped");
    }

    /**
     * Add a job with the default attempt ceiling
     */
    public String enqueue(JsonNode payload) {
        return enqueue(EnqueueRequest.builder().payload(payload).build());
    }

    public String enqueue(JsonNode payload, int maxAttempts) {
        return enqueue(EnqueueRequest.builder().payload(payload).maxAttempts(maxAttempts).build());
    }

    /**
     * Persist a new PENDING job
     *
     * @return id of the new job
     * @throws com.whereq.tempo.exception.DuplicateIdException if the id is taken
     */
    public String enqueue(EnqueueRequest request) {
        String jobId = request.getJobId() != null && !request.getJobId().isBlank()
            ? request.getJobId()
            : "job-" + UUID.randomUUID();
        int maxAttempts = request.getMaxAttempts() != null
            ? request.getMaxAttempts()
            : properties.getScheduler().getMaxAttempts();
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got " + maxAttempts);
        }

        Job job = Job.builder()
            .id(jobId)
            .payload(request.getPayload() != null ? request.getPayload() : NullNode.getInstance())
            .maxAttempts(maxAttempts)
            .retryOnTimeout(request.getRetryOnTimeout())
            .createdAt(clock.instant())
            .build();

        lock.lock();
        try {
            ensureLoaded();
            store.append(job);
            changed.signalAll();
        } finally {
            lock.unlock();
        }

        log.info("Enqueued job {} (max attempts {})", jobId, maxAttempts);
        return jobId;
    }

    /**
     * Cancel one job. A PENDING job is cancelled at once; a RUNNING job is
     * signalled and becomes CANCELLED when its body stops.
     *
     * @return false if the job was already terminal or already signalled
     * @throws com.whereq.tempo.exception.JobNotFoundException for an unknown id
     */
    public boolean cancel(String jobId) {
        lock.lock();
        try {
            ensureLoaded();
            Job job = store.get(jobId);
            return switch (job.getState()) {
                case PENDING -> {
                    cancelPending(job);
                    changed.signalAll();
                    yield true;
                }
                case RUNNING -> cancelRunning(jobId, "Cancelled on request");
                default -> {
                    if (dropDeferredRetry(job)) {
                        changed.signalAll();
                        yield true;
                    }
                    log.debug("Job {} is already {}, nothing to cancel", jobId, job.getState());
                    yield false;
                }
            };
        } finally {
            lock.unlock();
        }
    }

    /**
     * Cancel every PENDING job and signal every RUNNING one
     *
     * @return number of jobs affected
     */
    public int cancelAll() {
        lock.lock();
        try {
            ensureLoaded();
            int affected = 0;
            for (Job job : store.listByState(JobState.PENDING)) {
                cancelPending(job);
                affected++;
            }
            for (Job job : store.listByState(JobState.RUNNING)) {
                if (cancelRunning(job.getId(), "All jobs cancelled on request")) {
                    affected++;
                }
            }
            for (String jobId : new ArrayList<>(deferredRetries.keySet())) {
                if (dropDeferredRetry(store.get(jobId))) {
                    affected++;
                }
            }
            changed.signalAll();
            log.info("Cancel-all affected {} jobs", affected);
            return affected;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Send a FAILED job back to PENDING. Also allowed for permanent
     * failures, as long as attempts remain.
     *
     * @throws InvalidTransitionException if the job is not FAILED, has used all attempts or its
     *         timed-out execution is still running
     */
    public JobView retryFailed(String jobId) {
        lock.lock();
        try {
            ensureLoaded();
            Job job = store.get(jobId);
            if (job.getState() != JobState.FAILED) {
                throw new InvalidTransitionException(jobId, job.getState(), JobState.PENDING,
                    "Only FAILED jobs can be retried, job " + jobId + " is " + job.getState());
            }
            if (!job.hasAttemptsRemaining()) {
                throw new InvalidTransitionException(jobId, JobState.FAILED, JobState.PENDING,
                    "Job " + jobId + " has used all " + job.getMaxAttempts() + " attempts");
            }
            if (deferredRetries.containsKey(jobId) || lingering.contains(jobId)) {
                throw new InvalidTransitionException(jobId, JobState.FAILED, JobState.PENDING,
                    "Job " + jobId + " is still waiting for its timed-out execution to stop");
            }
            Job pending = store.update(jobId, JobState.PENDING, j -> {
                j.setEligibleAt(null);
                j.setFinishedAt(null);
            });
            changed.signalAll();
            log.info("Job {} re-queued manually (attempt {}/{} used)",
                jobId, pending.getAttemptCount(), pending.getMaxAttempts());
            return JobView.from(pending);
        } finally {
            lock.unlock();
        }
    }

    public JobView status(String jobId) {
        lock.lock();
        try {
            ensureLoaded();
            return JobView.from(store.get(jobId));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Jobs that ended FAILED, in enqueue order
     */
    public List<JobView> listFailed() {
        lock.lock();
        try {
            ensureLoaded();
            return store.listByState(JobState.FAILED).stream()
                .map(JobView::from)
                .collect(Collectors.toList());
        } finally {
            lock.unlock();
        }
    }

    public QueueStatistics statistics() {
        lock.lock();
        try {
            ensureLoaded();
            return store.statistics();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Budget used by the last admission pass, sampled now if there was none
     */
    public ResourceBudget currentBudget() {
        lock.lock();
        try {
            return currentBudget != null ? currentBudget : resourceMonitor.sample();
        } finally {
            lock.unlock();
        }
    }

    public int runningCount() {
        lock.lock();
        try {
            return inFlight.size();
        } finally {
            lock.unlock();
        }
    }

    public boolean isRunning() {
        lock.lock();
        try {
            return lifecycle == Lifecycle.RUNNING && loopActive;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Block until no job is PENDING or RUNNING
     *
     * @return summary of the run so far
     * @throws com.whereq.tempo.exception.StoreException if the store failed fatally
     */
    public BatchReport drain() throws InterruptedException {
        lock.lock();
        try {
            while (!isDrained()) {
                changed.await();
            }
            return buildReport();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Like {@link #drain()} but gives up after the timeout
     *
     * @return true if the queue drained in time
     */
    public boolean awaitDrained(Duration timeout) throws InterruptedException {
        long remaining = timeout.toNanos();
        lock.lock();
        try {
            while (!isDrained()) {
                if (remaining <= 0) {
                    return false;
                }
                remaining = changed.awaitNanos(remaining);
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Batch mode: start, wait for the queue to drain, stop
     */
    public BatchReport run() throws InterruptedException {
        start();
        try {
            BatchReport report = drain();
            log.info("Batch finished: {} completed, {} failed, {} cancelled in {} s ({} jobs/s, peak {} running)",
                report.getCompletedJobs(), report.getFailedJobs(), report.getCancelledJobs(),
                report.getElapsed().toSeconds(), String.format(Locale.ROOT, "%.2f", report.getThroughput()),
                report.getPeakRunning());
            return report;
        } finally {
            close();
        }
    }

    // ---------------------------------------------------------------- control loop

    private void controlLoop() {
        log.debug("Control loop started");
        lock.lock();
        try {
            while (true) {
                Instant wakeAt;
                try {
                    processCompletions();
                    if (lifecycle == Lifecycle.STOPPED) {
                        if (inFlight.isEmpty()) {
                            releaseDeferredRetries();
                            break;
                        }
                        if (!clock.instant().isBefore(shutdownDeadline)) {
                            log.warn("{} jobs did not stop within the shutdown grace, leaving them RUNNING "
                                + "for recovery on the next start: {}", inFlight.size(), inFlight.keySet());
                            releaseDeferredRetries();
                            break;
                        }
                        wakeAt = shutdownDeadline;
                    } else {
                        Instant giveUpAt = resolveDeferredRetries();
                        wakeAt = admit();
                        if (giveUpAt != null && giveUpAt.isBefore(wakeAt)) {
                            wakeAt = giveUpAt;
                        }
                    }
                } catch (RuntimeException e) {
                    fail(e);
                    break;
                }

                changed.signalAll();
                if (completions.isEmpty()) {
                    long nanos = Duration.between(clock.instant(), wakeAt).toNanos();
                    changed.awaitNanos(Math.max(TimeUnit.MILLISECONDS.toNanos(1), nanos));
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Control loop interrupted");
        } finally {
            loopActive = false;
            changed.signalAll();
            lock.unlock();
            log.debug("Control loop exited");
        }
    }

    /**
     * Dispatch eligible jobs within the current budget
     *
     * @return when the loop should look again without being signalled
     */
    private Instant admit() {
        Instant now = clock.instant();
        Instant wakeAt = now.plus(properties.getScheduler().getBudgetRecheckInterval());

        List<Job> eligible = new ArrayList<>();
        for (Job job : store.listByState(JobState.PENDING)) {
            if (inFlight.containsKey(job.getId()) || lingering.contains(job.getId())) {
                continue;
            }
            if (!job.hasAttemptsRemaining()) {
                Job cancelled = store.update(job.getId(), JobState.CANCELLED, j -> {
                    j.setLastError("No attempts left (" + j.getAttemptCount() + "/" + j.getMaxAttempts() + ")");
                    j.setFinishedAt(now);
                });
                log.warn("Job {} was PENDING with no attempts left, cancelled", job.getId());
                finished(cancelled, null);
                continue;
            }
            if (job.isEligibleAt(now)) {
                eligible.add(job);
            } else if (job.getEligibleAt().isBefore(wakeAt)) {
                wakeAt = job.getEligibleAt();
            }
        }
        if (eligible.isEmpty()) {
            return wakeAt;
        }

        // stable sort: ties keep insertion order
        eligible.sort(Comparator.comparing(Job::getCreatedAt));

        ResourceBudget budget = resourceMonitor.sample();
        currentBudget = budget;
        int slots = budget.getMaxWorkers() - inFlight.size();
        if (slots <= 0) {
            log.debug("Worker budget of {} in use, {} eligible jobs waiting", budget.getMaxWorkers(), eligible.size());
            return wakeAt;
        }

        for (Job job : eligible.subList(0, Math.min(slots, eligible.size()))) {
            dispatch(job, budget);
        }
        return wakeAt;
    }

    private void dispatch(Job pending, ResourceBudget budget) {
        Instant now = clock.instant();
        Duration timeout = properties.getScheduler().getJobTimeout();
        Job job = store.update(pending.getId(), JobState.RUNNING, j -> {
            j.setAttemptCount(j.getAttemptCount() + 1);
            j.setStartedAt(now);
            j.setFinishedAt(null);
            j.setEligibleAt(null);
            j.setCancelRequested(false);
        });

        CooperativeCancellation cancellation = new CooperativeCancellation();
        Execution execution = new Execution(job.getId(), job.getAttemptCount(), cancellation, System.nanoTime());
        JobContext context = JobContext.builder()
            .jobId(job.getId())
            .attempt(job.getAttemptCount())
            .acceleratorClass(budget.getAcceleratorClass())
            .deadline(now.plus(timeout))
            .cancellation(cancellation)
            .build();

        inFlight.put(job.getId(), execution);
        lingering.add(job.getId());
        peakRunning = Math.max(peakRunning, inFlight.size());

        log.info("Dispatching job {} (attempt {}/{}, running {}/{})",
            job.getId(), job.getAttemptCount(), job.getMaxAttempts(), inFlight.size(), budget.getMaxWorkers());
        notifyListeners(listener -> listener.onJobStarted(job));

        JsonNode payload = job.getPayload();
        Mono.fromCallable(() -> execute(execution, payload, context))
            .subscribeOn(workerScheduler)
            .timeout(timeout)
            .subscribe(
                completion -> report(completion),
                error -> {
                    if (error instanceof TimeoutException) {
                        cancellation.cancel("Job timed out after " + timeout);
                    }
                    report(new Completion(execution, null, error, clock.instant()));
                });
    }

    /**
     * Runs on a worker thread. Never throws for a failed body so the outcome
     * always travels as a value.
     */
    private Completion execute(Execution execution, JsonNode payload, JobContext context) {
        execution.cancellation.bind(Thread.currentThread());
        try {
            JsonNode result = jobRunner.run(payload, context);
            return new Completion(execution, result != null ? result : NullNode.getInstance(), null, clock.instant());
        } catch (Exception e) {
            return new Completion(execution, null, e, clock.instant());
        } finally {
            execution.cancellation.unbind();
            // clear a late interrupt before the thread goes back to the pool
            Thread.interrupted();
            release(execution.jobId);
        }
    }

    private void release(String jobId) {
        lock.lock();
        try {
            lingering.remove(jobId);
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    private void report(Completion completion) {
        if (!completion.getExecution().reported.compareAndSet(false, true)) {
            return;
        }
        lock.lock();
        try {
            completions.add(completion);
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    private void processCompletions() {
        Completion completion;
        while ((completion = completions.poll()) != null) {
            handle(completion);
        }
    }

    private void handle(Completion completion) {
        Execution execution = completion.getExecution();
        String jobId = execution.jobId;
        Instant finishedAt = completion.getFinishedAt();
        inFlight.remove(jobId, execution);

        Duration executionTime = Duration.ofNanos(System.nanoTime() - execution.startNanos);
        executedAttempts++;
        totalExecutionTime = totalExecutionTime.plus(executionTime);

        if (completion.getError() == null) {
            // a body that returned a result completed, even if a cancel arrived meanwhile
            Job completed = store.update(jobId, JobState.COMPLETED, j -> {
                j.setResult(completion.getResult());
                j.setLastError(null);
                j.setLastFailureKind(null);
                j.setFinishedAt(finishedAt);
            });
            log.info("Job {} completed in {} ms (attempt {})", jobId, executionTime.toMillis(), execution.attempt);
            finished(completed, executionTime);
            return;
        }

        Throwable error = completion.getError();
        if (execution.cancelledByUser) {
            Job cancelled = store.update(jobId, JobState.CANCELLED, j -> {
                retryPolicy.recordFailure(j, FailureKind.CANCELLED, execution.cancellation.reason(), finishedAt);
                j.setFinishedAt(finishedAt);
            });
            log.info("Job {} cancelled after {} ms", jobId, executionTime.toMillis());
            finished(cancelled, executionTime);
            return;
        }

        FailureKind kind;
        String message;
        if (execution.interruptedByShutdown) {
            kind = FailureKind.INTERRUPTED;
            message = INTERRUPTED_MESSAGE;
        } else if (error instanceof TimeoutException) {
            kind = FailureKind.TIMEOUT;
            message = "Job timed out after " + properties.getScheduler().getJobTimeout();
        } else {
            kind = FailureClassifier.classify(error);
            message = FailureClassifier.describe(error);
        }

        log.warn("Job {} attempt {} failed ({}): {}", jobId, execution.attempt, kind, message);
        log.debug("Job {} failure detail", jobId, error);

        Job failed = store.update(jobId, JobState.FAILED, j -> {
            retryPolicy.recordFailure(j, kind, message, finishedAt);
            j.setFinishedAt(finishedAt);
        });
        scheduleRetryOrFinish(failed, finishedAt, executionTime);
    }

    private void scheduleRetryOrFinish(Job failed, Instant failedAt, Duration executionTime) {
        RetryDecision decision = retryPolicy.decide(failed, failedAt, clock.instant());
        if (!decision.isRetry()) {
            log.warn("Job {} failed permanently after {} attempt(s): {}",
                failed.getId(), failed.getAttemptCount(), failed.getLastError());
            finished(failed, executionTime);
            return;
        }

        if (lingering.contains(failed.getId())) {
            // the abandoned body still holds the id
            Instant giveUpAt = decision.getEligibleAt().plus(properties.getScheduler().getJobTimeout());
            deferredRetries.put(failed.getId(), new DeferredRetry(decision, giveUpAt, executionTime));
            log.warn("Job {} has not stopped after its timeout, holding its retry until it does (at most until {})",
                failed.getId(), giveUpAt);
            return;
        }
        requeue(failed.getId(), decision);
    }

    private void requeue(String jobId, RetryDecision decision) {
        Job retried = store.update(jobId, JobState.PENDING, j -> {
            j.setEligibleAt(decision.getEligibleAt());
            j.setFinishedAt(null);
        });
        log.info("Retrying job {} in {} ms (attempt {}/{} used)",
            retried.getId(), decision.getBackoff().toMillis(), retried.getAttemptCount(), retried.getMaxAttempts());
        notifyListeners(listener -> listener.onJobRetryScheduled(retried, decision));
    }

    /**
     * Re-queue held retries whose abandoned body has returned and give up on
     * those whose body outlived the bound
     *
     * @return earliest pending give-up instant, null if none
     */
    private Instant resolveDeferredRetries() {
        Instant now = clock.instant();
        Instant earliest = null;
        Iterator<Map.Entry<String, DeferredRetry>> it = deferredRetries.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<String, DeferredRetry> entry = it.next();
            String jobId = entry.getKey();
            DeferredRetry deferred = entry.getValue();
            if (!lingering.contains(jobId)) {
                it.remove();
                requeue(jobId, deferred.getDecision());
            } else if (!now.isBefore(deferred.getGiveUpAt())) {
                it.remove();
                Duration timeout = properties.getScheduler().getJobTimeout();
                Job failed = store.amend(jobId, j -> j.setLastError(j.getLastError()
                    + "; the timed-out execution ignored its stop signal for another " + timeout
                    + ", retries abandoned"));
                log.error("Job {} failed permanently: its timed-out execution is still running", jobId);
                finished(failed, deferred.getExecutionTime());
            } else if (earliest == null || deferred.getGiveUpAt().isBefore(earliest)) {
                earliest = deferred.getGiveUpAt();
            }
        }
        return earliest;
    }

    /**
     * On shutdown held retries go back to PENDING for the next start
     */
    private void releaseDeferredRetries() {
        for (Map.Entry<String, DeferredRetry> entry : deferredRetries.entrySet()) {
            requeue(entry.getKey(), entry.getValue().getDecision());
        }
        deferredRetries.clear();
    }

    private boolean dropDeferredRetry(Job job) {
        DeferredRetry deferred = deferredRetries.remove(job.getId());
        if (deferred == null) {
            return false;
        }
        log.info("Dropped the held retry of job {}, it stays {}", job.getId(), job.getState());
        finished(job, deferred.getExecutionTime());
        return true;
    }

    private void cancelPending(Job job) {
        Instant now = clock.instant();
        Job cancelled = store.update(job.getId(), JobState.CANCELLED, j -> {
            j.setFinishedAt(now);
            j.setEligibleAt(null);
        });
        log.info("Job {} cancelled before it ran", job.getId());
        finished(cancelled, null);
    }

    private boolean cancelRunning(String jobId, String reason) {
        Execution execution = inFlight.get(jobId);
        if (execution != null && execution.cancelledByUser) {
            return false;
        }
        store.amend(jobId, j -> j.setCancelRequested(true));
        if (execution != null) {
            execution.cancelByUser(reason);
            log.info("Job {} signalled to stop: {}", jobId, reason);
        }
        return true;
    }

    private void finished(Job job, Duration executionTime) {
        finishedJobs++;
        notifyListeners(listener -> listener.onJobFinished(job, executionTime));
    }

    private void fail(RuntimeException e) {
        fatalError = e;
        log.error("Scheduler stopped admitting jobs after a fatal error: {}", e.getMessage(), e);
        inFlight.values().forEach(execution -> execution.interruptForShutdown("Scheduler failed: " + e.getMessage()));
    }

    private void notifyListeners(Consumer<JobEventListener> event) {
        for (JobEventListener listener : listeners) {
            try {
                event.accept(listener);
            } catch (RuntimeException e) {
                log.warn("Job event listener {} failed: {}", listener.getClass().getSimpleName(), e.getMessage(), e);
            }
        }
    }

    // ---------------------------------------------------------------- loading and recovery

    private void ensureLoaded() {
        if (loaded) {
            return;
        }
        try {
            store.load();
        } catch (CorruptStateException e) {
            if (properties.getStore().getOnCorrupt() != TempoProperties.CorruptStatePolicy.START_EMPTY) {
                throw e;
            }
            log.error("Queue file is unreadable, starting with an empty queue: {}", e.getMessage());
            store.quarantineAndReset();
        }
        recoverInterrupted();
        loaded = true;
    }

    /**
     * Jobs still RUNNING in a freshly loaded queue belong to a process that
     * died; they count as interrupted attempts
     */
    private void recoverInterrupted() {
        Instant now = clock.instant();
        for (Job orphan : store.listByState(JobState.RUNNING)) {
            if (orphan.isCancelRequested()) {
                Job cancelled = store.update(orphan.getId(), JobState.CANCELLED, j -> {
                    retryPolicy.recordFailure(j, FailureKind.CANCELLED, INTERRUPTED_MESSAGE, now);
                    j.setFinishedAt(now);
                });
                log.warn("Recovered job {} as CANCELLED (cancel was requested before the restart)", orphan.getId());
                finished(cancelled, null);
                continue;
            }

            Job failed = store.update(orphan.getId(), JobState.FAILED, j -> {
                retryPolicy.recordFailure(j, FailureKind.INTERRUPTED, INTERRUPTED_MESSAGE, now);
                j.setFinishedAt(now);
            });
            log.warn("Recovered interrupted job {} (attempt {}/{})",
                failed.getId(), failed.getAttemptCount(), failed.getMaxAttempts());
            scheduleRetryOrFinish(failed, now, null);
        }
    }

    // ---------------------------------------------------------------- helpers

    private boolean isDrained() {
        if (fatalError != null) {
            throw fatalError;
        }
        if (!inFlight.isEmpty() || !completions.isEmpty() || !deferredRetries.isEmpty()) {
            return false;
        }
        ensureLoaded();
        if (store.statistics().isDrained()) {
            return true;
        }
        if (lifecycle != Lifecycle.RUNNING || !loopActive) {
            throw new IllegalStateException("Scheduler is not running, " + store.statistics().getPending()
                + " jobs can never finish");
        }
        return false;
    }

    private BatchReport buildReport() {
        QueueStatistics stats = store.statistics();
        Duration elapsed = startedAt != null ? Duration.between(startedAt, clock.instant()) : Duration.ZERO;
        double seconds = elapsed.toMillis() / 1000.0;
        return BatchReport.builder()
            .totalJobs(stats.getTotal())
            .completedJobs(stats.getCompleted())
            .failedJobs(stats.getFailed())
            .cancelledJobs(stats.getCancelled())
            .elapsed(elapsed)
            .averageJobDuration(executedAttempts > 0 ? totalExecutionTime.dividedBy(executedAttempts) : Duration.ZERO)
            .throughput(seconds > 0 ? finishedJobs / seconds : 0.0)
            .peakRunning(peakRunning)
            .build();
    }

    private static ThreadFactory workerThreadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "tempo-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    /**
     * One execution attempt of a job
     */
    private static final class Execution {
        final String jobId;
        final int attempt;
        final CooperativeCancellation cancellation;
        final long startNanos;
        final AtomicBoolean reported = new AtomicBoolean();
        volatile boolean cancelledByUser;
        volatile boolean interruptedByShutdown;

        Execution(String jobId, int attempt, CooperativeCancellation cancellation, long startNanos) {
            this.jobId = jobId;
            this.attempt = attempt;
            this.cancellation = cancellation;
            this.startNanos = startNanos;
        }

        void cancelByUser(String reason) {
            cancelledByUser = true;
            cancellation.cancel(reason);
        }

        void interruptForShutdown(String reason) {
            interruptedByShutdown = true;
            cancellation.cancel(reason);
        }
    }

    /**
     * Retry held back until the timed-out body of the job returns
     */
    @Value
    private static class DeferredRetry {
        RetryDecision decision;
        Instant giveUpAt;
        Duration executionTime;
    }

    /**
     * Outcome of an execution: a result or an error, never both
     */
    @Value
    private static class Completion {
        Execution execution;
        JsonNode result;
        Throwable error;
        Instant finishedAt;
    }
}
