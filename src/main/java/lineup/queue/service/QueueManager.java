package lineup.queue.service;

import lineup.queue.config.QueueConfig;
import lineup.queue.error.InvalidStateException;
import lineup.queue.error.JobNotFoundException;
import lineup.queue.error.StoreException;
import lineup.queue.events.CompositeJobEventListener;
import lineup.queue.events.JobEventListener;
import lineup.queue.executor.CancellationFlag;
import lineup.queue.executor.ExecutionOutcome;
import lineup.queue.executor.JobExecutor;
import lineup.queue.executor.JobHandlerRegistry;
import lineup.queue.model.CancelResult;
import lineup.queue.model.JobPayload;
import lineup.queue.model.JobPriority;
import lineup.queue.model.JobRecord;
import lineup.queue.model.JobStatus;
import lineup.queue.repository.JobStore;
import lineup.queue.scheduler.InterruptedJobRecovery;
import lineup.queue.scheduler.JobDispatcher;
import lineup.queue.scheduler.QueueIndex;
import lineup.queue.scheduler.SchedulerLoop;
import lineup.queue.scheduler.ThrottlePolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.BooleanSupplier;

/**
 * Entry point of the queue: enqueue, cancel, reorder, pause/resume, list, prune.
 *
 * Owns the store, the in-memory queue index and the scheduler loop. Every
 * read-then-write of the store or the index happens under one lock; handlers
 * run outside it. A status change is written to the store before listeners
 * hear about it, and notifications are sent after the lock is released.
 *
 * The store is authoritative. When a write fails or the store disagrees with
 * the index, the index is marked stale and rebuilt before the next dispatch.
 */
public class QueueManager implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(QueueManager.class);

    private final JobStore store;
    private final JobEventListener listener;
    private final JobExecutor executor;
    private final Clock clock;
    private final SchedulerLoop loop;

    private final Object lock = new Object();

    // guarded by lock
    private final QueueIndex index = new QueueIndex();
    private boolean indexStale = false;
    private ActiveJob active;
    private Instant lastCreatedAt;
    private boolean paused = false;

    private volatile boolean closed = false;

    public QueueManager(JobStore store, JobHandlerRegistry handlers, JobEventListener listener, QueueConfig config) {
        this(store, handlers, listener, config, Clock.systemUTC());
    }

    /**
     * Create the queue and bring it to a consistent state: jobs left RUNNING by
     * a previous process are requeued and the index is rebuilt. Dispatch starts
     * with {@link #start()}.
     *
     * @throws StoreException if recovery cannot read or write the store
     */
    public QueueManager(JobStore store, JobHandlerRegistry handlers, JobEventListener listener,
            QueueConfig config, Clock clock) {
        this.store = Objects.requireNonNull(store, "store");
        this.listener = listener instanceof CompositeJobEventListener
                ? listener
                : new CompositeJobEventListener(List.of(listener != null ? listener : JobEventListener.NO_OP));
        this.executor = new JobExecutor(Objects.requireNonNull(handlers, "handlers"), this.listener);
        this.clock = Objects.requireNonNull(clock, "clock");

        new InterruptedJobRecovery(store, clock).recover();
        synchronized (lock) {
            rebuildIndex();
        }

        ThrottlePolicy throttle = new ThrottlePolicy(
                config.cooldown(), config.maxConsecutive(), config.forcedCooldown());
        this.loop = new SchedulerLoop(new Dispatcher(), throttle, config.pollInterval(),
                config.shutdownTimeout(), clock);

        log.info("Queue ready with {} queued jobs", index.size());
    }

    /**
     * Start dispatching.
     */
    public void start() {
        ensureOpen();
        loop.start();
    }

    /**
     * Stop the scheduler loop. A job still running after the shutdown timeout
     * is interrupted and stays RUNNING in the store, to be requeued on next start.
     * The store itself is not closed.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        loop.stop();
        log.info("Queue closed");
    }

    // ------------------------------------------------------------------
    // Caller operations
    // ------------------------------------------------------------------

    public String enqueue(JobPayload payload) {
        return enqueue(payload, JobPriority.NORMAL);
    }

    /**
     * Add a job.
     *
     * @return the new job id
     * @throws StoreException if the job could not be persisted
     */
    public String enqueue(JobPayload payload, JobPriority priority) {
        Objects.requireNonNull(payload, "payload");
        Objects.requireNonNull(priority, "priority");
        ensureOpen();

        String id = "job-" + UUID.randomUUID();
        synchronized (lock) {
            Instant createdAt = nextCreatedAt();
            JobRecord record = JobRecord.builder()
                    .id(id)
                    .payload(payload)
                    .priority(priority)
                    .status(JobStatus.QUEUED)
                    .createdAt(createdAt)
                    .build();

            store.insert(record);
            lastCreatedAt = createdAt;
            if (!indexStale) {
                index.insert(record);
            }
        }

        log.info("Enqueued job {} ({}, {})", id, payload.type(), priority);
        loop.wake();
        return id;
    }

    /**
     * Cancel a job. A queued job is cancelled at once; a running job gets its
     * cancellation flag raised and ends as CANCELLED only if its handler acts on
     * it. Cancelling a finished job does nothing.
     *
     * @throws JobNotFoundException if no job has this id
     */
    public CancelResult cancel(String id) {
        CancelResult result;

        synchronized (lock) {
            JobRecord current = store.get(id).orElseThrow(() -> new JobNotFoundException(id));

            switch (current.status()) {
                case QUEUED -> {
                    writeStatus(id, JobStatus.QUEUED, JobStatus.CANCELLED, null);
                    index.remove(id);
                    result = CancelResult.CANCELLED;
                }
                case RUNNING -> {
                    if (active != null && active.record.id().equals(id)) {
                        active.cancellation.requestCancel();
                    } else {
                        log.warn("Job {} is RUNNING in the store but not active here", id);
                    }
                    result = CancelResult.CANCEL_REQUESTED;
                }
                default -> result = CancelResult.ALREADY_TERMINAL;
            }
        }

        switch (result) {
            case CANCELLED -> {
                log.info("Cancelled queued job {}", id);
                listener.onJobCancelled(id);
            }
            case CANCEL_REQUESTED -> log.info("Cancellation requested for running job {}", id);
            case ALREADY_TERMINAL -> log.debug("Cancel of job {} ignored, already finished", id);
        }
        return result;
    }

    /**
     * Change the priority of a queued job. Its {@code createdAt} is kept, so it
     * takes its age position in the new level.
     *
     * @throws JobNotFoundException  if no job has this id
     * @throws InvalidStateException if the job is no longer queued
     */
    public JobRecord reorder(String id, JobPriority priority) {
        Objects.requireNonNull(priority, "priority");

        JobRecord updated;
        synchronized (lock) {
            JobRecord current = store.get(id).orElseThrow(() -> new JobNotFoundException(id));
            if (current.status() != JobStatus.QUEUED) {
                throw new InvalidStateException(id, current.status(), "reorder");
            }
            if (current.priority() == priority) {
                return current;
            }

            updated = store.updatePriority(id, priority).orElseThrow(() -> diverged(id));
            if (!indexStale && !index.reorder(id, priority)) {
                indexStale = true;
            }
        }

        log.info("Reordered job {} to {}", id, priority);
        return updated;
    }

    /**
     * Stop dispatching new jobs. A running job is left to finish. Once this
     * returns no further job is claimed until {@link #resume()}.
     */
    public void pause() {
        synchronized (lock) {
            if (paused) {
                return;
            }
            paused = true;
        }
        log.info("Queue paused");
    }

    public void resume() {
        synchronized (lock) {
            if (!paused) {
                return;
            }
            paused = false;
        }
        log.info("Queue resumed");
        loop.wake();
    }

    public boolean isPaused() {
        synchronized (lock) {
            return paused;
        }
    }

    /**
     * Snapshot of all jobs: running, queued, completed, failed, cancelled; then
     * priority and age.
     */
    public List<JobRecord> list() {
        return store.scanAll();
    }

    public List<JobRecord> list(JobStatus status) {
        return store.scanByStatus(status);
    }

    public Optional<JobRecord> get(String id) {
        return store.get(id);
    }

    public int count(JobStatus status) {
        return store.countByStatus(status);
    }

    /**
     * Delete finished jobs whose last status change is older than {@code age}.
     * Queued and running jobs are never touched.
     *
     * @return number of jobs deleted
     */
    public int prune(Duration age) {
        if (age == null || age.isNegative()) {
            throw new IllegalArgumentException("age must not be negative");
        }
        Instant cutoff = clock.instant().minus(age);
        int deleted = store.deleteOlderThan(JobStatus.TERMINAL, cutoff);
        if (deleted > 0) {
            log.info("Pruned {} finished jobs older than {}", deleted, cutoff);
        }
        return deleted;
    }

    public int queuedCount() {
        synchronized (lock) {
            return indexStale ? store.countByStatus(JobStatus.QUEUED) : index.size();
        }
    }

    /** Id of the job whose handler is running or whose outcome is still being written. */
    public Optional<String> runningJobId() {
        synchronized (lock) {
            return active != null ? Optional.of(active.record.id()) : Optional.empty();
        }
    }

    // ------------------------------------------------------------------
    // Internals (callers hold lock where noted)
    // ------------------------------------------------------------------

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Queue is closed");
        }
    }

    // lock held
    private void rebuildIndex() {
        List<JobRecord> queued = store.scanByStatus(JobStatus.QUEUED);
        index.rebuild(queued);
        indexStale = false;
        for (JobRecord record : queued) {
            if (lastCreatedAt == null || record.createdAt().isAfter(lastCreatedAt)) {
                lastCreatedAt = record.createdAt();
            }
        }
        log.debug("Queue index rebuilt with {} jobs", queued.size());
    }

    // lock held; creation times are strictly increasing so FIFO order is total
    private Instant nextCreatedAt() {
        Instant now = clock.instant().truncatedTo(ChronoUnit.MICROS);
        if (lastCreatedAt != null && !now.isAfter(lastCreatedAt)) {
            now = lastCreatedAt.plus(1, ChronoUnit.MICROS);
        }
        return now;
    }

    // lock held
    private JobRecord writeStatus(String id, JobStatus expected, JobStatus status, String result) {
        try {
            return store.updateStatus(id, expected, status, result, clock.instant())
                    .orElseThrow(() -> diverged(id));
        } catch (StoreException e) {
            indexStale = true;
            throw e;
        }
    }

    // lock held
    private StoreException diverged(String id) {
        indexStale = true;
        return new StoreException("Job " + id + " changed in the store outside this queue");
    }

    private void notifyTerminal(JobRecord record) {
        switch (record.status()) {
            case COMPLETED -> listener.onJobCompleted(record.id(), record.result());
            case FAILED -> listener.onJobFailed(record.id(), record.result());
            case CANCELLED -> listener.onJobCancelled(record.id());
            default -> throw new IllegalStateException("Not a terminal status: " + record.status());
        }
    }

    /**
     * The job currently holding the single run slot. It keeps the slot until its
     * outcome is in the store.
     */
    private static final class ActiveJob {
        final JobRecord record;
        final CancellationFlag cancellation = new CancellationFlag();
        ExecutionOutcome outcome;

        ActiveJob(JobRecord record) {
            this.record = record;
        }
    }

    private final class Dispatcher implements JobDispatcher {

        @Override
        public boolean hasPendingCompletion() {
            synchronized (lock) {
                return active != null && active.outcome != null;
            }
        }

        @Override
        public Optional<Instant> retryPendingCompletion() {
            ActiveJob job;
            synchronized (lock) {
                job = active;
            }
            if (job == null || job.outcome == null) {
                return Optional.empty();
            }
            log.info("Retrying outcome write for job {}", job.record.id());
            return complete(job);
        }

        @Override
        public boolean isPaused() {
            return QueueManager.this.isPaused();
        }

        @Override
        public Optional<JobRecord> claimNext() {
            JobRecord started;
            synchronized (lock) {
                if (paused || active != null) {
                    return Optional.empty();
                }
                if (indexStale) {
                    rebuildIndex();
                }

                while (true) {
                    Optional<JobRecord> next = index.peekNext();
                    if (next.isEmpty()) {
                        return Optional.empty();
                    }
                    String id = next.get().id();

                    Optional<JobRecord> updated;
                    try {
                        updated = store.updateStatus(id, JobStatus.QUEUED, JobStatus.RUNNING, null, clock.instant());
                    } catch (StoreException e) {
                        indexStale = true;
                        throw e;
                    }

                    if (updated.isPresent()) {
                        index.remove(id);
                        started = updated.get();
                        active = new ActiveJob(started);
                        break;
                    }
                    log.warn("Job {} was not QUEUED in the store, rebuilding index", id);
                    rebuildIndex();
                }
            }

            log.info("Dispatching job {} ({}, {}, attempt {})",
                    started.id(), started.type(), started.priority(), started.attemptCount());
            listener.onJobStarted(started.id());
            return Optional.of(started);
        }

        @Override
        public Optional<Instant> runClaimed(BooleanSupplier shuttingDown) {
            ActiveJob job;
            synchronized (lock) {
                job = active;
            }
            if (job == null) {
                return Optional.empty();
            }

            ExecutionOutcome outcome = executor.execute(job.record, job.cancellation, shuttingDown);

            if (outcome.isAborted()) {
                synchronized (lock) {
                    active = null;
                }
                log.warn("Job {} interrupted by shutdown, left RUNNING for recovery", job.record.id());
                return Optional.empty();
            }

            synchronized (lock) {
                job.outcome = outcome;
            }
            return complete(job);
        }

        private Optional<Instant> complete(ActiveJob job) {
            String id = job.record.id();
            Instant at = clock.instant();
            JobRecord finished;

            synchronized (lock) {
                Optional<JobRecord> updated;
                try {
                    updated = store.updateStatus(id, JobStatus.RUNNING, job.outcome.status(),
                            job.outcome.result(), at);
                } catch (StoreException e) {
                    log.error("Failed to record {} for job {}, will retry", job.outcome.status(), id, e);
                    return Optional.empty();
                }

                active = null;
                if (updated.isEmpty()) {
                    indexStale = true;
                    log.warn("Job {} was no longer RUNNING in the store, outcome {} dropped",
                            id, job.outcome.status());
                    return Optional.of(at);
                }
                finished = updated.get();
            }

            log.info("Job {} {}", id, finished.status());
            notifyTerminal(finished);
            return Optional.of(at);
        }
    }
}
