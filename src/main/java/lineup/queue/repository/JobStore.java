package lineup.queue.repository;

import lineup.queue.model.JobPriority;
import lineup.queue.model.JobRecord;
import lineup.queue.model.JobStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Persistence contract for job records.
 * Implementations: a JDBC store (durable) and an in-memory map (non-durable).
 * Both are the only place that touches storage, and both raise
 * {@link lineup.queue.error.StoreException} on I/O or serialization failure.
 * Every single-record write is atomic: readers never see a half-applied change.
 */
public interface JobStore extends AutoCloseable {

    /**
     * Insert a new job record.
     *
     * @param record the record to insert, normally QUEUED
     */
    void insert(JobRecord record);

    /**
     * Atomically move a job from {@code expected} to {@code status}.
     * Attempt count, start and finish times are maintained as described by
     * {@link JobRecord#transition}.
     *
     * @param id       the job ID
     * @param expected the status the job must currently have
     * @param status   the new status
     * @param result   output or error text for terminal statuses, otherwise null
     * @param at       transition time, becomes {@code updatedAt}
     * @return the updated record, or empty if the job is missing or not in {@code expected}
     */
    Optional<JobRecord> updateStatus(String id, JobStatus expected, JobStatus status, String result, Instant at);

    /**
     * Change priority of a QUEUED job.
     *
     * @return the updated record, or empty if the job is missing or not QUEUED
     */
    Optional<JobRecord> updatePriority(String id, JobPriority priority);

    /**
     * Find a job by ID.
     */
    Optional<JobRecord> get(String id);

    /**
     * All jobs with the given status, oldest first.
     */
    List<JobRecord> scanByStatus(JobStatus status);

    /**
     * All jobs: running, then queued by priority and age, then terminal ones.
     */
    List<JobRecord> scanAll();

    /**
     * Delete jobs in one of {@code statuses} whose last transition is before {@code cutoff}.
     *
     * @return number of deleted records
     */
    int deleteOlderThan(Set<JobStatus> statuses, Instant cutoff);

    /**
     * Count jobs with the given status.
     */
    int countByStatus(JobStatus status);

    @Override
    default void close() {
    }
}
