package lineup.queue.model;

import lineup.queue.error.InvalidStateException;

import java.time.Instant;
import java.util.Comparator;
import java.util.Objects;

/**
 * Immutable persisted unit of work.
 * Every change produces a new instance, so a record handed out by the queue
 * can be shared freely.
 */
public final class JobRecord {

    /** FIFO order within a priority level; id breaks exact timestamp ties. */
    public static final Comparator<JobRecord> BY_AGE =
            Comparator.comparing(JobRecord::createdAt).thenComparing(JobRecord::id);

    /** Dispatch order: highest priority first, then oldest. */
    public static final Comparator<JobRecord> DISPATCH_ORDER =
            Comparator.comparingInt((JobRecord r) -> r.priority().rank()).thenComparing(BY_AGE);

    /** Listing order: running, queued, completed, failed, cancelled; then dispatch order. */
    public static final Comparator<JobRecord> LISTING_ORDER =
            Comparator.comparingInt((JobRecord r) -> listingRank(r.status())).thenComparing(DISPATCH_ORDER);

    private final String id;
    private final JobPayload payload;
    private final JobPriority priority;
    private final JobStatus status;
    private final Instant createdAt;
    private final Instant updatedAt;
    private final Instant startedAt;
    private final Instant finishedAt;
    private final String result; // output on COMPLETED, error text on FAILED
    private final int attemptCount;

    private JobRecord(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.payload = Objects.requireNonNull(builder.payload, "payload is required");
        this.priority = Objects.requireNonNull(builder.priority, "priority is required");
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.createdAt = Objects.requireNonNull(builder.createdAt, "createdAt is required");
        this.updatedAt = builder.updatedAt != null ? builder.updatedAt : builder.createdAt;
        this.startedAt = builder.startedAt;
        this.finishedAt = builder.finishedAt;
        this.result = builder.result;
        this.attemptCount = builder.attemptCount;
    }

    public String id() {
        return id;
    }

    public JobPayload payload() {
        return payload;
    }

    /** Type tag of the payload, used to pick the handler. */
    public String type() {
        return payload.type();
    }

    public JobPriority priority() {
        return priority;
    }

    public JobStatus status() {
        return status;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant updatedAt() {
        return updatedAt;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public Instant finishedAt() {
        return finishedAt;
    }

    public String result() {
        return result;
    }

    public int attemptCount() {
        return attemptCount;
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    /** True if the job was started more than once, i.e. survived a crash mid-run. */
    public boolean wasInterrupted() {
        return attemptCount > 1 || (status == JobStatus.QUEUED && attemptCount > 0);
    }

    /**
     * Apply a status transition.
     * QUEUED to RUNNING bumps the attempt count; a terminal transition records
     * {@code result} and the finish time; RUNNING to QUEUED (recovery) clears the
     * start time and keeps everything else.
     *
     * @throws InvalidStateException if the state machine has no such edge
     */
    public JobRecord transition(JobStatus next, String result, Instant at) {
        if (!status.canTransitionTo(next)) {
            throw new InvalidStateException(id, status, "move to " + next + ":");
        }
        Builder b = toBuilder().status(next).updatedAt(at);
        switch (next) {
            case RUNNING -> b.attemptCount(attemptCount + 1).startedAt(at).result(null);
            case QUEUED -> b.startedAt(null).result(null);
            case COMPLETED, FAILED, CANCELLED -> b.finishedAt(at).result(result);
        }
        return b.build();
    }

    /**
     * Change priority. Only queued jobs can be reordered; {@code createdAt} is kept.
     */
    public JobRecord withPriority(JobPriority newPriority) {
        if (status != JobStatus.QUEUED) {
            throw new InvalidStateException(id, status, "reorder");
        }
        return toBuilder().priority(newPriority).build();
    }

    private static int listingRank(JobStatus status) {
        return switch (status) {
            case RUNNING -> 0;
            case QUEUED -> 1;
            case COMPLETED -> 2;
            case FAILED -> 3;
            case CANCELLED -> 4;
        };
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .payload(payload)
                .priority(priority)
                .status(status)
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .startedAt(startedAt)
                .finishedAt(finishedAt)
                .result(result)
                .attemptCount(attemptCount);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private JobPayload payload;
        private JobPriority priority = JobPriority.NORMAL;
        private JobStatus status = JobStatus.QUEUED;
        private Instant createdAt;
        private Instant updatedAt;
        private Instant startedAt;
        private Instant finishedAt;
        private String result;
        private int attemptCount = 0;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder payload(JobPayload payload) {
            this.payload = payload;
            return this;
        }

        public Builder priority(JobPriority priority) {
            this.priority = priority;
            return this;
        }

        public Builder status(JobStatus status) {
            this.status = status;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Builder startedAt(Instant startedAt) {
            this.startedAt = startedAt;
            return this;
        }

        public Builder finishedAt(Instant finishedAt) {
            this.finishedAt = finishedAt;
            return this;
        }

        public Builder result(String result) {
            this.result = result;
            return this;
        }

        public Builder attemptCount(int attemptCount) {
            this.attemptCount = attemptCount;
            return this;
        }

        public JobRecord build() {
            return new JobRecord(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof JobRecord job))
            return false;
        return Objects.equals(id, job.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "JobRecord{id='" + id + "', type='" + payload.type() + "', priority=" + priority
                + ", status=" + status + ", attempts=" + attemptCount + "}";
    }
}
