package lineup.queue.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Job lifecycle status.
 */
public enum JobStatus {
    /** Waiting in the queue to be dispatched */
    QUEUED,
    /** Dispatched to the executor; at most one job holds this status */
    RUNNING,
    /** Handler returned successfully */
    COMPLETED,
    /** Handler reported an error */
    FAILED,
    /** Cancelled by a caller before or during execution */
    CANCELLED;

    /** Statuses that can never be left except by pruning. */
    public static final Set<JobStatus> TERMINAL = EnumSet.of(COMPLETED, FAILED, CANCELLED);

    public boolean isTerminal() {
        return TERMINAL.contains(this);
    }

    /**
     * Check whether the state machine allows moving from this status to {@code next}.
     * RUNNING to QUEUED is only used by crash recovery.
     */
    public boolean canTransitionTo(JobStatus next) {
        return switch (this) {
            case QUEUED -> next == RUNNING || next == CANCELLED;
            case RUNNING -> next == COMPLETED || next == FAILED || next == CANCELLED || next == QUEUED;
            case COMPLETED, FAILED, CANCELLED -> false;
        };
    }
}
