package lineup.queue.model;

/**
 * Result of cancelling a job.
 */
public enum CancelResult {
    /** Job was queued and is now CANCELLED */
    CANCELLED,

    /**
     * Job is running; the cooperative flag was raised. The final status depends
     * on whether the handler observes it.
     */
    CANCEL_REQUESTED,

    /** Job was already in a terminal state - idempotent no-op */
    ALREADY_TERMINAL
}
