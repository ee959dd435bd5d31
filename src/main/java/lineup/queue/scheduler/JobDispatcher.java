package lineup.queue.scheduler;

import lineup.queue.model.JobRecord;

import java.time.Instant;
import java.util.Optional;
import java.util.function.BooleanSupplier;

/**
 * What the scheduler loop needs from the queue that owns the jobs.
 * Every call is made from the loop thread.
 */
public interface JobDispatcher {

    /**
     * @return true if a finished run is still waiting for its outcome to be
     *         written to the store
     */
    boolean hasPendingCompletion();

    /**
     * Try again to write a pending outcome.
     *
     * @return the completion instant once written, empty if it failed again
     */
    Optional<Instant> retryPendingCompletion();

    /**
     * @return true while dispatch of new jobs is paused
     */
    boolean isPaused();

    /**
     * Take the next job in dispatch order and mark it RUNNING. The pause state
     * is checked again under the same lock as the claim.
     *
     * @return the started job, empty if nothing is queued or dispatch is paused
     * @throws lineup.queue.error.StoreException if the store rejects the claim
     */
    Optional<JobRecord> claimNext();

    /**
     * Run the claimed job's handler on the calling thread and record how it ended.
     *
     * @param shuttingDown true once the loop is stopping
     * @return the completion instant, empty if the outcome could not be written
     *         yet or the run was aborted by shutdown
     */
    Optional<Instant> runClaimed(BooleanSupplier shuttingDown);
}
