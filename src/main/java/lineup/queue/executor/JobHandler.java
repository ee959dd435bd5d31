package lineup.queue.executor;

import lineup.queue.model.JobPayload;
import lineup.queue.model.JobResult;

/**
 * Executes jobs of one payload type.
 * <p>
 * Called on the queue's executor thread, outside any queue lock, so it may run
 * for as long as the work takes. Long handlers should poll
 * {@link JobContext#isCancelled()} (or call {@link JobContext#throwIfCancelled()})
 * to honour cancellation.
 */
@FunctionalInterface
public interface JobHandler {

    /**
     * @return the outcome; {@link JobResult#failure(String)} and any thrown
     *         exception both mark the job FAILED, while
     *         {@link lineup.queue.error.JobCancelledException} marks it CANCELLED
     */
    JobResult execute(JobPayload payload, JobContext context) throws Exception;
}
