package lineup.queue.error;

/**
 * Thrown by a job handler to report that it stopped because cancellation was
 * requested. The executor maps it to CANCELLED rather than FAILED.
 */
public class JobCancelledException extends QueueException {

    public JobCancelledException(String jobId) {
        super("Job was cancelled: " + jobId);
    }
}
