package lineup.queue.executor;

import lineup.queue.error.JobCancelledException;
import lineup.queue.events.JobEventListener;

/**
 * Handed to a {@link JobHandler} for the duration of one run.
 */
public final class JobContext {

    private final String jobId;
    private final int attempt;
    private final CancellationFlag cancellation;
    private final JobEventListener listener;

    public JobContext(String jobId, int attempt, CancellationFlag cancellation, JobEventListener listener) {
        this.jobId = jobId;
        this.attempt = attempt;
        this.cancellation = cancellation;
        this.listener = listener;
    }

    public String jobId() {
        return jobId;
    }

    /**
     * 1 for the first run; higher when the job is re-run after a crash.
     */
    public int attempt() {
        return attempt;
    }

    /**
     * Whether cancel was requested for this job.
     */
    public boolean isCancelled() {
        return cancellation.isCancelled();
    }

    /**
     * @throws JobCancelledException if cancel was requested
     */
    public void throwIfCancelled() {
        if (cancellation.isCancelled()) {
            throw new JobCancelledException(jobId);
        }
    }

    /**
     * Report progress to the event listener.
     */
    public void reportProgress(int current, int total) {
        if (current < 0 || total < 0) {
            throw new IllegalArgumentException("progress must not be negative: " + current + "/" + total);
        }
        listener.onJobProgress(jobId, current, total);
    }

    /** Fraction done, 0 when total is 0. */
    public static double fraction(int current, int total) {
        return total > 0 ? (double) current / total : 0.0;
    }
}
