package lineup.queue.executor;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag. Created anew for each run of a job and shared
 * between the queue (which raises it) and the job's context (which reads it).
 */
public final class CancellationFlag {
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * @return true if this call raised the flag
     */
    public boolean requestCancel() {
        return cancelled.compareAndSet(false, true);
    }
}
