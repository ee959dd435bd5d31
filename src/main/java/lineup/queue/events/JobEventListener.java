package lineup.queue.events;

/**
 * Receives job lifecycle notifications.
 * <p>
 * Notifications are fire-and-forget: return values and exceptions are ignored
 * by the queue. A status notification is only sent once the matching
 * transition has been written to the store. Methods are called from the queue
 * threads (progress from the handler's thread) and must not block for long.
 */
public interface JobEventListener {

    /** Listener that ignores everything. */
    JobEventListener NO_OP = new JobEventListener() {
    };

    default void onJobStarted(String jobId) {
    }

    default void onJobProgress(String jobId, int current, int total) {
    }

    /**
     * @param output handler output, may be null
     */
    default void onJobCompleted(String jobId, String output) {
    }

    default void onJobFailed(String jobId, String error) {
    }

    default void onJobCancelled(String jobId) {
    }
}
