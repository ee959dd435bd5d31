package lineup.queue.model;

/**
 * Outcome returned by a job handler.
 * A failure result is recorded the same way as a thrown exception.
 */
public record JobResult(boolean succeeded, String output, String error) {

    public static JobResult success() {
        return new JobResult(true, null, null);
    }

    public static JobResult success(String output) {
        return new JobResult(true, output, null);
    }

    public static JobResult failure(String error) {
        return new JobResult(false, null, error);
    }
}
