package lineup.queue.executor;

import lineup.queue.model.JobStatus;

/**
 * What happened to one run of a handler.
 *
 * @param status terminal status to record, or null when the run was aborted by
 *               shutdown and the job must stay RUNNING for crash recovery
 * @param result output for COMPLETED, error text for FAILED
 */
public record ExecutionOutcome(JobStatus status, String result) {

    public static ExecutionOutcome completed(String output) {
        return new ExecutionOutcome(JobStatus.COMPLETED, output);
    }

    public static ExecutionOutcome failed(String error) {
        return new ExecutionOutcome(JobStatus.FAILED, error);
    }

    public static ExecutionOutcome cancelled() {
        return new ExecutionOutcome(JobStatus.CANCELLED, null);
    }

    public static ExecutionOutcome aborted() {
        return new ExecutionOutcome(null, null);
    }

    public boolean isAborted() {
        return status == null;
    }
}
