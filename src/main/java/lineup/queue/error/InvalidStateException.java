package lineup.queue.error;

import lineup.queue.model.JobStatus;

/**
 * The requested operation is not allowed for the job's current status.
 */
public class InvalidStateException extends QueueException {

    private final String jobId;
    private final JobStatus status;

    public InvalidStateException(String jobId, JobStatus status, String operation) {
        super("Cannot " + operation + " job " + jobId + " in status " + status);
        this.jobId = jobId;
        this.status = status;
    }

    public String jobId() {
        return jobId;
    }

    public JobStatus status() {
        return status;
    }
}
