package lineup.queue.scheduler;

import lineup.queue.model.JobRecord;
import lineup.queue.model.JobStatus;
import lineup.queue.repository.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * Startup pass that requeues jobs left RUNNING by a process that died mid-run.
 *
 * Runs once, before the scheduler loop polls. A RUNNING record found at that
 * point cannot have a live handler behind it, so each one is moved back to
 * QUEUED. {@code createdAt} and {@code attemptCount} are kept, which puts the
 * job back at its original place in line and leaves the interrupted attempt
 * counted.
 */
public class InterruptedJobRecovery {

    private static final Logger log = LoggerFactory.getLogger(InterruptedJobRecovery.class);

    private final JobStore store;
    private final Clock clock;

    public InterruptedJobRecovery(JobStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    /**
     * Requeue every RUNNING job.
     *
     * @return number of jobs requeued
     * @throws lineup.queue.error.StoreException if the store cannot be read or written
     */
    public int recover() {
        List<JobRecord> interrupted = store.scanByStatus(JobStatus.RUNNING);

        if (interrupted.isEmpty()) {
            log.debug("No interrupted jobs found");
            return 0;
        }

        int requeued = 0;
        for (JobRecord job : interrupted) {
            Optional<JobRecord> updated = store.updateStatus(
                    job.id(), JobStatus.RUNNING, JobStatus.QUEUED, null, clock.instant());
            if (updated.isPresent()) {
                requeued++;
                log.info("Requeued job {} ({}) interrupted on attempt {}",
                        job.id(), job.type(), job.attemptCount());
            } else {
                log.warn("Job {} changed status during recovery, left as is", job.id());
            }
        }

        log.info("Crash recovery: {} of {} interrupted jobs requeued", requeued, interrupted.size());
        return requeued;
    }
}
