package lineup.queue.executor;

import lineup.queue.error.JobCancelledException;
import lineup.queue.events.JobEventListener;
import lineup.queue.model.JobRecord;
import lineup.queue.model.JobResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.BooleanSupplier;

/**
 * Runs one handler invocation and maps how it ended to an outcome.
 * Writing the outcome to the store and the terminal notification are left to
 * the caller, which holds the queue lock for the write.
 */
public class JobExecutor {

    private static final Logger log = LoggerFactory.getLogger(JobExecutor.class);

    private final JobHandlerRegistry handlers;
    private final JobEventListener listener;

    public JobExecutor(JobHandlerRegistry handlers, JobEventListener listener) {
        this.handlers = handlers;
        this.listener = listener;
    }

    /**
     * Execute a RUNNING job on the calling thread.
     *
     * @param job          the job, already marked RUNNING
     * @param cancellation flag raised by cancel for this run
     * @param shuttingDown true once the queue is closing; an interrupt seen then
     *                     aborts the run instead of failing the job
     */
    public ExecutionOutcome execute(JobRecord job, CancellationFlag cancellation, BooleanSupplier shuttingDown) {
        JobHandler handler = handlers.find(job.type()).orElse(null);
        if (handler == null) {
            log.warn("No handler registered for job {} of type '{}'", job.id(), job.type());
            return ExecutionOutcome.failed("No handler registered for job type '" + job.type() + "'");
        }

        JobContext context = new JobContext(job.id(), job.attemptCount(), cancellation, listener);
        long started = System.nanoTime();

        try {
            JobResult result = handler.execute(job.payload(), context);
            long elapsedMs = (System.nanoTime() - started) / 1_000_000;

            if (result == null || result.succeeded()) {
                log.debug("Job {} handler returned success in {}ms", job.id(), elapsedMs);
                return ExecutionOutcome.completed(result != null ? result.output() : null);
            }
            String error = result.error() != null ? result.error() : "Unknown error";
            log.debug("Job {} handler returned failure in {}ms: {}", job.id(), elapsedMs, error);
            return ExecutionOutcome.failed(error);

        } catch (JobCancelledException e) {
            log.debug("Job {} handler stopped on cancellation", job.id());
            return ExecutionOutcome.cancelled();

        } catch (InterruptedException e) {
            if (shuttingDown.getAsBoolean()) {
                Thread.currentThread().interrupt();
                log.warn("Job {} interrupted by shutdown", job.id());
                return ExecutionOutcome.aborted();
            }
            return ExecutionOutcome.failed(describe(e));

        } catch (Exception e) {
            if (shuttingDown.getAsBoolean() && Thread.currentThread().isInterrupted()) {
                log.warn("Job {} interrupted by shutdown", job.id(), e);
                return ExecutionOutcome.aborted();
            }
            log.warn("Job {} handler threw", job.id(), e);
            return ExecutionOutcome.failed(describe(e));
        } finally {
            // handlers share the scheduler thread; drop stray interrupts unless closing
            if (!shuttingDown.getAsBoolean()) {
                Thread.interrupted();
            }
        }
    }

    private static String describe(Exception e) {
        String message = e.getMessage();
        return message != null && !message.isBlank()
                ? message
                : e.getClass().getSimpleName();
    }
}
