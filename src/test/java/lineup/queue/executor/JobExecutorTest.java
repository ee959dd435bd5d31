package lineup.queue.executor;

import lineup.queue.events.JobEventListener;
import lineup.queue.model.JobPayload;
import lineup.queue.model.JobRecord;
import lineup.queue.model.JobResult;
import lineup.queue.model.JobStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for mapping handler behaviour to outcomes.
 */
class JobExecutorTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    private JobHandlerRegistry handlers;
    private List<String> progress;
    private JobExecutor executor;

    @BeforeEach
    void setUp() {
        handlers = new JobHandlerRegistry();
        progress = new ArrayList<>();
        JobEventListener listener = new JobEventListener() {
            @Override
            public void onJobProgress(String jobId, int current, int total) {
                progress.add(jobId + ":" + current + "/" + total);
            }
        };
        executor = new JobExecutor(handlers, listener);
    }

    private static JobRecord running(String type) {
        return JobRecord.builder()
                .id("job-1")
                .payload(JobPayload.ofText(type, "hello"))
                .createdAt(T0)
                .build()
                .transition(JobStatus.RUNNING, null, T0);
    }

    private ExecutionOutcome run(String type) {
        return executor.execute(running(type), new CancellationFlag(), () -> false);
    }

    @Test
    void successWithOutput() {
        handlers.register("upper", (payload, ctx) -> JobResult.success(payload.asText().toUpperCase()));

        ExecutionOutcome outcome = run("upper");

        assertEquals(JobStatus.COMPLETED, outcome.status());
        assertEquals("HELLO", outcome.result());
    }

    @Test
    void nullResultCountsAsSuccess() {
        handlers.register("quiet", (payload, ctx) -> null);

        ExecutionOutcome outcome = run("quiet");

        assertEquals(JobStatus.COMPLETED, outcome.status());
        assertNull(outcome.result());
    }

    @Test
    void failureResult() {
        handlers.register("bad", (payload, ctx) -> JobResult.failure("model not loaded"));

        ExecutionOutcome outcome = run("bad");

        assertEquals(JobStatus.FAILED, outcome.status());
        assertEquals("model not loaded", outcome.result());
    }

    @Test
    void thrownExceptionFailsJob() {
        handlers.register("boom", (payload, ctx) -> {
            throw new IllegalStateException("out of memory");
        });
        handlers.register("npe", (payload, ctx) -> {
            throw new NullPointerException();
        });

        assertEquals(ExecutionOutcome.failed("out of memory"), run("boom"));
        assertEquals(ExecutionOutcome.failed("NullPointerException"), run("npe"));
    }

    @Test
    void errorsAreNotRecordedAsFailures() {
        handlers.register("fatal", (payload, ctx) -> {
            throw new StackOverflowError("too deep");
        });

        StackOverflowError error = assertThrows(StackOverflowError.class, () -> run("fatal"));
        assertEquals("too deep", error.getMessage());
    }

    @Test
    void missingHandlerFailsJob() {
        ExecutionOutcome outcome = run("unknown");

        assertEquals(JobStatus.FAILED, outcome.status());
        assertEquals("No handler registered for job type 'unknown'", outcome.result());
    }

    @Test
    void cooperativeCancellation() {
        handlers.register("polite", (payload, ctx) -> {
            ctx.throwIfCancelled();
            return JobResult.success();
        });
        CancellationFlag flag = new CancellationFlag();
        assertTrue(flag.requestCancel());
        assertFalse(flag.requestCancel());

        ExecutionOutcome outcome = executor.execute(running("polite"), flag, () -> false);

        assertEquals(JobStatus.CANCELLED, outcome.status());
    }

    @Test
    void ignoredCancellationKeepsNaturalOutcome() {
        handlers.register("stubborn", (payload, ctx) -> JobResult.success("done anyway"));
        CancellationFlag flag = new CancellationFlag();
        flag.requestCancel();

        ExecutionOutcome outcome = executor.execute(running("stubborn"), flag, () -> false);

        assertEquals(ExecutionOutcome.completed("done anyway"), outcome);
    }

    @Test
    void interruptDuringShutdownAbortsRun() {
        handlers.register("sleepy", (payload, ctx) -> {
            Thread.currentThread().interrupt();
            Thread.sleep(1000);
            return JobResult.success();
        });

        ExecutionOutcome outcome = executor.execute(running("sleepy"), new CancellationFlag(), () -> true);

        assertTrue(outcome.isAborted());
        assertTrue(Thread.interrupted());
    }

    @Test
    void interruptOutsideShutdownFailsAndIsCleared() {
        handlers.register("sleepy", (payload, ctx) -> {
            Thread.currentThread().interrupt();
            Thread.sleep(1000);
            return JobResult.success();
        });

        ExecutionOutcome outcome = run("sleepy");

        assertEquals(JobStatus.FAILED, outcome.status());
        assertFalse(Thread.currentThread().isInterrupted());
    }

    @Test
    void progressIsForwarded() {
        handlers.register("steps", (payload, ctx) -> {
            for (int i = 1; i <= 3; i++) {
                ctx.reportProgress(i, 3);
            }
            assertEquals(1, ctx.attempt());
            return JobResult.success();
        });

        run("steps");

        assertEquals(List.of("job-1:1/3", "job-1:2/3", "job-1:3/3"), progress);
        assertEquals(0.5, JobContext.fraction(1, 2));
        assertEquals(0.0, JobContext.fraction(3, 0));
    }

    @Test
    void registryRejectsDuplicates() {
        handlers.register("x", (payload, ctx) -> null);

        assertThrows(IllegalArgumentException.class, () -> handlers.register("x", (payload, ctx) -> null));
        assertThrows(IllegalArgumentException.class, () -> handlers.register("", (payload, ctx) -> null));
        assertTrue(handlers.supports("x"));
        assertFalse(handlers.supports("y"));
    }
}
