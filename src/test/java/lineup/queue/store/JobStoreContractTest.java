package lineup.queue.store;

import lineup.queue.model.JobPayload;
import lineup.queue.model.JobPriority;
import lineup.queue.model.JobRecord;
import lineup.queue.model.JobStatus;
import lineup.queue.repository.JobStore;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Behaviour every JobStore must share, run against each implementation.
 */
abstract class JobStoreContractTest {

    protected static final Instant T0 = Instant.parse("2024-05-01T10:00:00.123456Z");

    protected abstract JobStore store();

    protected static JobRecord job(String id, JobPriority priority, Instant createdAt) {
        return JobRecord.builder()
                .id(id)
                .payload(JobPayload.of("render", new byte[] { 1, 2, (byte) 0xff }))
                .priority(priority)
                .createdAt(createdAt)
                .build();
    }

    @Test
    void insertAndGet() {
        store().insert(job("job-1", JobPriority.HIGH, T0));

        JobRecord found = store().get("job-1").orElseThrow();
        assertEquals(JobStatus.QUEUED, found.status());
        assertEquals(JobPriority.HIGH, found.priority());
        assertEquals(T0, found.createdAt());
        assertEquals(T0, found.updatedAt());
        assertEquals("render", found.type());
        assertArrayEquals(new byte[] { 1, 2, (byte) 0xff }, found.payload().data());
        assertTrue(store().get("missing").isEmpty());
    }

    @Test
    void updateStatusAppliesTransition() {
        store().insert(job("job-1", JobPriority.NORMAL, T0));

        JobRecord running = store().updateStatus("job-1", JobStatus.QUEUED, JobStatus.RUNNING, null,
                T0.plusSeconds(1)).orElseThrow();
        assertEquals(1, running.attemptCount());

        JobRecord done = store().updateStatus("job-1", JobStatus.RUNNING, JobStatus.COMPLETED, "ok",
                T0.plusSeconds(2)).orElseThrow();
        assertEquals("ok", done.result());

        JobRecord reread = store().get("job-1").orElseThrow();
        assertEquals(JobStatus.COMPLETED, reread.status());
        assertEquals(1, reread.attemptCount());
        assertEquals("ok", reread.result());
        assertEquals(T0.plusSeconds(1), reread.startedAt());
        assertEquals(T0.plusSeconds(2), reread.finishedAt());
        assertEquals(T0.plusSeconds(2), reread.updatedAt());
        assertEquals(T0, reread.createdAt());
    }

    @Test
    void updateStatusRejectsWrongExpectedStatus() {
        store().insert(job("job-1", JobPriority.NORMAL, T0));

        Optional<JobRecord> result = store().updateStatus("job-1", JobStatus.RUNNING, JobStatus.COMPLETED,
                null, T0.plusSeconds(1));

        assertTrue(result.isEmpty());
        assertEquals(JobStatus.QUEUED, store().get("job-1").orElseThrow().status());
        assertTrue(store().updateStatus("missing", JobStatus.QUEUED, JobStatus.RUNNING, null, T0).isEmpty());
    }

    @Test
    void updatePriorityOnlyWhileQueued() {
        store().insert(job("job-1", JobPriority.LOW, T0));
        store().insert(job("job-2", JobPriority.LOW, T0.plusSeconds(1)));
        store().updateStatus("job-2", JobStatus.QUEUED, JobStatus.RUNNING, null, T0.plusSeconds(2));

        JobRecord raised = store().updatePriority("job-1", JobPriority.HIGH).orElseThrow();
        assertEquals(JobPriority.HIGH, raised.priority());
        assertEquals(T0, raised.createdAt());

        assertTrue(store().updatePriority("job-2", JobPriority.HIGH).isEmpty());
        assertEquals(JobPriority.LOW, store().get("job-2").orElseThrow().priority());
    }

    @Test
    void scanByStatusIsOldestFirst() {
        store().insert(job("job-b", JobPriority.HIGH, T0.plusSeconds(2)));
        store().insert(job("job-a", JobPriority.LOW, T0));
        store().insert(job("job-c", JobPriority.NORMAL, T0.plusSeconds(1)));

        List<String> ids = store().scanByStatus(JobStatus.QUEUED).stream().map(JobRecord::id).toList();

        assertEquals(List.of("job-a", "job-c", "job-b"), ids);
        assertTrue(store().scanByStatus(JobStatus.RUNNING).isEmpty());
    }

    @Test
    void scanAllUsesListingOrder() {
        store().insert(job("queued-low", JobPriority.LOW, T0));
        store().insert(job("queued-high", JobPriority.HIGH, T0.plusSeconds(1)));
        store().insert(job("failed", JobPriority.HIGH, T0.plusSeconds(2)));
        store().insert(job("running", JobPriority.LOW, T0.plusSeconds(3)));
        store().updateStatus("failed", JobStatus.QUEUED, JobStatus.RUNNING, null, T0.plusSeconds(4));
        store().updateStatus("failed", JobStatus.RUNNING, JobStatus.FAILED, "x", T0.plusSeconds(5));
        store().updateStatus("running", JobStatus.QUEUED, JobStatus.RUNNING, null, T0.plusSeconds(6));

        List<String> ids = store().scanAll().stream().map(JobRecord::id).toList();

        assertEquals(List.of("running", "queued-high", "queued-low", "failed"), ids);
    }

    @Test
    void deleteOlderThanOnlyTouchesGivenStatuses() {
        store().insert(job("old-done", JobPriority.NORMAL, T0));
        store().insert(job("old-queued", JobPriority.NORMAL, T0.plusSeconds(1)));
        store().insert(job("new-done", JobPriority.NORMAL, T0.plusSeconds(2)));
        store().updateStatus("old-done", JobStatus.QUEUED, JobStatus.CANCELLED, null, T0.plusSeconds(10));
        store().updateStatus("new-done", JobStatus.QUEUED, JobStatus.CANCELLED, null, T0.plusSeconds(100));

        int deleted = store().deleteOlderThan(JobStatus.TERMINAL, T0.plusSeconds(50));

        assertEquals(1, deleted);
        assertTrue(store().get("old-done").isEmpty());
        assertTrue(store().get("old-queued").isPresent());
        assertTrue(store().get("new-done").isPresent());
        assertEquals(0, store().deleteOlderThan(EnumSet.noneOf(JobStatus.class), T0.plusSeconds(500)));
    }

    @Test
    void deleteOlderThanRemovesEveryFinishedStatusButNeverRunning() {
        store().insert(job("old-completed", JobPriority.NORMAL, T0));
        store().insert(job("old-failed", JobPriority.NORMAL, T0.plusSeconds(1)));
        store().insert(job("old-cancelled", JobPriority.NORMAL, T0.plusSeconds(2)));
        store().insert(job("old-running", JobPriority.HIGH, T0.plusSeconds(3)));
        store().insert(job("new-failed", JobPriority.LOW, T0.plusSeconds(4)));

        store().updateStatus("old-completed", JobStatus.QUEUED, JobStatus.RUNNING, null, T0.plusSeconds(5));
        store().updateStatus("old-completed", JobStatus.RUNNING, JobStatus.COMPLETED, "ok", T0.plusSeconds(6));
        store().updateStatus("old-failed", JobStatus.QUEUED, JobStatus.RUNNING, null, T0.plusSeconds(7));
        store().updateStatus("old-failed", JobStatus.RUNNING, JobStatus.FAILED, "boom", T0.plusSeconds(8));
        store().updateStatus("old-cancelled", JobStatus.QUEUED, JobStatus.CANCELLED, null, T0.plusSeconds(9));
        store().updateStatus("old-running", JobStatus.QUEUED, JobStatus.RUNNING, null, T0.plusSeconds(10));
        store().updateStatus("new-failed", JobStatus.QUEUED, JobStatus.RUNNING, null, T0.plusSeconds(11));
        store().updateStatus("new-failed", JobStatus.RUNNING, JobStatus.FAILED, "late", T0.plusSeconds(100));

        int deleted = store().deleteOlderThan(JobStatus.TERMINAL, T0.plusSeconds(50));

        assertEquals(3, deleted);
        assertTrue(store().get("old-completed").isEmpty());
        assertTrue(store().get("old-failed").isEmpty());
        assertTrue(store().get("old-cancelled").isEmpty());
        assertEquals(JobStatus.RUNNING, store().get("old-running").orElseThrow().status());
        assertEquals(JobStatus.FAILED, store().get("new-failed").orElseThrow().status());

        // even a cutoff far in the future leaves the running record alone
        assertEquals(1, store().deleteOlderThan(JobStatus.TERMINAL, T0.plusSeconds(100_000)));
        assertEquals(List.of("old-running"), store().scanAll().stream().map(JobRecord::id).toList());
    }

    @Test
    void countByStatus() {
        store().insert(job("job-1", JobPriority.NORMAL, T0));
        store().insert(job("job-2", JobPriority.NORMAL, T0.plusSeconds(1)));
        store().updateStatus("job-2", JobStatus.QUEUED, JobStatus.RUNNING, null, T0.plusSeconds(2));

        assertEquals(1, store().countByStatus(JobStatus.QUEUED));
        assertEquals(1, store().countByStatus(JobStatus.RUNNING));
        assertEquals(0, store().countByStatus(JobStatus.FAILED));
    }
}
