package lineup.queue.scheduler;

import lineup.queue.model.JobPayload;
import lineup.queue.model.JobPriority;
import lineup.queue.model.JobRecord;
import lineup.queue.model.JobStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class QueueIndexTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    private QueueIndex index;

    @BeforeEach
    void setUp() {
        index = new QueueIndex();
    }

    private static JobRecord job(String id, JobPriority priority, long secondsAfterT0) {
        return JobRecord.builder()
                .id(id)
                .payload(JobPayload.ofText("echo", id))
                .priority(priority)
                .createdAt(T0.plusSeconds(secondsAfterT0))
                .build();
    }

    @Test
    void emptyIndexHasNothingNext() {
        assertTrue(index.peekNext().isEmpty());
        assertTrue(index.isEmpty());
    }

    @Test
    void highestLevelThenOldestWins() {
        index.insert(job("low-1", JobPriority.LOW, 0));
        index.insert(job("normal-2", JobPriority.NORMAL, 2));
        index.insert(job("normal-1", JobPriority.NORMAL, 1));

        assertEquals("normal-1", index.peekNext().orElseThrow().id());

        index.insert(job("high-1", JobPriority.HIGH, 10));
        assertEquals("high-1", index.peekNext().orElseThrow().id());
        assertEquals(List.of("high-1", "normal-1", "normal-2", "low-1"), index.snapshotIds());
    }

    @Test
    void removeDropsJob() {
        index.insert(job("a", JobPriority.NORMAL, 0));
        index.insert(job("b", JobPriority.NORMAL, 1));

        assertTrue(index.remove("a"));
        assertFalse(index.remove("a"));
        assertEquals("b", index.peekNext().orElseThrow().id());
        assertEquals(1, index.size());
    }

    @Test
    void reorderKeepsAgePositionInNewLevel() {
        index.insert(job("high-old", JobPriority.HIGH, 0));
        index.insert(job("high-new", JobPriority.HIGH, 20));
        index.insert(job("low-mid", JobPriority.LOW, 10));

        assertTrue(index.reorder("low-mid", JobPriority.HIGH));

        assertEquals(List.of("high-old", "low-mid", "high-new"), index.snapshotIds());
        assertEquals(3, index.size(JobPriority.HIGH));
        assertEquals(0, index.size(JobPriority.LOW));
        assertFalse(index.reorder("unknown", JobPriority.HIGH));
    }

    @Test
    void insertReplacesSameId() {
        index.insert(job("a", JobPriority.LOW, 0));
        index.insert(job("a", JobPriority.HIGH, 0));

        assertEquals(1, index.size());
        assertEquals(1, index.size(JobPriority.HIGH));
    }

    @Test
    void onlyQueuedJobsAreIndexed() {
        JobRecord running = job("a", JobPriority.LOW, 0).transition(JobStatus.RUNNING, null, T0);
        assertThrows(IllegalArgumentException.class, () -> index.insert(running));
    }

    @Test
    void rebuildReplacesContent() {
        index.insert(job("stale", JobPriority.HIGH, 0));

        index.rebuild(List.of(job("x", JobPriority.NORMAL, 5), job("y", JobPriority.NORMAL, 1)));

        assertFalse(index.contains("stale"));
        assertEquals(List.of("y", "x"), index.snapshotIds());
    }
}
