package lineup.queue.store;

import lineup.queue.error.StoreException;
import lineup.queue.model.JobPriority;
import lineup.queue.model.JobRecord;
import lineup.queue.model.JobStatus;
import lineup.queue.repository.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Non-durable JobStore backed by a map. Records are immutable and replaced
 * whole under the store monitor, so readers never observe a partial update.
 */
public class InMemoryJobStore implements JobStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryJobStore.class);

    private final Map<String, JobRecord> jobs = new HashMap<>();

    @Override
    public synchronized void insert(JobRecord record) {
        if (jobs.containsKey(record.id())) {
            throw new StoreException("Duplicate job id: " + record.id());
        }
        jobs.put(record.id(), record);
        log.debug("Inserted job {} ({}, {})", record.id(), record.type(), record.priority());
    }

    @Override
    public synchronized Optional<JobRecord> updateStatus(String id, JobStatus expected, JobStatus status,
            String result, Instant at) {
        JobRecord current = jobs.get(id);
        if (current == null || current.status() != expected) {
            return Optional.empty();
        }
        JobRecord next = current.transition(status, result, at);
        jobs.put(id, next);
        log.debug("Job {} moved {} -> {}", id, expected, status);
        return Optional.of(next);
    }

    @Override
    public synchronized Optional<JobRecord> updatePriority(String id, JobPriority priority) {
        JobRecord current = jobs.get(id);
        if (current == null || current.status() != JobStatus.QUEUED) {
            return Optional.empty();
        }
        JobRecord next = current.withPriority(priority);
        jobs.put(id, next);
        return Optional.of(next);
    }

    @Override
    public synchronized Optional<JobRecord> get(String id) {
        return Optional.ofNullable(jobs.get(id));
    }

    @Override
    public synchronized List<JobRecord> scanByStatus(JobStatus status) {
        return jobs.values().stream()
                .filter(r -> r.status() == status)
                .sorted(JobRecord.BY_AGE)
                .toList();
    }

    @Override
    public synchronized List<JobRecord> scanAll() {
        return jobs.values().stream()
                .sorted(JobRecord.LISTING_ORDER)
                .toList();
    }

    @Override
    public synchronized int deleteOlderThan(Set<JobStatus> statuses, Instant cutoff) {
        int before = jobs.size();
        jobs.values().removeIf(r -> statuses.contains(r.status()) && r.updatedAt().isBefore(cutoff));
        return before - jobs.size();
    }

    @Override
    public synchronized int countByStatus(JobStatus status) {
        return (int) jobs.values().stream().filter(r -> r.status() == status).count();
    }
}
