package lineup.queue.scheduler;

import lineup.queue.model.JobPriority;
import lineup.queue.model.JobRecord;
import lineup.queue.model.JobStatus;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;

/**
 * In-memory view of QUEUED jobs: one age-ordered set per priority level.
 * Never persisted; rebuilt from the store at startup and whenever it may have
 * diverged. Not thread-safe, the owner guards it.
 */
public final class QueueIndex {

    private final Map<JobPriority, TreeSet<JobRecord>> levels = new EnumMap<>(JobPriority.class);
    private final Map<String, JobRecord> byId = new HashMap<>();

    public QueueIndex() {
        for (JobPriority priority : JobPriority.values()) {
            levels.put(priority, new TreeSet<>(JobRecord.BY_AGE));
        }
    }

    /**
     * Add a queued job. A record already present under the same id is replaced.
     */
    public void insert(JobRecord record) {
        if (record.status() != JobStatus.QUEUED) {
            throw new IllegalArgumentException("Only QUEUED jobs can be indexed: " + record);
        }
        remove(record.id());
        levels.get(record.priority()).add(record);
        byId.put(record.id(), record);
    }

    /**
     * @return true if the job was indexed
     */
    public boolean remove(String id) {
        JobRecord existing = byId.remove(id);
        if (existing == null) {
            return false;
        }
        levels.get(existing.priority()).remove(existing);
        return true;
    }

    /**
     * Oldest job of the highest non-empty priority level.
     */
    public Optional<JobRecord> peekNext() {
        for (JobPriority priority : JobPriority.values()) {
            TreeSet<JobRecord> level = levels.get(priority);
            if (!level.isEmpty()) {
                return Optional.of(level.first());
            }
        }
        return Optional.empty();
    }

    /**
     * Move a job to another level, keeping its original {@code createdAt} so it
     * lands in its age position among the jobs already there.
     *
     * @return true if the job was indexed
     */
    public boolean reorder(String id, JobPriority newPriority) {
        JobRecord existing = byId.get(id);
        if (existing == null) {
            return false;
        }
        if (existing.priority() != newPriority) {
            insert(existing.withPriority(newPriority));
        }
        return true;
    }

    /**
     * Replace the content with the given QUEUED records.
     */
    public void rebuild(Collection<JobRecord> queued) {
        clear();
        for (JobRecord record : queued) {
            insert(record);
        }
    }

    public void clear() {
        levels.values().forEach(TreeSet::clear);
        byId.clear();
    }

    public boolean contains(String id) {
        return byId.containsKey(id);
    }

    public int size() {
        return byId.size();
    }

    public int size(JobPriority priority) {
        return levels.get(priority).size();
    }

    public boolean isEmpty() {
        return byId.isEmpty();
    }

    /** Ids in dispatch order. */
    public List<String> snapshotIds() {
        List<String> ids = new ArrayList<>(byId.size());
        for (JobPriority priority : JobPriority.values()) {
            levels.get(priority).forEach(r -> ids.add(r.id()));
        }
        return ids;
    }
}
