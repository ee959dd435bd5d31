package lineup.queue.store;

import lineup.queue.error.StoreException;
import lineup.queue.model.JobPayload;
import lineup.queue.model.JobPriority;
import lineup.queue.model.JobRecord;
import lineup.queue.model.JobStatus;
import lineup.queue.repository.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * JDBC implementation of JobStore (durable mode).
 * Status changes lock the row, apply {@link JobRecord#transition} and write
 * back in one transaction, so a transition either fully lands or is absent.
 */
public class JdbcJobStore implements JobStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcJobStore.class);

    private static final String LISTING_ORDER = """
                ORDER BY
                    CASE status
                        WHEN 'RUNNING' THEN 0
                        WHEN 'QUEUED' THEN 1
                        WHEN 'COMPLETED' THEN 2
                        WHEN 'FAILED' THEN 3
                        WHEN 'CANCELLED' THEN 4
                    END,
                    priority, created_at, id
            """;

    private final Database db;
    private final boolean ownsDatabase;

    public JdbcJobStore(Database db) {
        this(db, false);
    }

    /**
     * @param ownsDatabase close the pool when this store is closed
     */
    public JdbcJobStore(Database db, boolean ownsDatabase) {
        this.db = db;
        this.ownsDatabase = ownsDatabase;
    }

    @Override
    public void insert(JobRecord record) {
        String sql = """
                    INSERT INTO jobs (id, job_type, payload, priority, status, attempt_count, result,
                                      created_at, updated_at, started_at, finished_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, record.id());
            ps.setString(2, record.type());
            ps.setBytes(3, record.payload().data());
            ps.setInt(4, record.priority().rank());
            ps.setString(5, record.status().name());
            ps.setInt(6, record.attemptCount());
            ps.setString(7, record.result());
            setTimestamp(ps, 8, record.createdAt());
            setTimestamp(ps, 9, record.updatedAt());
            setTimestamp(ps, 10, record.startedAt());
            setTimestamp(ps, 11, record.finishedAt());

            ps.executeUpdate();
            conn.commit();

            log.debug("Inserted job {} ({}, {})", record.id(), record.type(), record.priority());
        } catch (SQLException e) {
            throw new StoreException("Failed to insert job: " + record.id(), e);
        }
    }

    @Override
    public Optional<JobRecord> updateStatus(String id, JobStatus expected, JobStatus status, String result,
            Instant at) {
        String selectSql = "SELECT * FROM jobs WHERE id = ? FOR UPDATE";

        String updateSql = """
                    UPDATE jobs
                    SET status = ?, attempt_count = ?, result = ?, updated_at = ?, started_at = ?, finished_at = ?
                    WHERE id = ? AND status = ?
                """;

        try (Connection conn = db.getConnection()) {
            try {
                JobRecord current;
                try (PreparedStatement ps = conn.prepareStatement(selectSql)) {
                    ps.setString(1, id);
                    try (ResultSet rs = ps.executeQuery()) {
                        current = rs.next() ? mapRow(rs) : null;
                    }
                }

                if (current == null || current.status() != expected) {
                    conn.rollback();
                    log.debug("Job {} not moved to {}: expected {}, found {}", id, status, expected,
                            current != null ? current.status() : "nothing");
                    return Optional.empty();
                }

                JobRecord next = current.transition(status, result, at);

                try (PreparedStatement ps = conn.prepareStatement(updateSql)) {
                    ps.setString(1, next.status().name());
                    ps.setInt(2, next.attemptCount());
                    ps.setString(3, next.result());
                    setTimestamp(ps, 4, next.updatedAt());
                    setTimestamp(ps, 5, next.startedAt());
                    setTimestamp(ps, 6, next.finishedAt());
                    ps.setString(7, id);
                    ps.setString(8, expected.name());

                    if (ps.executeUpdate() == 0) {
                        conn.rollback();
                        return Optional.empty();
                    }
                }

                conn.commit();
                log.debug("Job {} moved {} -> {}", id, expected, status);
                return Optional.of(next);
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to update status of job: " + id, e);
        }
    }

    @Override
    public Optional<JobRecord> updatePriority(String id, JobPriority priority) {
        String sql = "UPDATE jobs SET priority = ? WHERE id = ? AND status = 'QUEUED'";

        try (Connection conn = db.getConnection()) {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                ps.setInt(1, priority.rank());
                ps.setString(2, id);

                if (ps.executeUpdate() == 0) {
                    conn.rollback();
                    return Optional.empty();
                }

                Optional<JobRecord> updated = findById(conn, id);
                conn.commit();
                log.debug("Job {} reprioritized to {}", id, priority);
                return updated;
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to update priority of job: " + id, e);
        }
    }

    @Override
    public Optional<JobRecord> get(String id) {
        try (Connection conn = db.getConnection()) {
            Optional<JobRecord> found = findById(conn, id);
            conn.commit();
            return found;
        } catch (SQLException e) {
            throw new StoreException("Failed to find job: " + id, e);
        }
    }

    @Override
    public List<JobRecord> scanByStatus(JobStatus status) {
        String sql = "SELECT * FROM jobs WHERE status = ? ORDER BY created_at, id";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, status.name());
            List<JobRecord> jobs = executeQuery(ps);
            conn.commit();
            return jobs;
        } catch (SQLException e) {
            throw new StoreException("Failed to find jobs by status: " + status, e);
        }
    }

    @Override
    public List<JobRecord> scanAll() {
        String sql = "SELECT * FROM jobs " + LISTING_ORDER;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            List<JobRecord> jobs = executeQuery(ps);
            conn.commit();
            return jobs;
        } catch (SQLException e) {
            throw new StoreException("Failed to list jobs", e);
        }
    }

    @Override
    public int deleteOlderThan(Set<JobStatus> statuses, Instant cutoff) {
        if (statuses.isEmpty())
            return 0;

        String placeholders = statuses.stream().map(s -> "?").collect(Collectors.joining(", "));
        String sql = "DELETE FROM jobs WHERE status IN (" + placeholders + ") AND updated_at < ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            int index = 1;
            for (JobStatus status : statuses) {
                ps.setString(index++, status.name());
            }
            setTimestamp(ps, index, cutoff);

            int deleted = ps.executeUpdate();
            conn.commit();

            if (deleted > 0) {
                log.debug("Deleted {} jobs in {} older than {}", deleted, statuses, cutoff);
            }
            return deleted;
        } catch (SQLException e) {
            throw new StoreException("Failed to delete old jobs", e);
        }
    }

    @Override
    public int countByStatus(JobStatus status) {
        String sql = "SELECT COUNT(*) FROM jobs WHERE status = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, status.name());
            int count = 0;
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    count = rs.getInt(1);
                }
            }
            conn.commit();
            return count;
        } catch (SQLException e) {
            throw new StoreException("Failed to count jobs", e);
        }
    }

    @Override
    public void close() {
        if (ownsDatabase) {
            db.close();
        }
    }

    // Helper methods

    private Optional<JobRecord> findById(Connection conn, String id) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("SELECT * FROM jobs WHERE id = ?")) {
            ps.setString(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
        }
        return Optional.empty();
    }

    private List<JobRecord> executeQuery(PreparedStatement ps) throws SQLException {
        List<JobRecord> results = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                results.add(mapRow(rs));
            }
        }
        return results;
    }

    private JobRecord mapRow(ResultSet rs) throws SQLException {
        try {
            return JobRecord.builder()
                    .id(rs.getString("id"))
                    .payload(JobPayload.of(rs.getString("job_type"), rs.getBytes("payload")))
                    .priority(JobPriority.fromRank(rs.getInt("priority")))
                    .status(JobStatus.valueOf(rs.getString("status")))
                    .attemptCount(rs.getInt("attempt_count"))
                    .result(rs.getString("result"))
                    .createdAt(getInstant(rs, "created_at"))
                    .updatedAt(getInstant(rs, "updated_at"))
                    .startedAt(getInstant(rs, "started_at"))
                    .finishedAt(getInstant(rs, "finished_at"))
                    .build();
        } catch (IllegalArgumentException e) {
            throw new SQLException("Corrupt job row: " + rs.getString("id"), e);
        }
    }

    private static Instant getInstant(ResultSet rs, String column) throws SQLException {
        OffsetDateTime value = rs.getObject(column, OffsetDateTime.class);
        return value != null ? value.toInstant() : null;
    }

    private static void setTimestamp(PreparedStatement ps, int index, Instant instant) throws SQLException {
        if (instant != null) {
            ps.setObject(index, OffsetDateTime.ofInstant(instant, ZoneOffset.UTC));
        } else {
            ps.setNull(index, Types.TIMESTAMP_WITH_TIMEZONE);
        }
    }
}
