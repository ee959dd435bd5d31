package lineup.queue.store;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import lineup.queue.config.QueueConfig;
import lineup.queue.error.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Database connection pool and schema management.
 * Uses HikariCP for connection pooling; connections are handed out with
 * auto-commit off so every store operation commits exactly once.
 */
public final class Database implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Database.class);

    private final HikariDataSource dataSource;

    public Database(QueueConfig config) {
        this(config.databaseUrl(), config.databasePoolSize());
    }

    public Database(String jdbcUrl, int poolSize) {
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbcUrl);
        hikariConfig.setMaximumPoolSize(poolSize);
        hikariConfig.setMinimumIdle(1);
        hikariConfig.setConnectionTimeout(5000);
        hikariConfig.setIdleTimeout(300000);
        hikariConfig.setPoolName("lineup-db-pool");
        hikariConfig.setAutoCommit(false);

        this.dataSource = new HikariDataSource(hikariConfig);

        log.info("Database pool initialized: {}", jdbcUrl);

        try {
            initSchema();
        } catch (StoreException e) {
            dataSource.close();
            throw e;
        }
    }

    /**
     * Get a connection from the pool.
     * Caller is responsible for closing the connection.
     */
    public Connection getConnection() throws SQLException {
        return dataSource.getConnection();
    }

    public boolean isHealthy() {
        try (Connection conn = getConnection()) {
            return conn.isValid(2);
        } catch (SQLException e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return false;
        }
    }

    private void initSchema() {
        try (Connection conn = getConnection();
                Statement st = conn.createStatement()) {

            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS jobs (
                            id              VARCHAR(64) PRIMARY KEY,
                            job_type        VARCHAR(256) NOT NULL,
                            payload         BLOB NOT NULL,
                            priority        INT NOT NULL DEFAULT 2,
                            status          VARCHAR(20) NOT NULL,
                            attempt_count   INT NOT NULL DEFAULT 0,
                            result          CLOB,
                            created_at      TIMESTAMP(9) WITH TIME ZONE NOT NULL,
                            updated_at      TIMESTAMP(9) WITH TIME ZONE NOT NULL,
                            started_at      TIMESTAMP(9) WITH TIME ZONE,
                            finished_at     TIMESTAMP(9) WITH TIME ZONE,
                            CONSTRAINT chk_jobs_status
                                CHECK (status IN ('QUEUED', 'RUNNING', 'COMPLETED', 'FAILED', 'CANCELLED'))
                        );
                    """);

            st.addBatch("CREATE INDEX IF NOT EXISTS idx_jobs_status_priority ON jobs(status, priority, created_at);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_jobs_status_updated ON jobs(status, updated_at);");

            st.executeBatch();
            conn.commit();

            log.info("Database schema initialized");
        } catch (SQLException e) {
            throw new StoreException("Failed to initialize database schema", e);
        }
    }

    @Override
    public void close() {
        if (dataSource != null && !dataSource.isClosed()) {
            dataSource.close();
            log.info("Database pool closed");
        }
    }
}
