package lineup.queue.config;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Configuration holder for the queue.
 * All settings have sensible defaults; the default store is in-memory.
 */
public final class QueueConfig {

    // Database settings (null url = non-durable in-memory store)
    private String databaseUrl = null;
    private int databasePoolSize = 4;

    // Throttle settings
    private Duration cooldown = Duration.ZERO;
    private int maxConsecutive = 0; // 0 = unlimited
    private Duration forcedCooldown = null; // null = derived, see forcedCooldown()

    // Loop settings
    private Duration pollInterval = Duration.ofSeconds(3);
    private Duration shutdownTimeout = Duration.ofSeconds(5);

    private QueueConfig() {
    }

    public static QueueConfig defaults() {
        return new QueueConfig();
    }

    public static QueueConfig fromEnv() {
        QueueConfig config = new QueueConfig();

        // Override from environment variables
        String dbUrl = System.getenv("LINEUP_DB_URL");
        String dbPath = System.getenv("LINEUP_DB_PATH");
        if (dbUrl != null && !dbUrl.isBlank()) {
            config.databaseUrl = dbUrl;
        } else if (dbPath != null && !dbPath.isBlank()) {
            config.withDatabasePath(Path.of(dbPath));
        }

        String cooldownMs = System.getenv("LINEUP_COOLDOWN_MS");
        if (cooldownMs != null && !cooldownMs.isBlank()) {
            config.withCooldown(Duration.ofMillis(Long.parseLong(cooldownMs)));
        }

        String maxConsecutive = System.getenv("LINEUP_MAX_CONSECUTIVE");
        if (maxConsecutive != null && !maxConsecutive.isBlank()) {
            config.withMaxConsecutive(Integer.parseInt(maxConsecutive));
        }

        String forcedMs = System.getenv("LINEUP_FORCED_COOLDOWN_MS");
        if (forcedMs != null && !forcedMs.isBlank()) {
            config.withForcedCooldown(Duration.ofMillis(Long.parseLong(forcedMs)));
        }

        String pollMs = System.getenv("LINEUP_POLL_INTERVAL_MS");
        if (pollMs != null && !pollMs.isBlank()) {
            config.withPollInterval(Duration.ofMillis(Long.parseLong(pollMs)));
        }

        return config;
    }

    // Getters
    public String databaseUrl() {
        return databaseUrl;
    }

    public boolean isDurable() {
        return databaseUrl != null;
    }

    public int databasePoolSize() {
        return databasePoolSize;
    }

    public Duration cooldown() {
        return cooldown;
    }

    public int maxConsecutive() {
        return maxConsecutive;
    }

    /**
     * Length of the pause forced after {@code maxConsecutive} dispatches.
     * Unless set explicitly this is the cooldown, or the poll interval when
     * the cooldown is zero.
     */
    public Duration forcedCooldown() {
        if (forcedCooldown != null) {
            return forcedCooldown;
        }
        return cooldown.isZero() ? pollInterval : cooldown;
    }

    public Duration pollInterval() {
        return pollInterval;
    }

    public Duration shutdownTimeout() {
        return shutdownTimeout;
    }

    // Fluent setters for testing/customization
    public QueueConfig withDatabaseUrl(String url) {
        this.databaseUrl = url;
        return this;
    }

    /**
     * Use a file-backed H2 database at {@code path} (without the .mv.db suffix).
     */
    public QueueConfig withDatabasePath(Path path) {
        this.databaseUrl = "jdbc:h2:file:" + path.toAbsolutePath() + ";DB_CLOSE_ON_EXIT=FALSE";
        return this;
    }

    public QueueConfig inMemory() {
        this.databaseUrl = null;
        return this;
    }

    public QueueConfig withDatabasePoolSize(int size) {
        if (size < 1) {
            throw new IllegalArgumentException("databasePoolSize must be at least 1");
        }
        this.databasePoolSize = size;
        return this;
    }

    public QueueConfig withCooldown(Duration cooldown) {
        this.cooldown = requireNonNegative(cooldown, "cooldown");
        return this;
    }

    public QueueConfig withMaxConsecutive(int maxConsecutive) {
        if (maxConsecutive < 0) {
            throw new IllegalArgumentException("maxConsecutive must not be negative");
        }
        this.maxConsecutive = maxConsecutive;
        return this;
    }

    public QueueConfig withForcedCooldown(Duration forcedCooldown) {
        this.forcedCooldown = requireNonNegative(forcedCooldown, "forcedCooldown");
        return this;
    }

    public QueueConfig withPollInterval(Duration pollInterval) {
        if (pollInterval == null || pollInterval.isNegative() || pollInterval.isZero()) {
            throw new IllegalArgumentException("pollInterval must be positive");
        }
        this.pollInterval = pollInterval;
        return this;
    }

    public QueueConfig withShutdownTimeout(Duration shutdownTimeout) {
        this.shutdownTimeout = requireNonNegative(shutdownTimeout, "shutdownTimeout");
        return this;
    }

    private static Duration requireNonNegative(Duration value, String name) {
        if (value == null || value.isNegative()) {
            throw new IllegalArgumentException(name + " must not be negative");
        }
        return value;
    }

    @Override
    public String toString() {
        return "QueueConfig{" +
                "databaseUrl=" + (databaseUrl != null ? "'" + databaseUrl + "'" : "in-memory") +
                ", cooldown=" + cooldown.toMillis() + "ms" +
                ", maxConsecutive=" + maxConsecutive +
                ", forcedCooldown=" + forcedCooldown().toMillis() + "ms" +
                ", pollInterval=" + pollInterval.toMillis() + "ms" +
                '}';
    }
}
