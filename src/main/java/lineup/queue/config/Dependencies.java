package lineup.queue.config;

import lineup.queue.events.CompositeJobEventListener;
import lineup.queue.events.JobEventListener;
import lineup.queue.events.LoggingJobEventListener;
import lineup.queue.executor.JobHandlerRegistry;
import lineup.queue.repository.JobStore;
import lineup.queue.service.QueueManager;
import lineup.queue.store.Database;
import lineup.queue.store.InMemoryJobStore;
import lineup.queue.store.JdbcJobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Manual dependency injection container.
 * Creates and wires the store, listeners and queue.
 *
 * Usage:
 *
 * <pre>
 * JobHandlerRegistry handlers = new JobHandlerRegistry()
 *         .register("thumbnail", new ThumbnailHandler());
 * Dependencies deps = Dependencies.create(QueueConfig.fromEnv(), handlers);
 * deps.start(); // start dispatching
 * String id = deps.queueManager().enqueue(JobPayload.ofText("thumbnail", "img-42.png"));
 * // ... use the queue ...
 * deps.close(); // cleanup
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final QueueConfig config;
    private final Database database; // null in in-memory mode
    private final JobStore jobStore;
    private final CompositeJobEventListener listeners;
    private final JobHandlerRegistry handlers;
    private final QueueManager queueManager;

    private Dependencies(QueueConfig config, JobHandlerRegistry handlers, JobEventListener listener) {
        this.config = config;
        this.handlers = handlers;

        log.info("Initializing dependencies with config: {}", config);

        // Infrastructure
        if (config.isDurable()) {
            this.database = new Database(config);
            this.jobStore = new JdbcJobStore(database);
        } else {
            this.database = null;
            this.jobStore = new InMemoryJobStore();
        }

        // Listeners: always log, plus the caller's own
        this.listeners = new CompositeJobEventListener().add(new LoggingJobEventListener());
        if (listener != null) {
            listeners.add(listener);
        }

        // Queue (runs crash recovery)
        try {
            this.queueManager = new QueueManager(jobStore, handlers, listeners, config);
        } catch (RuntimeException e) {
            if (database != null) {
                database.close();
            }
            throw e;
        }

        log.info("Dependencies initialized successfully");
    }

    /**
     * Create dependencies with the given config and handlers.
     */
    public static Dependencies create(QueueConfig config, JobHandlerRegistry handlers) {
        return create(config, handlers, null);
    }

    /**
     * Create dependencies with an additional event listener.
     */
    public static Dependencies create(QueueConfig config, JobHandlerRegistry handlers, JobEventListener listener) {
        return new Dependencies(config, handlers, listener);
    }

    /**
     * Create dependencies with environment-based config.
     */
    public static Dependencies create(JobHandlerRegistry handlers) {
        return create(QueueConfig.fromEnv(), handlers);
    }

    // Getters
    public QueueConfig config() {
        return config;
    }

    public Database database() {
        return database;
    }

    public JobStore jobStore() {
        return jobStore;
    }

    public CompositeJobEventListener listeners() {
        return listeners;
    }

    public JobHandlerRegistry handlers() {
        return handlers;
    }

    public QueueManager queueManager() {
        return queueManager;
    }

    /**
     * Start the scheduler loop.
     */
    public void start() {
        queueManager.start();
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");

        // Stop the queue first
        try {
            queueManager.close();
        } catch (Exception e) {
            log.warn("Error stopping queue: {}", e.getMessage());
        }

        // Close database
        if (database != null) {
            try {
                database.close();
            } catch (Exception e) {
                log.warn("Error closing database: {}", e.getMessage());
            }
        }

        log.info("Dependencies closed");
    }
}
