package lineup.queue.scheduler;

import lineup.queue.model.JobRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * Single-threaded dispatch loop.
 *
 * Each pass: finish any outcome still waiting to be written, then, unless the
 * queue is paused or throttled, claim the next job and run it on this thread.
 * Between passes the loop sleeps for the poll interval or until {@link #wake()}
 * is called (enqueue, resume). Handlers run on the loop thread, so at most one
 * runs at a time.
 */
public class SchedulerLoop implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SchedulerLoop.class);

    private final JobDispatcher dispatcher;
    private final ThrottlePolicy throttle;
    private final Duration pollInterval;
    private final Duration shutdownTimeout;
    private final Clock clock;
    private final ExecutorService executor;
    private final Semaphore wakeups = new Semaphore(0);

    private volatile boolean running = false;
    private volatile boolean stopping = false;

    public SchedulerLoop(JobDispatcher dispatcher, ThrottlePolicy throttle, Duration pollInterval,
            Duration shutdownTimeout, Clock clock) {
        if (pollInterval.isNegative() || pollInterval.isZero()) {
            throw new IllegalArgumentException("pollInterval must be positive");
        }
        this.dispatcher = dispatcher;
        this.throttle = throttle;
        this.pollInterval = pollInterval;
        this.shutdownTimeout = shutdownTimeout;
        this.clock = clock;
        this.executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "lineup-scheduler");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Start polling. A loop that was stopped cannot be restarted.
     */
    public synchronized void start() {
        if (running) {
            log.warn("Scheduler loop already running");
            return;
        }
        if (stopping) {
            throw new IllegalStateException("Scheduler loop has been stopped");
        }

        running = true;
        executor.submit(this::loop);
        log.info("Scheduler loop started (poll every {}ms, cooldown {}ms, max consecutive {})",
                pollInterval.toMillis(), throttle.cooldown().toMillis(), throttle.maxConsecutive());
    }

    /**
     * Stop the loop. A running handler gets {@code shutdownTimeout} to finish;
     * after that the loop thread is interrupted.
     */
    public synchronized void stop() {
        if (stopping) {
            return;
        }
        stopping = true;
        wake();
        executor.shutdown();

        try {
            if (!executor.awaitTermination(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                executor.shutdownNow();
                if (!executor.awaitTermination(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                    log.warn("Scheduler loop did not stop; a handler is ignoring interrupts");
                } else {
                    log.warn("Scheduler loop forcefully stopped");
                }
            } else {
                log.info("Scheduler loop stopped gracefully");
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        } finally {
            running = false;
        }
    }

    @Override
    public void close() {
        stop();
    }

    /** Cut the current poll wait short. */
    public void wake() {
        if (wakeups.availablePermits() == 0) {
            wakeups.release();
        }
    }

    private void loop() {
        while (!stopping && !Thread.currentThread().isInterrupted()) {
            try {
                Duration wait = tick();
                if (wait != null) {
                    await(wait);
                }
            } catch (RuntimeException e) {
                log.error("Scheduler loop error", e);
                await(pollInterval);
            }
        }
        log.debug("Scheduler loop exited");
    }

    /**
     * One scheduling decision.
     *
     * @return how long to sleep before the next pass, null to go again at once
     */
    Duration tick() {
        if (dispatcher.hasPendingCompletion()) {
            Optional<Instant> completed = dispatcher.retryPendingCompletion();
            if (completed.isEmpty()) {
                return pollInterval;
            }
            afterCompletion(completed.get());
        }

        if (dispatcher.isPaused()) {
            throttle.resetConsecutive();
            return pollInterval;
        }

        Instant now = clock.instant();
        Instant blockedUntil = throttle.blockedUntil(now);
        if (blockedUntil != null) {
            Duration remaining = Duration.between(now, blockedUntil);
            return remaining.compareTo(pollInterval) < 0 ? remaining : pollInterval;
        }

        Optional<JobRecord> claimed = dispatcher.claimNext();
        if (claimed.isEmpty()) {
            throttle.resetConsecutive();
            return pollInterval;
        }

        throttle.onDispatch();
        dispatcher.runClaimed(() -> stopping).ifPresent(this::afterCompletion);
        return null;
    }

    private void afterCompletion(Instant at) {
        if (throttle.onCompletion(at)) {
            log.info("Dispatched {} jobs in a row, pausing dispatch for {}ms",
                    throttle.consecutive(), throttle.cooldown().plus(throttle.forcedCooldown()).toMillis());
        }
    }

    private void await(Duration timeout) {
        try {
            if (wakeups.tryAcquire(Math.max(1, timeout.toMillis()), TimeUnit.MILLISECONDS)) {
                wakeups.drainPermits();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
