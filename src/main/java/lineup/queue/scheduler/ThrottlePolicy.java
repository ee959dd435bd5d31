package lineup.queue.scheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Dispatch throttle combining two rules:
 * <ul>
 * <li>a fixed cooldown after every completed job;</li>
 * <li>after {@code maxConsecutive} dispatches in a row, an extra forced pause on
 * top of the cooldown, even when the cooldown is zero.</li>
 * </ul>
 * The consecutive counter resets when the forced pause ends, when the queue is
 * paused and when it runs empty. Time is passed in by the caller.
 */
public final class ThrottlePolicy {

    private final Duration cooldown;
    private final int maxConsecutive;
    private final Duration forcedCooldown;

    private int consecutive;
    private Instant cooldownUntil;
    private Instant forcedUntil;

    /**
     * @param cooldown       delay after each completion, zero for none
     * @param maxConsecutive dispatches before a forced pause, 0 for unlimited
     * @param forcedCooldown length of the forced pause
     */
    public ThrottlePolicy(Duration cooldown, int maxConsecutive, Duration forcedCooldown) {
        this.cooldown = Objects.requireNonNull(cooldown, "cooldown");
        this.forcedCooldown = Objects.requireNonNull(forcedCooldown, "forcedCooldown");
        if (cooldown.isNegative() || forcedCooldown.isNegative()) {
            throw new IllegalArgumentException("cooldown durations must not be negative");
        }
        if (maxConsecutive < 0) {
            throw new IllegalArgumentException("maxConsecutive must not be negative");
        }
        this.maxConsecutive = maxConsecutive;
    }

    /**
     * @return null if a job may be dispatched at {@code now}, otherwise the
     *         earliest instant at which it may
     */
    public synchronized Instant blockedUntil(Instant now) {
        if (forcedUntil != null) {
            if (now.isBefore(forcedUntil)) {
                return forcedUntil;
            }
            forcedUntil = null;
            consecutive = 0;
        }
        if (cooldownUntil != null && now.isBefore(cooldownUntil)) {
            return cooldownUntil;
        }
        return null;
    }

    public boolean canDispatch(Instant now) {
        return blockedUntil(now) == null;
    }

    public synchronized void onDispatch() {
        consecutive++;
    }

    /**
     * Record a job completion (any terminal outcome).
     *
     * @return true if this completion triggered a forced pause
     */
    public synchronized boolean onCompletion(Instant at) {
        cooldownUntil = cooldown.isZero() ? null : at.plus(cooldown);
        if (maxConsecutive > 0 && consecutive >= maxConsecutive) {
            forcedUntil = at.plus(cooldown).plus(forcedCooldown);
            return true;
        }
        return false;
    }

    /**
     * Reset the consecutive counter (queue paused or empty). A forced pause
     * already in progress still runs to its end.
     */
    public synchronized void resetConsecutive() {
        consecutive = 0;
    }

    public synchronized int consecutive() {
        return consecutive;
    }

    public synchronized boolean inForcedPause(Instant now) {
        return forcedUntil != null && now.isBefore(forcedUntil);
    }

    public Duration cooldown() {
        return cooldown;
    }

    public int maxConsecutive() {
        return maxConsecutive;
    }

    public Duration forcedCooldown() {
        return forcedCooldown;
    }
}
