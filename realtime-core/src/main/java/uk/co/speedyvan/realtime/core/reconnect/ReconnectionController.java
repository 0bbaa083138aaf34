package uk.co.speedyvan.realtime.core.reconnect;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import uk.co.speedyvan.realtime.core.schedule.ScheduledTask;
import uk.co.speedyvan.realtime.core.schedule.TaskScheduler;

import java.time.Duration;
import java.util.Objects;

/**
 * Bounded, exponentially delayed reconnect attempts.
 * <p>
 * At most one attempt is pending or in flight at any time. Once {@code maxAttempts} attempts have failed nothing
 * more is scheduled until {@link #reset()} is called after a successful connect.
 * <p>
 * Not thread-safe: every method must be called while holding the owner's monitor. The owner confirms each fired
 * attempt with {@link #beginAttempt(int)} before connecting, which discards attempts made stale by a reset.
 */
public final class ReconnectionController {

    private static final Logger LOGGER = LoggerFactory.getLogger(ReconnectionController.class);

    private final ExponentialBackoff backoff;
    private final int maxAttempts;
    private final TaskScheduler scheduler;
    private final ReconnectTarget target;

    private int attempts;
    private boolean exhausted;
    private boolean inFlight;
    private ScheduledTask pending;
    private Duration lastDelay = Duration.ZERO;

    public ReconnectionController(ExponentialBackoff backoff, int maxAttempts, TaskScheduler scheduler, ReconnectTarget target) {
        this.backoff = Objects.requireNonNull(backoff, "backoff");
        this.maxAttempts = Math.max(0, maxAttempts);
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.target = Objects.requireNonNull(target, "target");
    }

    /**
     * Schedules the next attempt unless one is already pending or in flight, or retries are exhausted.
     *
     * @return {@code true} if an attempt was scheduled
     */
    public boolean onConnectionLost() {
        if (pending != null || inFlight || exhausted) {
            return false;
        }
        return scheduleNext();
    }

    /**
     * Marks a fired attempt as started.
     *
     * @return {@code false} if the attempt was cancelled or superseded and must not connect
     */
    public boolean beginAttempt(int attempt) {
        if (pending == null || attempt != attempts) {
            return false;
        }
        pending = null;
        inFlight = true;
        return true;
    }

    /**
     * Records a failed attempt and schedules the next one.
     *
     * @return {@code true} if another attempt was scheduled, {@code false} once retries are exhausted
     */
    public boolean attemptFailed() {
        inFlight = false;
        return scheduleNext();
    }

    /**
     * Ends an in-flight attempt that reached no transport, keeping the attempt count so a failure that recurs after
     * every such attempt still runs into the limit.
     */
    public void attemptCompleted() {
        inFlight = false;
        if (pending != null) {
            pending.cancel();
            pending = null;
        }
    }

    public void reset() {
        if (pending != null) {
            pending.cancel();
            pending = null;
        }
        attempts = 0;
        exhausted = false;
        inFlight = false;
        lastDelay = Duration.ZERO;
    }

    public int attempts() {
        return attempts;
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    public boolean isExhausted() {
        return exhausted;
    }

    public boolean isAttemptPending() {
        return pending != null;
    }

    /** {@code true} while an attempt is scheduled or connecting. */
    public boolean isAttemptInFlight() {
        return inFlight || pending != null;
    }

    public Duration lastDelay() {
        return lastDelay;
    }

    private boolean scheduleNext() {
        if (attempts >= maxAttempts) {
            exhausted = true;
            LOGGER.warn("Giving up on reconnecting after {} attempt(s)", attempts);
            return false;
        }
        attempts++;
        int attempt = attempts;
        lastDelay = backoff.delayFor(attempt);
        LOGGER.info("Reconnect attempt {}/{} in {} ms", attempt, maxAttempts, lastDelay.toMillis());
        pending = scheduler.schedule(() -> target.reconnect(attempt), lastDelay);
        return true;
    }
}
