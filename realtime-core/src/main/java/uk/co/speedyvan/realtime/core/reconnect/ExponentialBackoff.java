package uk.co.speedyvan.realtime.core.reconnect;

import uk.co.speedyvan.realtime.api.Preconditions;

import java.time.Duration;

/**
 * Reconnect delay of {@code baseDelay * 2^(attempt-1)}, capped at {@code maxDelay}. No jitter.
 */
public final class ExponentialBackoff {

    private final long baseDelayMs;
    private final long maxDelayMs;

    public ExponentialBackoff(Duration baseDelay, Duration maxDelay) {
        this.baseDelayMs = Preconditions.checkPositive(baseDelay, "baseDelay").toMillis();
        this.maxDelayMs = Math.max(baseDelayMs, Preconditions.checkPositive(maxDelay, "maxDelay").toMillis());
    }

    /**
     * @param attempt 1-based attempt number
     */
    public Duration delayFor(int attempt) {
        if (attempt <= 0) {
            return Duration.ZERO;
        }
        long delay;
        if (attempt >= 31) {
            delay = maxDelayMs;
        } else {
            long shift = 1L << (attempt - 1);
            // overflow guard
            delay = shift > maxDelayMs / baseDelayMs ? maxDelayMs : Math.min(maxDelayMs, baseDelayMs * shift);
        }
        return Duration.ofMillis(delay);
    }
}
