package uk.co.speedyvan.realtime.api.channel;

import java.time.Duration;
import java.util.Optional;

/**
 * Per-subscription delivery options.
 *
 * @param pollingInterval interval of the polling fallback for this stream; {@code null} means the stream is only
 *                        polled after the connection drops, at the client's default interval
 * @param requiresAuth    whether the channel must be bound through the authenticated transport session
 */
public record SubscriptionOptions(Duration pollingInterval, boolean requiresAuth) {

    private static final SubscriptionOptions DEFAULTS = new SubscriptionOptions(null, false);

    public SubscriptionOptions {
        if (pollingInterval != null && (pollingInterval.isNegative() || pollingInterval.isZero())) {
            throw new IllegalArgumentException("pollingInterval must be positive");
        }
    }

    public static SubscriptionOptions defaults() {
        return DEFAULTS;
    }

    public static SubscriptionOptions polling(Duration pollingInterval) {
        return new SubscriptionOptions(pollingInterval, false);
    }

    public SubscriptionOptions withPollingInterval(Duration interval) {
        return new SubscriptionOptions(interval, requiresAuth);
    }

    public SubscriptionOptions withAuth() {
        return new SubscriptionOptions(pollingInterval, true);
    }

    public Optional<Duration> pollingIntervalIfSet() {
        return Optional.ofNullable(pollingInterval);
    }
}
