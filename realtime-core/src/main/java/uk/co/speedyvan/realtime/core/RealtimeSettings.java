package uk.co.speedyvan.realtime.core;

import java.time.Duration;

/**
 * Options that tune reconnection and the polling fallback.
 */
public final class RealtimeSettings {

    private final int maxReconnectAttempts;
    private final Duration reconnectBaseDelay;
    private final Duration reconnectMaxDelay;
    private final Duration defaultPollingInterval;
    private final boolean pollingEnabled;
    private final Duration pollRequestTimeout;
    private final Duration transportFailureLogInterval;

    public RealtimeSettings(int maxReconnectAttempts,
                            Duration reconnectBaseDelay,
                            Duration reconnectMaxDelay,
                            Duration defaultPollingInterval,
                            boolean pollingEnabled,
                            Duration pollRequestTimeout,
                            Duration transportFailureLogInterval) {
        this.maxReconnectAttempts = Math.max(0, maxReconnectAttempts);
        this.reconnectBaseDelay = positiveOr(reconnectBaseDelay, Duration.ofSeconds(1));
        Duration maxDelay = positiveOr(reconnectMaxDelay, Duration.ofMinutes(1));
        this.reconnectMaxDelay = maxDelay.compareTo(this.reconnectBaseDelay) < 0 ? this.reconnectBaseDelay : maxDelay;
        this.defaultPollingInterval = positiveOr(defaultPollingInterval, Duration.ofSeconds(30));
        this.pollingEnabled = pollingEnabled;
        this.pollRequestTimeout = positiveOr(pollRequestTimeout, Duration.ofSeconds(10));
        this.transportFailureLogInterval = transportFailureLogInterval == null || transportFailureLogInterval.isNegative()
                ? Duration.ZERO : transportFailureLogInterval;
    }

    public static RealtimeSettings defaults() {
        return new RealtimeSettings(5, Duration.ofMillis(1000), Duration.ofSeconds(60), Duration.ofMillis(30_000), true,
                Duration.ofSeconds(10), Duration.ofSeconds(5));
    }

    public int maxReconnectAttempts() {
        return maxReconnectAttempts;
    }

    public Duration reconnectBaseDelay() {
        return reconnectBaseDelay;
    }

    public Duration reconnectMaxDelay() {
        return reconnectMaxDelay;
    }

    public Duration defaultPollingInterval() {
        return defaultPollingInterval;
    }

    public boolean pollingEnabled() {
        return pollingEnabled;
    }

    public Duration pollRequestTimeout() {
        return pollRequestTimeout;
    }

    public Duration transportFailureLogInterval() {
        return transportFailureLogInterval;
    }

    public RealtimeSettings withMaxReconnectAttempts(int attempts) {
        return new RealtimeSettings(attempts, reconnectBaseDelay, reconnectMaxDelay, defaultPollingInterval,
                pollingEnabled, pollRequestTimeout, transportFailureLogInterval);
    }

    public RealtimeSettings withReconnectBaseDelay(Duration delay) {
        return new RealtimeSettings(maxReconnectAttempts, delay, reconnectMaxDelay, defaultPollingInterval,
                pollingEnabled, pollRequestTimeout, transportFailureLogInterval);
    }

    public RealtimeSettings withPollingEnabled(boolean enabled) {
        return new RealtimeSettings(maxReconnectAttempts, reconnectBaseDelay, reconnectMaxDelay, defaultPollingInterval,
                enabled, pollRequestTimeout, transportFailureLogInterval);
    }

    public RealtimeSettings withDefaultPollingInterval(Duration interval) {
        return new RealtimeSettings(maxReconnectAttempts, reconnectBaseDelay, reconnectMaxDelay, interval,
                pollingEnabled, pollRequestTimeout, transportFailureLogInterval);
    }

    private static Duration positiveOr(Duration value, Duration fallback) {
        if (value == null || value.isNegative() || value.isZero()) {
            return fallback;
        }
        return value;
    }

    @Override
    public String toString() {
        return "RealtimeSettings{" +
                "maxReconnectAttempts=" + maxReconnectAttempts +
                ", reconnectBaseDelay=" + reconnectBaseDelay +
                ", reconnectMaxDelay=" + reconnectMaxDelay +
                ", defaultPollingInterval=" + defaultPollingInterval +
                ", pollingEnabled=" + pollingEnabled +
                ", pollRequestTimeout=" + pollRequestTimeout +
                '}';
    }
}
