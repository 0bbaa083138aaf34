package uk.co.speedyvan.realtime.bootstrap.config;

import uk.co.speedyvan.realtime.core.RealtimeSettings;

import java.time.Duration;
import java.util.Map;

import static uk.co.speedyvan.realtime.bootstrap.config.YamlValues.toBoolean;
import static uk.co.speedyvan.realtime.bootstrap.config.YamlValues.toInt;
import static uk.co.speedyvan.realtime.bootstrap.config.YamlValues.toLong;

public record ClientYamlConfig(int maxReconnectAttempts,
                               long reconnectBaseDelayMs,
                               long reconnectMaxDelayMs,
                               long defaultPollingIntervalMs,
                               boolean pollingEnabled,
                               long pollRequestTimeoutMs,
                               long transportFailureLogIntervalMs) {

    public static ClientYamlConfig fromMap(Map<String, Object> section) {
        RealtimeSettings defaults = RealtimeSettings.defaults();
        if (section == null) {
            return fromSettings(defaults);
        }
        int maxAttempts = toInt(section.get("max-reconnect-attempts"), defaults.maxReconnectAttempts());
        long baseDelay = toLong(section.get("reconnect-base-delay-ms"), defaults.reconnectBaseDelay().toMillis());
        long maxDelay = toLong(section.get("reconnect-max-delay-ms"), defaults.reconnectMaxDelay().toMillis());
        long pollingInterval = toLong(section.get("default-polling-interval-ms"), defaults.defaultPollingInterval().toMillis());
        boolean pollingEnabled = toBoolean(section.get("polling-enabled"), defaults.pollingEnabled());
        long pollTimeout = toLong(section.get("poll-request-timeout-ms"), defaults.pollRequestTimeout().toMillis());
        long logInterval = toLong(section.get("transport-failure-log-interval-ms"),
                defaults.transportFailureLogInterval().toMillis());

        if (maxAttempts < 0) {
            throw new IllegalArgumentException("client.max-reconnect-attempts must not be negative");
        }
        requirePositive(baseDelay, "client.reconnect-base-delay-ms");
        requirePositive(maxDelay, "client.reconnect-max-delay-ms");
        requirePositive(pollingInterval, "client.default-polling-interval-ms");
        requirePositive(pollTimeout, "client.poll-request-timeout-ms");
        if (logInterval < 0) {
            throw new IllegalArgumentException("client.transport-failure-log-interval-ms must not be negative");
        }
        return new ClientYamlConfig(maxAttempts, baseDelay, maxDelay, pollingInterval, pollingEnabled, pollTimeout, logInterval);
    }

    public RealtimeSettings toSettings() {
        return new RealtimeSettings(
                maxReconnectAttempts,
                Duration.ofMillis(reconnectBaseDelayMs),
                Duration.ofMillis(reconnectMaxDelayMs),
                Duration.ofMillis(defaultPollingIntervalMs),
                pollingEnabled,
                Duration.ofMillis(pollRequestTimeoutMs),
                Duration.ofMillis(transportFailureLogIntervalMs));
    }

    private static ClientYamlConfig fromSettings(RealtimeSettings settings) {
        return new ClientYamlConfig(
                settings.maxReconnectAttempts(),
                settings.reconnectBaseDelay().toMillis(),
                settings.reconnectMaxDelay().toMillis(),
                settings.defaultPollingInterval().toMillis(),
                settings.pollingEnabled(),
                settings.pollRequestTimeout().toMillis(),
                settings.transportFailureLogInterval().toMillis());
    }

    private static void requirePositive(long value, String key) {
        if (value <= 0) {
            throw new IllegalArgumentException(key + " must be positive");
        }
    }
}
