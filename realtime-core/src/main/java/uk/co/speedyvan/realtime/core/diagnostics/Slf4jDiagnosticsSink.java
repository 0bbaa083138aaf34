package uk.co.speedyvan.realtime.core.diagnostics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import uk.co.speedyvan.realtime.api.channel.SubscriptionKey;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Logs recovered failures. Transport failures are throttled to one log line per interval.
 */
public final class Slf4jDiagnosticsSink implements DiagnosticsSink {

    private static final Logger LOGGER = LoggerFactory.getLogger(Slf4jDiagnosticsSink.class);

    private final long transportLogIntervalMillis;
    private final AtomicLong lastTransportLogMillis = new AtomicLong(0);
    private final AtomicLong suppressedTransportFailures = new AtomicLong(0);

    public Slf4jDiagnosticsSink() {
        this(Duration.ofSeconds(5));
    }

    public Slf4jDiagnosticsSink(Duration transportLogInterval) {
        this.transportLogIntervalMillis = transportLogInterval == null ? 0L : Math.max(0L, transportLogInterval.toMillis());
    }

    @Override
    public void handlerFailed(SubscriptionKey key, Throwable cause) {
        LOGGER.warn("Handler for '{}' failed", key, cause);
    }

    @Override
    public void pollFailed(SubscriptionKey key, Throwable cause) {
        LOGGER.warn("Polling '{}' failed, retrying on next tick: {}", key, cause.toString());
    }

    @Override
    public void transportFailed(String reason, Throwable cause) {
        long now = System.currentTimeMillis();
        long lastLog = lastTransportLogMillis.get();
        if (now - lastLog < transportLogIntervalMillis) {
            suppressedTransportFailures.incrementAndGet();
            return;
        }
        if (lastTransportLogMillis.compareAndSet(lastLog, now)) {
            long suppressed = suppressedTransportFailures.getAndSet(0);
            if (cause == null) {
                LOGGER.warn("Realtime transport failure: {} (suppressed {})", reason, suppressed);
            } else {
                LOGGER.warn("Realtime transport failure: {} (suppressed {})", reason, suppressed, cause);
            }
        }
    }

    @Override
    public void listenerFailed(Throwable cause) {
        LOGGER.warn("Connection state listener failed", cause);
    }
}
