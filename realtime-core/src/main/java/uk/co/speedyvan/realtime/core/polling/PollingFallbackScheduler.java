package uk.co.speedyvan.realtime.core.polling;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import uk.co.speedyvan.realtime.api.Preconditions;
import uk.co.speedyvan.realtime.api.channel.SubscriptionKey;
import uk.co.speedyvan.realtime.api.poll.PollClient;
import uk.co.speedyvan.realtime.api.poll.PollResponse;
import uk.co.speedyvan.realtime.core.diagnostics.DiagnosticsSink;
import uk.co.speedyvan.realtime.core.schedule.ScheduledTask;
import uk.co.speedyvan.realtime.core.schedule.TaskScheduler;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.function.Predicate;

/**
 * At most one periodic poll timer per {@link SubscriptionKey}.
 * <p>
 * Ticks are suppressed while the key is delivered over a live binding; the timer itself keeps running.
 * A failed poll is reported and retried on the next tick. A response whose timer was disarmed or replaced while
 * the request was in flight is dropped.
 */
public final class PollingFallbackScheduler implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(PollingFallbackScheduler.class);

    private final TaskScheduler scheduler;
    private final PollClient pollClient;
    private final Predicate<SubscriptionKey> deliveredLive;
    private final PollResultSink sink;
    private final DiagnosticsSink diagnostics;
    private final Map<SubscriptionKey, PollingTimer> timers = new ConcurrentHashMap<>();

    public PollingFallbackScheduler(TaskScheduler scheduler,
                                    PollClient pollClient,
                                    Predicate<SubscriptionKey> deliveredLive,
                                    PollResultSink sink,
                                    DiagnosticsSink diagnostics) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.pollClient = Objects.requireNonNull(pollClient, "pollClient");
        this.deliveredLive = Objects.requireNonNull(deliveredLive, "deliveredLive");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
    }

    /**
     * Starts polling {@code key} every {@code interval}. A key that is already armed keeps its existing timer.
     *
     * @return {@code true} if a new timer was created
     */
    public boolean arm(SubscriptionKey key, Duration interval) {
        Preconditions.checkNotNull(key, "key");
        Preconditions.checkPositive(interval, "interval");
        if (timers.containsKey(key)) {
            return false;
        }
        PollingTimer timer = new PollingTimer(key, interval);
        if (timers.putIfAbsent(key, timer) != null) {
            return false;
        }
        timer.task = scheduler.scheduleAtFixedRate(() -> tick(timer), interval, interval);
        if (timer.cancelled) {
            // disarmed concurrently before the task handle was published
            timer.task.cancel();
            return false;
        }
        LOGGER.debug("Polling armed for '{}' every {} ms", key, interval.toMillis());
        return true;
    }

    public boolean disarm(SubscriptionKey key) {
        PollingTimer timer = timers.remove(key);
        if (timer == null) {
            return false;
        }
        timer.cancel();
        LOGGER.debug("Polling disarmed for '{}'", key);
        return true;
    }

    public void disarmAll() {
        for (SubscriptionKey key : Set.copyOf(timers.keySet())) {
            disarm(key);
        }
    }

    public boolean isArmed(SubscriptionKey key) {
        return timers.containsKey(key);
    }

    public Optional<Duration> interval(SubscriptionKey key) {
        PollingTimer timer = timers.get(key);
        return timer == null ? Optional.empty() : Optional.of(timer.interval);
    }

    public Set<SubscriptionKey> armedKeys() {
        return Set.copyOf(timers.keySet());
    }

    @Override
    public void close() {
        disarmAll();
    }

    private void tick(PollingTimer timer) {
        if (!isCurrent(timer) || deliveredLive.test(timer.key)) {
            return;
        }
        SubscriptionKey key = timer.key;
        CompletableFuture<PollResponse> request;
        try {
            request = pollClient.fetch(key);
        } catch (RuntimeException e) {
            diagnostics.pollFailed(key, e);
            return;
        }
        if (request == null) {
            return;
        }
        request.whenComplete((response, error) -> {
            if (error != null) {
                diagnostics.pollFailed(key, unwrap(error));
                return;
            }
            if (response == null || !response.hasUpdate()) {
                return;
            }
            if (!isCurrent(timer)) {
                LOGGER.debug("Dropping poll result for '{}', timer no longer armed", key);
                return;
            }
            try {
                sink.deliver(key, response.payloadJson());
            } catch (RuntimeException e) {
                diagnostics.pollFailed(key, e);
            }
        });
    }

    private boolean isCurrent(PollingTimer timer) {
        return timers.get(timer.key) == timer;
    }

    private static Throwable unwrap(Throwable error) {
        if ((error instanceof CompletionException || error instanceof ExecutionException) && error.getCause() != null) {
            return error.getCause();
        }
        return error;
    }

    private static final class PollingTimer {

        private final SubscriptionKey key;
        private final Duration interval;
        private volatile ScheduledTask task;
        private volatile boolean cancelled;

        private PollingTimer(SubscriptionKey key, Duration interval) {
            this.key = key;
            this.interval = interval;
        }

        private void cancel() {
            cancelled = true;
            ScheduledTask current = task;
            if (current != null) {
                current.cancel();
            }
        }
    }
}
