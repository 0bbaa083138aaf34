package uk.co.speedyvan.realtime.core.schedule;

import java.time.Duration;
import java.util.concurrent.Executor;

/**
 * Timer source for reconnect attempts and polling ticks, and the executor transport callbacks are handed to.
 * <p>
 * A task that throws is logged by the implementation and keeps its schedule.
 */
public interface TaskScheduler extends Executor, AutoCloseable {

    ScheduledTask schedule(Runnable task, Duration delay);

    ScheduledTask scheduleAtFixedRate(Runnable task, Duration initialDelay, Duration period);

    @Override
    void close();
}
