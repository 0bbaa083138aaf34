package uk.co.speedyvan.realtime.core.schedule;

public interface ScheduledTask {

    void cancel();

    boolean isCancelled();
}
