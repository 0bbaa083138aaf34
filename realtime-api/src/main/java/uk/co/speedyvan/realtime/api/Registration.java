package uk.co.speedyvan.realtime.api;

/**
 * Handle returned when registering an observer. Closing it removes the observer.
 */
@FunctionalInterface
public interface Registration extends AutoCloseable {

    @Override
    void close();
}
