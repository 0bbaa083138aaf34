package uk.co.speedyvan.realtime.core.reconnect;

/**
 * Performs one scheduled reconnect attempt. Invoked on the scheduler thread without any lock held.
 */
@FunctionalInterface
public interface ReconnectTarget {

    void reconnect(int attempt);
}
