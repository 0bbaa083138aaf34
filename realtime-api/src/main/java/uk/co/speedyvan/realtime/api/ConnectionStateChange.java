package uk.co.speedyvan.realtime.api;

/**
 * A single connection state transition as seen by {@link ConnectionStateListener}s.
 *
 * @param previous             state before the transition
 * @param current              state after the transition
 * @param reconnectAttempt     reconnect attempts made since the last successful connect
 * @param maxReconnectAttempts configured bound on automatic attempts
 * @param retriesExhausted     {@code true} once automatic reconnection has given up; polling stays the
 *                             delivery path until {@link RealtimeClient#initialize()} is called again
 */
public record ConnectionStateChange(ConnectionState previous,
                                    ConnectionState current,
                                    int reconnectAttempt,
                                    int maxReconnectAttempts,
                                    boolean retriesExhausted) {

    public ConnectionStateChange {
        Preconditions.checkNotNull(previous, "previous");
        Preconditions.checkNotNull(current, "current");
    }

    public ConnectionState state() {
        return current;
    }
}
