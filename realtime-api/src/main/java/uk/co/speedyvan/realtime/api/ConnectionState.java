package uk.co.speedyvan.realtime.api;

/**
 * Realtime connection state machine.
 * <p>
 * Only {@link #CONNECTED} delivers through live bindings. Every other state delivers through the polling fallback.
 */
public enum ConnectionState {
    CONNECTING,
    CONNECTED,
    DISCONNECTED,
    RECONNECTING,
    ERROR;

    public boolean isLive() {
        return this == CONNECTED;
    }
}
