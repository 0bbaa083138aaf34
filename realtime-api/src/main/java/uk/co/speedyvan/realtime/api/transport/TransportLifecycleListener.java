package uk.co.speedyvan.realtime.api.transport;

/**
 * Connection lifecycle callbacks of a {@link TransportSession}. Every method has a no-op default.
 */
public interface TransportLifecycleListener {

    default void onConnected() {
    }

    default void onDisconnected() {
    }

    default void onReconnecting() {
    }

    default void onError(Throwable cause) {
    }
}
