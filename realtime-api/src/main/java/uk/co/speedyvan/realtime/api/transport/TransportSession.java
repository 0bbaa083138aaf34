package uk.co.speedyvan.realtime.api.transport;

/**
 * One publish/subscribe connection shared by every subscription of a realtime client.
 * <p>
 * Implementations report connection changes through {@link TransportLifecycleListener} and deliver messages to the
 * handlers bound with {@link #bindEvent}. Only the owning client may connect or disconnect a session.
 */
public interface TransportSession {

    /**
     * Opens the connection, replacing any previous one. Blocks until the connection is usable.
     *
     * @throws TransportException if the connection cannot be established
     */
    void connect();

    /**
     * Closes the connection and drops every channel subscription and binding. Idempotent.
     */
    void disconnect();

    boolean isConnected();

    /**
     * Subscribes to a wire channel. Authorization and the subscribe round trip may complete asynchronously;
     * failures are reported as {@link TransportLifecycleListener#onError}.
     */
    void subscribeChannel(String channel);

    void unsubscribeChannel(String channel);

    EventBinding bindEvent(String channel, String event, TransportMessageHandler handler);

    void addLifecycleListener(TransportLifecycleListener listener);

    void removeLifecycleListener(TransportLifecycleListener listener);
}
