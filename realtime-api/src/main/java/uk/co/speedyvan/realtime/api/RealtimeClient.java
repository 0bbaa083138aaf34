package uk.co.speedyvan.realtime.api;

import uk.co.speedyvan.realtime.api.channel.ChannelKey;
import uk.co.speedyvan.realtime.api.channel.SubscriptionOptions;
import uk.co.speedyvan.realtime.api.event.RealtimeEvent;

/**
 * Application-facing contract of the realtime delivery layer.
 * <p>
 * Pages and dashboards only talk to this interface. The transport sessions behind it are never exposed.
 */
public interface RealtimeClient extends AutoCloseable {

    /**
     * Connects the transport session(s).
     *
     * @throws RealtimeInitializationException if the initial connection cannot be established; the state is then
     *                                         {@link ConnectionState#ERROR} and nothing is retried automatically
     */
    void initialize();

    default <T> Subscription subscribe(ChannelKey channelKey, RealtimeEvent<T> event, RealtimeHandler<T> handler) {
        return subscribe(channelKey, event, handler, SubscriptionOptions.defaults());
    }

    <T> Subscription subscribe(ChannelKey channelKey,
                               RealtimeEvent<T> event,
                               RealtimeHandler<T> handler,
                               SubscriptionOptions options);

    /**
     * Registers an observer that is invoked synchronously on every state transition.
     *
     * @return a handle whose {@code close()} removes the observer
     */
    Registration onConnectionStateChange(ConnectionStateListener listener);

    ConnectionState connectionState();

    /**
     * Tears down every timer, binding and handler and closes the transport session(s). Idempotent.
     */
    void disconnect();

    @Override
    default void close() {
        disconnect();
    }
}
