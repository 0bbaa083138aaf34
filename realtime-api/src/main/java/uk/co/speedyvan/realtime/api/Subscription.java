package uk.co.speedyvan.realtime.api;

import uk.co.speedyvan.realtime.api.channel.SubscriptionKey;

/**
 * Handle for one registered handler.
 * <p>
 * {@link #unsubscribe()} removes exactly this handler. Once it returns, the handler receives nothing more.
 * Calling it again is a no-op.
 */
public interface Subscription extends AutoCloseable {

    SubscriptionKey key();

    void unsubscribe();

    boolean isActive();

    @Override
    default void close() {
        unsubscribe();
    }
}
