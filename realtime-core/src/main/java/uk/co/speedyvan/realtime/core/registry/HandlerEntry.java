package uk.co.speedyvan.realtime.core.registry;

import uk.co.speedyvan.realtime.api.RealtimeHandler;
import uk.co.speedyvan.realtime.api.channel.SubscriptionKey;

import java.util.Objects;

/**
 * One registered handler and the key it was registered under.
 * Entries compare by identity, so the same handler registered twice yields two independent entries.
 */
public final class HandlerEntry<T> {

    private final SubscriptionKey key;
    private final Class<T> payloadType;
    private final RealtimeHandler<T> handler;
    private volatile boolean active = true;

    HandlerEntry(SubscriptionKey key, Class<T> payloadType, RealtimeHandler<T> handler) {
        this.key = Objects.requireNonNull(key, "key");
        this.payloadType = Objects.requireNonNull(payloadType, "payloadType");
        this.handler = Objects.requireNonNull(handler, "handler");
    }

    public SubscriptionKey key() {
        return key;
    }

    public Class<T> payloadType() {
        return payloadType;
    }

    public boolean isActive() {
        return active;
    }

    void deactivate() {
        active = false;
    }

    void deliver(Object payload) {
        handler.onEvent(payloadType.cast(payload));
    }
}
