package uk.co.speedyvan.realtime.api.event;

import uk.co.speedyvan.realtime.api.Preconditions;
import uk.co.speedyvan.realtime.api.channel.ChannelNamespace;

/**
 * Typed event descriptor: which namespace publishes it, its wire name and the payload shape.
 *
 * @param <T> payload type handlers receive
 */
public record RealtimeEvent<T>(ChannelNamespace namespace, String name, Class<T> payloadType) {

    public RealtimeEvent {
        Preconditions.checkNotNull(namespace, "namespace");
        Preconditions.checkNotBlank(name, "name");
        Preconditions.checkNotNull(payloadType, "payloadType");
    }

    public static <T> RealtimeEvent<T> of(ChannelNamespace namespace, String name, Class<T> payloadType) {
        return new RealtimeEvent<>(namespace, name, payloadType);
    }

    @Override
    public String toString() {
        return namespace.wireName() + ":" + name;
    }
}
