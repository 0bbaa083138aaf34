package uk.co.speedyvan.realtime.api.channel;

import uk.co.speedyvan.realtime.api.Preconditions;

/**
 * Logical channel address: a namespace plus an optional instance id (an order reference, a driver id).
 */
public record ChannelKey(ChannelNamespace namespace, String instanceId) {

    public ChannelKey {
        Preconditions.checkNotNull(namespace, "namespace");
        instanceId = instanceId == null || instanceId.isBlank() ? null : instanceId.trim();
    }

    public static ChannelKey of(ChannelNamespace namespace) {
        return new ChannelKey(namespace, null);
    }

    public static ChannelKey of(ChannelNamespace namespace, String instanceId) {
        return new ChannelKey(namespace, instanceId);
    }

    public boolean hasInstanceId() {
        return instanceId != null;
    }

    /**
     * Wire channel name for this key, see {@link ChannelNames}.
     */
    public String wireName() {
        return ChannelNames.resolve(namespace, instanceId);
    }
}
