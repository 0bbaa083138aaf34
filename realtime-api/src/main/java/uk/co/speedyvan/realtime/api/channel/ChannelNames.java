package uk.co.speedyvan.realtime.api.channel;

import uk.co.speedyvan.realtime.api.Preconditions;

/**
 * Single source of truth for wire-level channel naming.
 * <p>
 * Channel format:
 * <ul>
 *     <li>{@code {namespace}} when no instance id is given, e.g. {@code dispatch}</li>
 *     <li>{@code {namespace}-{instanceId}} otherwise, e.g. {@code orders-SV123}</li>
 * </ul>
 * The mapping is pure and total: the same input always yields the same channel name.
 */
public final class ChannelNames {

    private static final String SEPARATOR = "-";

    private ChannelNames() {
    }

    public static String resolve(ChannelNamespace namespace) {
        return resolve(namespace, null);
    }

    public static String resolve(ChannelNamespace namespace, String instanceId) {
        Preconditions.checkNotNull(namespace, "namespace");
        if (instanceId == null || instanceId.isBlank()) {
            return namespace.wireName();
        }
        return namespace.wireName() + SEPARATOR + instanceId.trim();
    }

    public static String resolve(ChannelKey key) {
        Preconditions.checkNotNull(key, "key");
        return resolve(key.namespace(), key.instanceId());
    }
}
