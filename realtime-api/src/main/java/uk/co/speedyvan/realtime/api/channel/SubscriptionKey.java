package uk.co.speedyvan.realtime.api.channel;

import uk.co.speedyvan.realtime.api.Preconditions;

/**
 * Identifies one logical stream of updates: a wire channel and an event name within it.
 */
public record SubscriptionKey(String channel, String event) {

    public SubscriptionKey {
        Preconditions.checkNotBlank(channel, "channel");
        Preconditions.checkNotBlank(event, "event");
    }

    public static SubscriptionKey of(ChannelKey channelKey, String event) {
        Preconditions.checkNotNull(channelKey, "channelKey");
        return new SubscriptionKey(channelKey.wireName(), event);
    }

    @Override
    public String toString() {
        return channel + "/" + event;
    }
}
