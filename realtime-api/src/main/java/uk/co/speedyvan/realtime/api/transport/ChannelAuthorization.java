package uk.co.speedyvan.realtime.api.transport;

import uk.co.speedyvan.realtime.api.Preconditions;

public record ChannelAuthorization(String channel, String signature) {

    public ChannelAuthorization {
        Preconditions.checkNotBlank(channel, "channel");
        Preconditions.checkNotBlank(signature, "signature");
    }
}
