package uk.co.speedyvan.realtime.api.transport;

import java.util.concurrent.CompletableFuture;

/**
 * Asks the application back end whether the current user may subscribe to a private channel.
 */
@FunctionalInterface
public interface ChannelAuthorizer {

    /**
     * @param socketId identifier of the transport connection requesting access
     * @param channel  wire channel name
     * @return a future completed with the signature, or exceptionally with {@link ChannelAuthorizationException}
     */
    CompletableFuture<ChannelAuthorization> authorize(String socketId, String channel);
}
