package uk.co.speedyvan.realtime.api.poll;

import uk.co.speedyvan.realtime.api.channel.SubscriptionKey;

import java.util.concurrent.CompletableFuture;

/**
 * Pull-based read of the current state of one stream, used while the live transport is unavailable.
 * <p>
 * Calls must be idempotent and side-effect free. Each call is an independent request with its own timeout.
 */
@FunctionalInterface
public interface PollClient {

    CompletableFuture<PollResponse> fetch(SubscriptionKey key);
}
