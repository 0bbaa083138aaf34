package uk.co.speedyvan.realtime.core.polling;

import uk.co.speedyvan.realtime.api.channel.SubscriptionKey;

@FunctionalInterface
public interface PollResultSink {

    void deliver(SubscriptionKey key, String payloadJson);
}
