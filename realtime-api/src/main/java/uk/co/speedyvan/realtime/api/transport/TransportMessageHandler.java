package uk.co.speedyvan.realtime.api.transport;

@FunctionalInterface
public interface TransportMessageHandler {

    /**
     * @param channel     wire channel the message arrived on
     * @param event       event name within the channel
     * @param payloadJson raw JSON payload
     */
    void onMessage(String channel, String event, String payloadJson);
}
