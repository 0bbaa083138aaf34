package uk.co.speedyvan.realtime.api.transport;

/**
 * Binding handle. unbind() stops delivery for this (channel, event) handler.
 */
public interface EventBinding {

    String channel();

    String event();

    void unbind();
}
