package uk.co.speedyvan.realtime.core.diagnostics;

import uk.co.speedyvan.realtime.api.channel.SubscriptionKey;

/**
 * Receives every failure the client recovers from locally instead of propagating.
 */
public interface DiagnosticsSink {

    void handlerFailed(SubscriptionKey key, Throwable cause);

    void pollFailed(SubscriptionKey key, Throwable cause);

    void transportFailed(String reason, Throwable cause);

    void listenerFailed(Throwable cause);
}
