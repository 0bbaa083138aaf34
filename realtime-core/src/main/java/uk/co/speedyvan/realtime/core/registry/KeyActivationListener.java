package uk.co.speedyvan.realtime.core.registry;

import uk.co.speedyvan.realtime.api.channel.SubscriptionKey;

/**
 * Notified when a key gains its first handler or loses its last one.
 */
public interface KeyActivationListener {

    void keyActivated(SubscriptionKey key);

    void keyDeactivated(SubscriptionKey key);
}
