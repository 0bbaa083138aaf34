package uk.co.speedyvan.realtime.api;

/**
 * Receives decoded payloads for one subscription.
 * <p>
 * Payloads are state snapshots. The same snapshot may arrive through the live path and through polling around a
 * reconnect, so implementations should be idempotent.
 */
@FunctionalInterface
public interface RealtimeHandler<T> {

    void onEvent(T payload);
}
