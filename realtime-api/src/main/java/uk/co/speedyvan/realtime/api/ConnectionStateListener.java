package uk.co.speedyvan.realtime.api;

@FunctionalInterface
public interface ConnectionStateListener {

    void onStateChange(ConnectionStateChange change);
}
