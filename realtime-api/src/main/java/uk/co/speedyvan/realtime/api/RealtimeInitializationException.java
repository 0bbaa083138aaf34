package uk.co.speedyvan.realtime.api;

public class RealtimeInitializationException extends RuntimeException {

    public RealtimeInitializationException(String message, Throwable cause) {
        super(message, cause);
    }

    public RealtimeInitializationException(String message) {
        super(message);
    }
}
