package uk.co.speedyvan.realtime.api.transport;

public class ChannelAuthorizationException extends TransportException {

    private final int statusCode;

    public ChannelAuthorizationException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public ChannelAuthorizationException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    /**
     * HTTP status of the auth endpoint response, or {@code -1} if no response was received.
     */
    public int statusCode() {
        return statusCode;
    }
}
