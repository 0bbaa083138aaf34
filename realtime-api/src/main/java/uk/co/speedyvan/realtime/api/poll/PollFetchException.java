package uk.co.speedyvan.realtime.api.poll;

public class PollFetchException extends RuntimeException {

    private final int statusCode;

    public PollFetchException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public PollFetchException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    public int statusCode() {
        return statusCode;
    }
}
