package uk.co.speedyvan.realtime.api.poll;

/**
 * Body of the poll endpoint.
 *
 * @param hasUpdate   whether {@code payloadJson} carries state that should be dispatched
 * @param payloadJson raw JSON payload, {@code null} when there is no update
 */
public record PollResponse(boolean hasUpdate, String payloadJson) {

    private static final PollResponse NO_UPDATE = new PollResponse(false, null);

    public PollResponse {
        if (hasUpdate && payloadJson == null) {
            throw new IllegalArgumentException("payloadJson must not be null when hasUpdate is true");
        }
    }

    public static PollResponse noUpdate() {
        return NO_UPDATE;
    }

    public static PollResponse update(String payloadJson) {
        return new PollResponse(true, payloadJson);
    }
}
