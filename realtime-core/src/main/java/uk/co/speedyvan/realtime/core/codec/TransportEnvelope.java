package uk.co.speedyvan.realtime.core.codec;

import com.fasterxml.jackson.databind.JsonNode;
import uk.co.speedyvan.realtime.api.Preconditions;

import java.time.Instant;
import java.util.UUID;

/**
 * Message shape published on a realtime channel: the event name plus its JSON data.
 */
public record TransportEnvelope(String event, JsonNode data, String messageId, long createdAtEpochMillis) {

    public TransportEnvelope {
        Preconditions.checkNotBlank(event, "event");
        Preconditions.checkNotNull(data, "data");
        messageId = messageId == null || messageId.isBlank() ? UUID.randomUUID().toString() : messageId;
        createdAtEpochMillis = createdAtEpochMillis <= 0 ? Instant.now().toEpochMilli() : createdAtEpochMillis;
    }

    public static TransportEnvelope of(String event, JsonNode data) {
        return new TransportEnvelope(event, data, null, 0L);
    }
}
