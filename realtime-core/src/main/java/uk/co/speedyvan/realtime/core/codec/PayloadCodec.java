package uk.co.speedyvan.realtime.core.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Objects;

/**
 * JSON conversion for envelopes and payloads.
 * Keeps try/catch out of the transport and the registry.
 */
public final class PayloadCodec {

    private final ObjectMapper mapper;

    public PayloadCodec() {
        this(new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false));
    }

    public PayloadCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public ObjectMapper mapper() {
        return mapper;
    }

    public <T> T decode(String json, Class<T> type) {
        try {
            return mapper.readValue(json, type);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to decode " + type.getSimpleName() + ": " + safe(json), e);
        }
    }

    public JsonNode readTree(String json) {
        try {
            return mapper.readTree(json);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to parse JSON: " + safe(json), e);
        }
    }

    public String encode(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode " + value.getClass().getSimpleName(), e);
        }
    }

    public TransportEnvelope decodeEnvelope(String json) {
        JsonNode root = readTree(json);
        JsonNode event = root.get("event");
        JsonNode data = root.get("data");
        if (event == null || !event.isTextual() || data == null) {
            throw new IllegalStateException("Envelope requires 'event' and 'data': " + safe(json));
        }
        JsonNode messageId = root.get("messageId");
        JsonNode createdAt = root.get("createdAtEpochMillis");
        return new TransportEnvelope(
                event.asText(),
                data,
                messageId == null ? null : messageId.asText(),
                createdAt == null ? 0L : createdAt.asLong());
    }

    public String encodeEnvelope(TransportEnvelope envelope) {
        return encode(envelope);
    }

    static String safe(String s) {
        if (s == null) return "null";
        if (s.length() <= 200) return s;
        return s.substring(0, 200) + "...(truncated)";
    }
}
