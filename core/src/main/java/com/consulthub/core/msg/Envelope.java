package com.consulthub.core.msg;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.util.Optional;

/**
 * Universal message envelope exchanged between WebSocket clients and the hub.
 * <p>
 * <b>Wire shape:</b>
 * {@code {"type": string, "data": object|null, "timestamp": int64, "id"?: string, "user_id"?: string, "session_id"?: string}}
 * </p>
 * <p>
 * <b>Trust:</b> {@code user_id} and {@code timestamp} on inbound envelopes are advisory only.
 * The connection stamps the authenticated user id and the hub stamps the timestamp when it
 * processes the envelope.
 * </p>
 * <p>
 * Envelopes are immutable; use the {@code with*} methods to derive a new one.
 * The {@code data} tree is shared between derived envelopes and must be treated as read-only.
 * </p>
 */
@Value
@Builder
@With
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Envelope {

    /**
     * Payload key carrying the room identifier.
     */
    public static final String SESSION_ID_KEY = "sessionId";

    /**
     * Legacy payload key for the room identifier, still sent by older clients.
     */
    public static final String CONSULTATION_ID_KEY = "consultationId";

    /**
     * Message type tag (see {@link MessageType} for the types the hub acts on).
     */
    @JsonProperty("type")
    String type;

    /**
     * Type-specific payload, a JSON object or null.
     */
    @JsonProperty("data")
    @JsonInclude(JsonInclude.Include.ALWAYS)
    JsonNode data;

    /**
     * Event time in epoch millis, assigned by the hub.
     */
    @JsonProperty("timestamp")
    long timestamp;

    /**
     * Optional correlation id chosen by the sender.
     */
    @JsonProperty("id")
    String id;

    /**
     * Sender identity, attached by the connection and never trusted from the wire.
     */
    @JsonProperty("user_id")
    String userId;

    /**
     * Room identifier on room-scoped envelopes.
     */
    @JsonProperty("session_id")
    String sessionId;

    @JsonIgnore
    public Optional<MessageType> messageType() {
        return MessageType.fromWire(type);
    }

    /**
     * Room identifier requested in the payload ({@code data.sessionId}, falling back to
     * {@code data.consultationId}).
     *
     * @return the room id, or empty if the payload names none
     */
    @JsonIgnore
    public Optional<String> requestedSessionId() {
        if (data == null || !data.isObject()) {
            return Optional.empty();
        }
        return textField(SESSION_ID_KEY).or(() -> textField(CONSULTATION_ID_KEY));
    }

    private Optional<String> textField(String key) {
        JsonNode node = data.get(key);
        if (node == null || !node.isTextual() || node.asText().isBlank()) {
            return Optional.empty();
        }
        return Optional.of(node.asText());
    }
}
