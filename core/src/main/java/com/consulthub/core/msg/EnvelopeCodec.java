package com.consulthub.core.msg;

import com.consulthub.core.util.JsonUtils;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Text-frame codec for {@link Envelope}.
 * <p>
 * One frame carries exactly one JSON object. A frame is rejected when it is not valid JSON,
 * when its root is not an object, or when {@code data} is neither an object nor null.
 * </p>
 */
public final class EnvelopeCodec {
    private EnvelopeCodec() {
    }

    /**
     * Decodes one inbound text frame.
     *
     * @param frame raw frame text
     * @return decoded envelope, with a JSON {@code null} payload normalized to {@code null}
     * @throws MalformedEnvelopeException if the frame is not a valid envelope
     */
    public static Envelope decode(String frame) {
        if (frame == null || frame.isBlank()) {
            throw new MalformedEnvelopeException("Empty frame");
        }

        JsonNode root;
        try {
            root = JsonUtils.mapper().readTree(frame);
        } catch (JsonProcessingException e) {
            throw new MalformedEnvelopeException("Frame is not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new MalformedEnvelopeException("Frame root must be a JSON object");
        }

        JsonNode data = root.get("data");
        if (data != null && !data.isNull() && !data.isObject()) {
            throw new MalformedEnvelopeException("Envelope data must be an object or null");
        }

        Envelope envelope;
        try {
            envelope = JsonUtils.mapper().treeToValue(root, Envelope.class);
        } catch (JsonProcessingException e) {
            throw new MalformedEnvelopeException("Frame does not match the envelope shape", e);
        }

        if (envelope.getData() != null && envelope.getData().isNull()) {
            return envelope.withData(null);
        }
        return envelope;
    }

    /**
     * Encodes an envelope as a JSON text frame.
     *
     * @param envelope envelope to encode
     * @return JSON text
     */
    public static String encode(Envelope envelope) {
        return JsonUtils.writeValueAsString(envelope);
    }
}
