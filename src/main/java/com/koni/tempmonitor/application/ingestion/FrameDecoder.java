package com.koni.tempmonitor.application.ingestion;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.koni.tempmonitor.domain.exception.MalformedFrameException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Decodes a raw inbound frame into one of the closed set of {@link InboundFrame} variants.
 *
 * Rules:
 * - the payload must be a JSON object, anything else is malformed
 * - a missing or unrecognised {@code type} yields an {@link UnknownFrame}
 * - a temperature frame needs a non-blank string {@code deviceId} and numeric
 *   {@code ambientTemp} and {@code objectTemp}; a missing or non-numeric
 *   {@code timestamp} falls back to the receipt time
 */
@Component
@RequiredArgsConstructor
public class FrameDecoder {

    private final ObjectMapper objectMapper;

    /**
     * @param payload the frame text
     * @param receivedAt gateway receipt time in epoch milliseconds
     * @return the decoded frame, never null
     * @throws MalformedFrameException if the payload is not a usable frame
     */
    public InboundFrame decode(String payload, long receivedAt) {
        JsonNode root = parse(payload);

        JsonNode type = root.get("type");
        if (type == null || !type.isTextual()) {
            return new UnknownFrame(null);
        }

        switch (type.asText()) {
            case HandshakeFrame.TYPE:
                return new HandshakeFrame(optionalText(root, "deviceId"), optionalText(root, "deviceName"));
            case TemperatureFrame.TYPE:
                return decodeTemperature(root, receivedAt);
            default:
                return new UnknownFrame(type.asText());
        }
    }

    private JsonNode parse(String payload) {
        if (payload == null) {
            throw new MalformedFrameException("Frame is empty");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            throw new MalformedFrameException("Invalid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new MalformedFrameException("Frame is not a JSON object");
        }
        return root;
    }

    private TemperatureFrame decodeTemperature(JsonNode root, long receivedAt) {
        JsonNode deviceId = root.get("deviceId");
        if (deviceId == null || !deviceId.isTextual() || deviceId.asText().isBlank()) {
            throw new MalformedFrameException("deviceId is required");
        }
        double ambientTemp = requiredNumber(root, "ambientTemp");
        double objectTemp = requiredNumber(root, "objectTemp");

        JsonNode timestamp = root.get("timestamp");
        long observedAt = timestamp != null && timestamp.isNumber() ? timestamp.asLong() : receivedAt;

        return new TemperatureFrame(deviceId.asText(), ambientTemp, objectTemp, observedAt);
    }

    private static double requiredNumber(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (node == null || !node.isNumber()) {
            throw new MalformedFrameException(field + " must be a number");
        }
        return node.asDouble();
    }

    private static String optionalText(JsonNode root, String field) {
        JsonNode node = root.get(field);
        return node != null && node.isTextual() ? node.asText() : null;
    }
}
