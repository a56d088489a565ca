package com.spacesync.backend.modules.telemetry.application;

import java.io.IOException;
import java.util.Base64;

import com.spacesync.backend.global.error.ProblemException;
import com.spacesync.backend.modules.device.domain.DevEui;
import com.spacesync.backend.modules.telemetry.domain.AckEvent;
import com.spacesync.backend.modules.telemetry.domain.JoinEvent;
import com.spacesync.backend.modules.telemetry.domain.UplinkEvent;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.springframework.stereotype.Component;

/**
 * Reads the network server's JSON integration events.
 *
 * <p>Uplink occupancy comes from the decoded {@code object.occupied} when present, otherwise from
 * the first byte of the base64 {@code data} field ({@code 0x01} means occupied). Radio metrics are
 * taken from the first {@code rxInfo} entry.
 */
@Component
public class WebhookPayloadParser {

    private static final int OCCUPIED_BYTE = 0x01;

    private final ObjectMapper objectMapper;

    public WebhookPayloadParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public JsonNode readTree(byte[] body) {
        try {
            JsonNode root = objectMapper.readTree(body);
            if (root == null || !root.isObject()) {
                throw malformed("body must be a JSON object");
            }
            return root;
        } catch (IOException ex) {
            throw malformed("body is not valid JSON");
        }
    }

    public UplinkEvent parseUplink(JsonNode root) {
        String devEui = devEui(root);
        JsonNode fcntNode = root.get("fCnt");
        if (fcntNode == null || !fcntNode.isIntegralNumber() || !fcntNode.canConvertToLong() || fcntNode.asLong() < 0) {
            throw malformed("fCnt is required and must be a non-negative integer");
        }
        Integer rssi = null;
        Double snr = null;
        JsonNode rxInfo = root.path("rxInfo");
        if (rxInfo.isArray() && !rxInfo.isEmpty()) {
            JsonNode first = rxInfo.get(0);
            if (first.hasNonNull("rssi")) {
                rssi = first.get("rssi").asInt();
            }
            if (first.hasNonNull("snr")) {
                snr = first.get("snr").asDouble();
            }
        }
        return new UplinkEvent(devEui, fcntNode.asLong(), occupancy(root), rssi, snr);
    }

    public JoinEvent parseJoin(JsonNode root) {
        return new JoinEvent(devEui(root));
    }

    public AckEvent parseAck(JsonNode root) {
        String devEui = devEui(root);
        JsonNode queueItemId = root.get("queueItemId");
        if (queueItemId == null || queueItemId.asText().isBlank()) {
            throw malformed("queueItemId is required");
        }
        return new AckEvent(devEui, queueItemId.asText(), root.path("acknowledged").asBoolean(false));
    }

    private Boolean occupancy(JsonNode root) {
        JsonNode decoded = root.path("object").get("occupied");
        if (decoded != null && !decoded.isNull()) {
            if (decoded.isBoolean()) {
                return decoded.booleanValue();
            }
            if (decoded.isNumber()) {
                return decoded.intValue() != 0;
            }
            String text = decoded.asText().trim();
            return "true".equalsIgnoreCase(text) || "occupied".equalsIgnoreCase(text) || "1".equals(text);
        }
        JsonNode data = root.get("data");
        if (data == null || data.isNull() || data.asText().isEmpty()) {
            return null;
        }
        byte[] bytes;
        try {
            bytes = Base64.getDecoder().decode(data.asText());
        } catch (IllegalArgumentException ex) {
            throw malformed("data is not valid base64");
        }
        if (bytes.length == 0) {
            return null;
        }
        return (bytes[0] & 0xFF) == OCCUPIED_BYTE;
    }

    private String devEui(JsonNode root) {
        JsonNode node = root.path("deviceInfo").get("devEui");
        if (node == null || node.isNull()) {
            throw malformed("deviceInfo.devEui is required");
        }
        try {
            return DevEui.normalize(node.asText());
        } catch (IllegalArgumentException ex) {
            throw malformed(ex.getMessage());
        }
    }

    private static ProblemException malformed(String detail) {
        return ProblemException.validation("webhook.malformed_payload", detail);
    }
}
