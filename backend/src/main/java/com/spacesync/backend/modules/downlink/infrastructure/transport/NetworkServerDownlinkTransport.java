package com.spacesync.backend.modules.downlink.infrastructure.transport;

import java.util.Base64;
import java.util.Map;

import com.spacesync.backend.modules.downlink.domain.DownlinkCommand;

import com.fasterxml.jackson.databind.JsonNode;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Enqueues frames through the network server's device queue REST API
 * ({@code POST /api/devices/{devEui}/queue}) as confirmed downlinks.
 */
public class NetworkServerDownlinkTransport implements DownlinkTransport {

    private static final Logger log = LoggerFactory.getLogger(NetworkServerDownlinkTransport.class);

    private final RestClient restClient;
    private final int fPort;

    public NetworkServerDownlinkTransport(RestClient restClient, int fPort) {
        this.restClient = restClient;
        this.fPort = fPort;
    }

    @Override
    public String send(DownlinkCommand command) throws DownlinkTransportException {
        byte[] frame;
        try {
            frame = DownlinkFrameEncoder.encode(command);
        } catch (IllegalArgumentException ex) {
            throw new DownlinkTransportException("Cannot encode command " + command.getId(), ex);
        }
        Map<String, Object> body = Map.of("queueItem", Map.of(
                "confirmed", true,
                "fPort", fPort,
                "data", Base64.getEncoder().encodeToString(frame)
        ));
        try {
            JsonNode response = restClient.post()
                    .uri("/api/devices/{devEui}/queue", command.getDevEui())
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(body)
                    .retrieve()
                    .body(JsonNode.class);
            String queueId = response != null && response.hasNonNull("id") ? response.get("id").asText() : null;
            if (queueId == null) {
                throw new DownlinkTransportException("Network server returned no queue item id for " + command.getDevEui());
            }
            log.debug("Downlink {} queued on network server as {}", command.getId(), queueId);
            return queueId;
        } catch (RestClientException ex) {
            throw new DownlinkTransportException("Network server rejected downlink for " + command.getDevEui()
                    + ": " + ex.getMessage(), ex);
        }
    }
}
