package com.spacesync.backend.modules.downlink.infrastructure.transport;

import java.util.HexFormat;
import java.util.UUID;

import com.spacesync.backend.modules.downlink.domain.DownlinkCommand;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Used when no network server is configured: logs the frame and reports it as queued.
 */
public class LoggingDownlinkTransport implements DownlinkTransport {

    private static final Logger log = LoggerFactory.getLogger(LoggingDownlinkTransport.class);

    @Override
    public String send(DownlinkCommand command) throws DownlinkTransportException {
        byte[] frame;
        try {
            frame = DownlinkFrameEncoder.encode(command);
        } catch (IllegalArgumentException ex) {
            throw new DownlinkTransportException("Cannot encode command " + command.getId(), ex);
        }
        String queueId = "local-" + UUID.randomUUID();
        log.info("Downlink {} {} to {}: {} (queue id {})", command.getId(), command.getCommandType(),
                command.getDevEui(), HexFormat.of().formatHex(frame), queueId);
        return queueId;
    }
}
