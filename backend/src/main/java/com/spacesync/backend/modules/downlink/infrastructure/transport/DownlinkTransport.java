package com.spacesync.backend.modules.downlink.infrastructure.transport;

import com.spacesync.backend.modules.downlink.domain.DownlinkCommand;

/**
 * Hands a command to the LoRaWAN network server. Returns the network server's queue item id,
 * which comes back on the confirmation webhook.
 */
public interface DownlinkTransport {

    String send(DownlinkCommand command) throws DownlinkTransportException;
}
