package com.spacesync.backend.modules.downlink.infrastructure.transport;

public class DownlinkTransportException extends Exception {

    public DownlinkTransportException(String message) {
        super(message);
    }

    public DownlinkTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
