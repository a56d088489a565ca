package com.spacesync.backend.modules.telemetry.infrastructure.spool;

public class SpoolFullException extends Exception {

    public SpoolFullException(String message) {
        super(message);
    }
}
