package com.spacesync.backend.modules.telemetry.domain;

/**
 * Decoded uplink. {@code occupied} is {@code null} when the frame carried no occupancy.
 */
public record UplinkEvent(String devEui, long fcnt, Boolean occupied, Integer rssi, Double snr) {
}
