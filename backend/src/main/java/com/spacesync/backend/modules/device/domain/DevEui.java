package com.spacesync.backend.modules.device.domain;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Canonical form of a LoRaWAN device EUI: 16 lowercase hex digits without separators.
 */
public final class DevEui {

    private static final Pattern SEPARATORS = Pattern.compile("[-:\\s]");
    private static final Pattern CANONICAL = Pattern.compile("^[0-9a-f]{16}$");

    private DevEui() {
    }

    public static String normalize(String raw) {
        if (raw == null) {
            throw new IllegalArgumentException("devEui is required");
        }
        String normalized = SEPARATORS.matcher(raw.trim()).replaceAll("").toLowerCase(Locale.ROOT);
        if (!CANONICAL.matcher(normalized).matches()) {
            throw new IllegalArgumentException("devEui must be 16 hex digits: " + raw);
        }
        return normalized;
    }
}
