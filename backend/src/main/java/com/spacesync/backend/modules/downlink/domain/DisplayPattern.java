package com.spacesync.backend.modules.downlink.domain;

public enum DisplayPattern {
    SOLID(0x00),
    BLINK(0x01),
    SLOW_BLINK(0x02),
    FAST_BLINK(0x03);

    private final int code;

    DisplayPattern(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }
}
