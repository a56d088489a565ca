package com.spacesync.backend.modules.downlink.domain;

public enum DisplayColor {
    OFF(0x00),
    GREEN(0x01),
    RED(0x02),
    BLUE(0x03),
    ORANGE(0x04),
    YELLOW(0x05),
    WHITE(0x06);

    private final int code;

    DisplayColor(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }
}
