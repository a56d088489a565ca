package com.spacesync.backend.modules.downlink.domain;

/**
 * Command codes understood by the display firmware; the code is the first byte of the frame.
 */
public enum DownlinkCommandType {
    SET_DISPLAY(0x01),
    REBOOT(0x02),
    RAW(0xFF);

    private final int code;

    DownlinkCommandType(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }
}
