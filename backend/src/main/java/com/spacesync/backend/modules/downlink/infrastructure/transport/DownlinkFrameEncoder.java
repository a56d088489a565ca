package com.spacesync.backend.modules.downlink.infrastructure.transport;

import java.util.Base64;

import com.spacesync.backend.modules.downlink.domain.DisplayPolicy.Instruction;
import com.spacesync.backend.modules.downlink.domain.DownlinkCommand;

/**
 * Binary frame layout: {@code [command code][argument bytes...]}. {@code SET_DISPLAY} carries
 * colour and pattern codes; {@code RAW} sends the base64 {@code data} field of the payload as is.
 */
public final class DownlinkFrameEncoder {

    private DownlinkFrameEncoder() {
    }

    public static byte[] encode(DownlinkCommand command) {
        return switch (command.getCommandType()) {
            case SET_DISPLAY -> {
                Instruction instruction = Instruction.fromPayload(command.getPayload());
                yield new byte[]{
                        (byte) command.getCommandType().getCode(),
                        (byte) instruction.color().getCode(),
                        (byte) instruction.pattern().getCode()
                };
            }
            case REBOOT -> new byte[]{(byte) command.getCommandType().getCode()};
            case RAW -> {
                Object data = command.getPayload().get("data");
                if (data == null) {
                    throw new IllegalArgumentException("RAW command requires payload.data");
                }
                yield Base64.getDecoder().decode(data.toString());
            }
        };
    }
}
