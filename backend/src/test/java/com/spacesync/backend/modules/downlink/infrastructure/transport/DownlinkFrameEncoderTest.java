package com.spacesync.backend.modules.downlink.infrastructure.transport;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;

import com.spacesync.backend.modules.downlink.domain.DisplayPolicy;
import com.spacesync.backend.modules.downlink.domain.DownlinkCommand;
import com.spacesync.backend.modules.downlink.domain.DownlinkCommandType;
import com.spacesync.backend.modules.space.domain.SpaceState;

import org.junit.jupiter.api.Test;

class DownlinkFrameEncoderTest {

    private static final OffsetDateTime NOW = OffsetDateTime.parse("2026-03-01T09:00:00Z");

    @Test
    void encodesDisplayState() {
        assertThat(DownlinkFrameEncoder.encode(displayCommand(SpaceState.OCCUPIED)))
                .containsExactly(0x01, 0x02, 0x00);
        assertThat(DownlinkFrameEncoder.encode(displayCommand(SpaceState.RESERVED)))
                .containsExactly(0x01, 0x03, 0x01);
        assertThat(DownlinkFrameEncoder.encode(displayCommand(SpaceState.UNKNOWN)))
                .containsExactly(0x01, 0x05, 0x02);
    }

    @Test
    void encodesRebootAndRaw() {
        assertThat(DownlinkFrameEncoder.encode(command(DownlinkCommandType.REBOOT, Map.of())))
                .containsExactly(0x02);
        assertThat(DownlinkFrameEncoder.encode(command(DownlinkCommandType.RAW, Map.of("data", "CgsM"))))
                .containsExactly(0x0A, 0x0B, 0x0C);
        assertThatThrownBy(() -> DownlinkFrameEncoder.encode(command(DownlinkCommandType.RAW, Map.of())))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static DownlinkCommand displayCommand(SpaceState state) {
        return command(DownlinkCommandType.SET_DISPLAY, DisplayPolicy.forState(state).toPayload());
    }

    private static DownlinkCommand command(DownlinkCommandType type, Map<String, Object> payload) {
        return DownlinkCommand.queue(UUID.randomUUID(), UUID.randomUUID(), "0102030405060708", null, type,
                payload, DisplayPolicy.DISPLAY_UPDATE_PRIORITY, null, NOW);
    }
}
