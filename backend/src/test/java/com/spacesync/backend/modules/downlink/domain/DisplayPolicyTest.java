package com.spacesync.backend.modules.downlink.domain;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Map;

import com.spacesync.backend.modules.downlink.domain.DisplayPolicy.Instruction;
import com.spacesync.backend.modules.space.domain.SpaceState;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

class DisplayPolicyTest {

    @ParameterizedTest
    @EnumSource(SpaceState.class)
    void everyStateMapped(SpaceState state) {
        assertThat(DisplayPolicy.forState(state)).isNotNull();
    }

    @Test
    void colours() {
        assertThat(DisplayPolicy.forState(SpaceState.FREE)).isEqualTo(new Instruction(DisplayColor.GREEN, DisplayPattern.SOLID));
        assertThat(DisplayPolicy.forState(SpaceState.OCCUPIED)).isEqualTo(new Instruction(DisplayColor.RED, DisplayPattern.SOLID));
        assertThat(DisplayPolicy.forState(SpaceState.MAINTENANCE).color()).isEqualTo(DisplayColor.ORANGE);
    }

    @Test
    void payloadForm() {
        assertThat(DisplayPolicy.forState(SpaceState.RESERVED).toPayload())
                .containsEntry("color", "blue")
                .containsEntry("pattern", "blink");
        assertThat(Instruction.fromPayload(Map.of("color", "white")))
                .isEqualTo(new Instruction(DisplayColor.WHITE, DisplayPattern.SOLID));
    }
}
