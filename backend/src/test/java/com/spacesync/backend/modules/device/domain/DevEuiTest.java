package com.spacesync.backend.modules.device.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class DevEuiTest {

    @Test
    void normalizes() {
        assertThat(DevEui.normalize("A8-40-41-00-00-00-12-3F")).isEqualTo("a84041000000123f");
        assertThat(DevEui.normalize(" a8:40:41:00:00:00:12:3f ")).isEqualTo("a84041000000123f");
        assertThat(DevEui.normalize("A84041000000123F")).isEqualTo("a84041000000123f");
    }

    @Test
    void rejectsInvalid() {
        assertThatThrownBy(() -> DevEui.normalize("a84041")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> DevEui.normalize("g84041000000123f")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> DevEui.normalize(null)).isInstanceOf(IllegalArgumentException.class);
    }
}
