package com.spacesync.backend.modules.downlink.domain;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

import com.spacesync.backend.modules.space.domain.SpaceState;

/**
 * Colour and pattern a display shows for each derived space state.
 */
public final class DisplayPolicy {

    public static final int DISPLAY_UPDATE_PRIORITY = 3;

    private static final Map<SpaceState, Instruction> POLICY = new EnumMap<>(SpaceState.class);

    static {
        POLICY.put(SpaceState.FREE, new Instruction(DisplayColor.GREEN, DisplayPattern.SOLID));
        POLICY.put(SpaceState.OCCUPIED, new Instruction(DisplayColor.RED, DisplayPattern.SOLID));
        POLICY.put(SpaceState.RESERVED, new Instruction(DisplayColor.BLUE, DisplayPattern.BLINK));
        POLICY.put(SpaceState.MAINTENANCE, new Instruction(DisplayColor.ORANGE, DisplayPattern.SOLID));
        POLICY.put(SpaceState.UNKNOWN, new Instruction(DisplayColor.YELLOW, DisplayPattern.SLOW_BLINK));
    }

    private DisplayPolicy() {
    }

    public static Instruction forState(SpaceState state) {
        return POLICY.get(state);
    }

    public record Instruction(DisplayColor color, DisplayPattern pattern) {

        public Map<String, Object> toPayload() {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("color", color.name().toLowerCase(Locale.ROOT));
            payload.put("pattern", pattern.name().toLowerCase(Locale.ROOT));
            return payload;
        }

        public static Instruction fromPayload(Map<String, Object> payload) {
            Object color = payload.get("color");
            Object pattern = payload.getOrDefault("pattern", "solid");
            if (color == null) {
                throw new IllegalArgumentException("payload.color is required");
            }
            return new Instruction(
                    DisplayColor.valueOf(color.toString().toUpperCase(Locale.ROOT)),
                    DisplayPattern.valueOf(pattern.toString().toUpperCase(Locale.ROOT))
            );
        }
    }
}
