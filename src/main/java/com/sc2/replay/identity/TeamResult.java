package com.sc2.replay.identity;

import lombok.Getter;

/**
 * Outcome of the game for a team.
 */
@Getter
public enum TeamResult {
    WIN("Win"),
    LOSS("Loss"),
    UNKNOWN("Unknown");

    private final String label;

    TeamResult(String label) {
        this.label = label;
    }

    /**
     * Map the result code found in replay details: 1 is a win, 2 a loss, anything else unknown.
     */
    public static TeamResult fromCode(int code) {
        return switch (code) {
            case 1 -> WIN;
            case 2 -> LOSS;
            default -> UNKNOWN;
        };
    }

    @Override
    public String toString() {
        return label;
    }
}
