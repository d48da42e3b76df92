package com.sc2.replay.summary;

import java.util.Optional;

import lombok.Getter;

/**
 * Short codes used as keys of the score-screen stats, with their labels.
 */
@Getter
public enum StatCode {
    RESOURCES("R", "Resources"),
    UNITS("U", "Units"),
    STRUCTURES("S", "Structures"),
    OVERVIEW("O", "Overview"),
    AVERAGE_UNSPENT_RESOURCES("AUR", "Average Unspent Resources"),
    RESOURCE_COLLECTION_RATE("RCR", "Resource Collection Rate"),
    WORKERS_CREATED("WC", "Workers Created"),
    UNITS_TRAINED("UT", "Units Trained"),
    KILLED_UNIT_COUNT("KUC", "Killed Unit Count"),
    STRUCTURES_BUILT("SB", "Structures Built"),
    STRUCTURES_RAZED_COUNT("SRC", "Structures Razed Count");

    private final String shortCode;
    private final String prettyName;

    StatCode(String shortCode, String prettyName) {
        this.shortCode = shortCode;
        this.prettyName = prettyName;
    }

    public static Optional<StatCode> fromShortCode(String shortCode) {
        for (StatCode code : values()) {
            if (code.shortCode.equals(shortCode)) {
                return Optional.of(code);
            }
        }
        return Optional.empty();
    }
}
