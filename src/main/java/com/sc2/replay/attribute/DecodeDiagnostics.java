package com.sc2.replay.attribute;

import java.util.ArrayList;
import java.util.List;

import lombok.Getter;

/**
 * Errors and warnings accumulated while decoding one replay's attribute block.
 *
 * Pure structure only: no logging, no formatting.
 */
@Getter
public class DecodeDiagnostics {
    private final List<String> errors = new ArrayList<>();
    private final List<String> warnings = new ArrayList<>();
    private int decoded;

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }

    void recordDecoded() {
        decoded++;
    }
}
