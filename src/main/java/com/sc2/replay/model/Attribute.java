package com.sc2.replay.model;

import lombok.NonNull;
import lombok.Value;

/**
 * A decoded attribute. The value is either a {@link String} or an {@link Integer}
 * depending on the code's transform, and never ends in NUL characters.
 */
@Value
public class Attribute {

    public static final String UNKNOWN_NAME = "Unknown";

    int code;
    int ownerIndex;
    @NonNull
    String displayName;
    @NonNull
    Object value;

    public static Attribute ofString(int code, int ownerIndex, String displayName, String value) {
        return new Attribute(code, ownerIndex, displayName, value);
    }

    public static Attribute ofInteger(int code, int ownerIndex, String displayName, int value) {
        return new Attribute(code, ownerIndex, displayName, value);
    }

    public boolean isKnown() {
        return !UNKNOWN_NAME.equals(displayName);
    }

    public boolean isNumeric() {
        return value instanceof Integer;
    }

    public String getStringValue() {
        if (value instanceof String s) {
            return s;
        }
        throw new IllegalStateException(displayName + " holds an integer, not a string");
    }

    public int getIntValue() {
        if (value instanceof Integer i) {
            return i;
        }
        throw new IllegalStateException(displayName + " holds a string, not an integer");
    }

    @Override
    public String toString() {
        return "[" + ownerIndex + "] " + displayName + ": " + value;
    }
}
