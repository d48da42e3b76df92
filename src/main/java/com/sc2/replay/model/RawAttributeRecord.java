package com.sc2.replay.model;

import java.util.Arrays;
import java.util.HexFormat;

import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;

/**
 * One attribute entry as split out of the replay's attribute block by the container parser.
 * The raw value still carries its trailing NUL padding.
 */
@Getter
@EqualsAndHashCode
public final class RawAttributeRecord {

    public static final int MAX_CODE = 0xFFFF;

    private final int header;
    private final int code;
    private final int ownerIndex;
    @Getter(AccessLevel.NONE)
    private final byte[] rawValue;

    public RawAttributeRecord(int header, int code, int ownerIndex, @NonNull byte[] rawValue) {
        if (code < 0 || code > MAX_CODE) {
            throw new IllegalArgumentException("Attribute code out of 16-bit range: " + code);
        }
        this.header = header;
        this.code = code;
        this.ownerIndex = ownerIndex;
        this.rawValue = rawValue.clone();
    }

    public byte[] getRawValue() {
        return rawValue.clone();
    }

    public int getRawLength() {
        return rawValue.length;
    }

    @Override
    public String toString() {
        return String.format("RawAttributeRecord[header=%d, code=0x%04X, owner=%d, value=%s]",
                header, code, ownerIndex, HexFormat.of().formatHex(rawValue));
    }

    /**
     * Copy of the value with every trailing NUL byte removed; interior NULs are kept.
     */
    public byte[] strippedValue() {
        int end = rawValue.length;
        while (end > 0 && rawValue[end - 1] == 0) {
            end--;
        }
        return Arrays.copyOf(rawValue, end);
    }
}
