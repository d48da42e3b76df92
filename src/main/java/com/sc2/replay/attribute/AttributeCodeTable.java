package com.sc2.replay.attribute;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import lombok.experimental.UtilityClass;

/**
 * Read-only index from numeric attribute code to {@link AttributeCode}.
 * Built once from the enum constants; safe for concurrent reads.
 */
@UtilityClass
public class AttributeCodeTable {

    private static final Map<Integer, AttributeCode> BY_CODE = index();

    public static Optional<AttributeCode> lookup(int code) {
        return Optional.ofNullable(BY_CODE.get(code));
    }

    public static boolean isKnown(int code) {
        return BY_CODE.containsKey(code);
    }

    public static Map<Integer, AttributeCode> entries() {
        return BY_CODE;
    }

    private static Map<Integer, AttributeCode> index() {
        Map<Integer, AttributeCode> map = new LinkedHashMap<>();
        for (AttributeCode code : AttributeCode.values()) {
            AttributeCode previous = map.put(code.getCode(), code);
            if (previous != null) {
                throw new IllegalStateException("Duplicate attribute code 0x"
                        + Integer.toHexString(code.getCode()) + ": " + previous + ", " + code);
            }
        }
        return Collections.unmodifiableMap(map);
    }
}
