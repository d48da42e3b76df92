package com.sc2.replay.attribute;

import java.util.function.ToIntFunction;

import com.sc2.replay.codes.NamedCodeTable;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;

/**
 * Closed set of value transforms, discriminated by {@link TransformKind}.
 * Only the payload matching the kind is set.
 */
@Getter
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class ValueTransform {

    public static final ValueTransform NONE = new ValueTransform(TransformKind.NONE, null, null, null);

    /**
     * Integer value of the first character, as used by the team-count attributes.
     */
    public static final ValueTransform FIRST_DIGIT = computed("first digit", ValueTransform::firstDigit);

    private final TransformKind kind;
    private final NamedCodeTable table;
    private final String functionName;
    private final ToIntFunction<String> function;

    public static ValueTransform lookup(@NonNull NamedCodeTable table) {
        return new ValueTransform(TransformKind.TABLE_LOOKUP, table, null, null);
    }

    public static ValueTransform computed(@NonNull String name, @NonNull ToIntFunction<String> function) {
        return new ValueTransform(TransformKind.COMPUTED, null, name, function);
    }

    private static int firstDigit(String value) {
        if (value.isEmpty()) {
            throw new IllegalArgumentException("empty value has no first digit");
        }
        int digit = Character.digit(value.charAt(0), 10);
        if (digit < 0) {
            throw new IllegalArgumentException("'" + value.charAt(0) + "' is not a digit");
        }
        return digit;
    }

    @Override
    public String toString() {
        return switch (kind) {
            case NONE -> "none";
            case TABLE_LOOKUP -> "lookup(" + table.getName() + ")";
            case COMPUTED -> "computed(" + functionName + ")";
        };
    }
}
