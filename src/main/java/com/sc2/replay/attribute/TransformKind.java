package com.sc2.replay.attribute;

/**
 * How an attribute's stripped raw value turns into its decoded value.
 */
public enum TransformKind {
    /**
     * Keep the stripped string as is.
     */
    NONE,

    /**
     * Use the stripped string as a key into a secondary code table.
     */
    TABLE_LOOKUP,

    /**
     * Compute an integer from the stripped string.
     */
    COMPUTED
}
