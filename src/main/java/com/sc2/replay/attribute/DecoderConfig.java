package com.sc2.replay.attribute;

import lombok.Builder;
import lombok.Data;

/**
 * Settings for a batch attribute decode.
 */
@Data
@Builder
public class DecoderConfig {

    /**
     * Rethrow the first record that fails to decode instead of recording it and moving on.
     */
    private boolean strict;

    /**
     * Keep attributes whose code is not in the code table, named "Unknown".
     */
    @Builder.Default
    private boolean keepUnknown = true;

    public static DecoderConfig defaults() {
        return DecoderConfig.builder().build();
    }
}
