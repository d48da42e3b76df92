package com.sc2.replay.identity;

import lombok.Builder;
import lombok.Value;

/**
 * Per-player entry of the replay details block, as read by the details parser.
 */
@Value
@Builder
public class PlayerDetails {
    String name;
    BnetDetails bnet;
    String race;
    PlayerColor color;
    int handicap;
    /**
     * Raw result code, see {@link TeamResult#fromCode(int)}.
     */
    int result;
}
