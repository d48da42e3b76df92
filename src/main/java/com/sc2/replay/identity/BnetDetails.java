package com.sc2.replay.identity;

import lombok.Value;

/**
 * Battle.net account coordinates of a player.
 */
@Value
public class BnetDetails {
    int subregion;
    long uid;
}
