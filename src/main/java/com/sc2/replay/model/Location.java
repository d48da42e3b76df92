package com.sc2.replay.model;

import lombok.Value;

/**
 * A map position in game coordinates.
 */
@Value
public class Location {
    int x;
    int y;
}
