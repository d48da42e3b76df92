package com.sc2.replay.summary;

import lombok.Value;

/**
 * One sample of a score-screen graph: a time in seconds and the value at that time.
 */
@Value
public class GraphPoint {
    long time;
    long value;
}
