package com.sc2.replay.identity.event;

/**
 * A game event attributed to a person. Produced and interpreted by the event stream
 * decoder; the identity model only stores them in order.
 */
public interface ReplayEvent {

    /**
     * Game loop frame the event happened on.
     */
    int getFrame();
}
