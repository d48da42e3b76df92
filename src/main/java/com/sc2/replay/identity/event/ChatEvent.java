package com.sc2.replay.identity.event;

/**
 * A chat message sent by a person during the game.
 */
public interface ChatEvent extends ReplayEvent {

    String getText();
}
