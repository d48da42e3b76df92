package com.sc2.replay.identity;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.sc2.replay.identity.event.ChatEvent;
import com.sc2.replay.identity.event.ReplayEvent;

import lombok.Getter;
import lombok.NonNull;
import lombok.Setter;

/**
 * Someone present in the game, either playing or observing.
 * Never instantiated directly; see {@link Player} and {@link Observer}.
 */
@Getter
public abstract class Person {

    private final int pid;

    @Setter
    @NonNull
    private String name;

    private final boolean observer;

    protected boolean human;

    /**
     * Set once the message stream shows this person recorded the replay.
     */
    @Setter
    private boolean recorder;

    @Getter(lombok.AccessLevel.NONE)
    private final List<ChatEvent> messages = new ArrayList<>();

    @Getter(lombok.AccessLevel.NONE)
    private final List<ReplayEvent> events = new ArrayList<>();

    protected Person(int pid, @NonNull String name, boolean observer) {
        this.pid = pid;
        this.name = name;
        this.observer = observer;
    }

    public void addMessage(@NonNull ChatEvent message) {
        messages.add(message);
    }

    public void addEvent(@NonNull ReplayEvent event) {
        events.add(event);
    }

    public List<ChatEvent> getMessages() {
        return Collections.unmodifiableList(messages);
    }

    public List<ReplayEvent> getEvents() {
        return Collections.unmodifiableList(events);
    }
}
