package com.sc2.replay.identity;

/**
 * A person watching the game. Observers are always human and have no team or race.
 */
public class Observer extends Person {

    public Observer(int pid, String name) {
        super(pid, name, true);
        this.human = true;
    }

    @Override
    public String toString() {
        return "Observer " + getPid() + " - " + getName();
    }
}
