package com.sc2.replay.identity;

import lombok.Value;

/**
 * A player's color as an ARGB quadruple.
 */
@Value
public class PlayerColor {
    int a;
    int r;
    int g;
    int b;

    public PlayerColor(int a, int r, int g, int b) {
        this.a = channel("a", a);
        this.r = channel("r", r);
        this.g = channel("g", g);
        this.b = channel("b", b);
    }

    public String toHex() {
        return String.format("#%02X%02X%02X", r, g, b);
    }

    @Override
    public String toString() {
        return toHex();
    }

    private static int channel(String name, int value) {
        if (value < 0 || value > 255) {
            throw new IllegalArgumentException("Color channel " + name + " out of range: " + value);
        }
        return value;
    }
}
