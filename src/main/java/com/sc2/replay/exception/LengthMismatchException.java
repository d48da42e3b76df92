package com.sc2.replay.exception;

public class LengthMismatchException extends ReplayCoreException {

    private static final long serialVersionUID = 1L;

    public LengthMismatchException(int timesLength, int valuesLength) {
        super("Graph has " + timesLength + " times but " + valuesLength + " values");
    }
}
