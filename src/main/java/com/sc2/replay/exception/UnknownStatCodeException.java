package com.sc2.replay.exception;

/**
 * A stats map held a key with no pretty name. Stats collectors validate keys before
 * storing them, so this indicates a defect upstream rather than bad input.
 */
public class UnknownStatCodeException extends ReplayCoreException {

    private static final long serialVersionUID = 1L;

    public UnknownStatCodeException(String statCode) {
        super("Unknown stat code: " + statCode);
    }
}
