package com.sc2.replay.exception;

/**
 * Base class for every failure raised by the replay attribute core.
 */
public class ReplayCoreException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ReplayCoreException(String message) {
        super(message);
    }

    public ReplayCoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
