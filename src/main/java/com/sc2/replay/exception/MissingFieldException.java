package com.sc2.replay.exception;

/**
 * A format template referenced a field the formatted object does not have.
 */
public class MissingFieldException extends ReplayCoreException {

    private static final long serialVersionUID = 1L;

    public MissingFieldException(String message, Throwable cause) {
        super(message, cause);
    }
}
