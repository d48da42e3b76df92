package com.sc2.replay.exception;

import java.util.List;

/**
 * A derived identity (such as a profile url) was read while some of the fields it is
 * built from are still unset. Holds every missing field, not just the first.
 */
public class IncompleteIdentityException extends ReplayCoreException {

    private static final long serialVersionUID = 1L;
    private final List<String> missingFields;

    public IncompleteIdentityException(String subject, List<String> missingFields) {
        super(subject + " is missing " + String.join(", ", missingFields));
        this.missingFields = List.copyOf(missingFields);
    }

    public List<String> getMissingFields() {
        return missingFields;
    }
}
