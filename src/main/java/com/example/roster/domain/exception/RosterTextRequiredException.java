package com.example.roster.domain.exception;

/**
 * Raised when the plain-text endpoint is called without any roster text.
 */
public class RosterTextRequiredException extends DomainException {

    public RosterTextRequiredException() {
        super("Roster text is required.");
    }
}
