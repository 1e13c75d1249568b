package com.example.roster.application.exception;

/**
 * A request that reached a use case but cannot be served, e.g. a member search before any roster was extracted.
 * Mapped to 400, except for the CSV export subtype.
 */
public class UseCaseValidationException extends ApplicationException {

    public UseCaseValidationException(String message) {
        super(message);
    }

    public static UseCaseValidationException noCachedRoster(String action) {
        return new UseCaseValidationException("Extract a roster before " + action + ".");
    }
}
