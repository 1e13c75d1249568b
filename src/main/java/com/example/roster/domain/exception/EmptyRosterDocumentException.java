package com.example.roster.domain.exception;

/**
 * Raised when a roster source has no pages at all. Fatal for that document; pages that merely
 * lack text are skipped instead.
 */
public class EmptyRosterDocumentException extends DomainException {

	/**
	 * @param source file name or description of the empty source
	 */
    public EmptyRosterDocumentException(String source) {
        super("Roster document has no pages: " + source);
    }
}
