package com.example.roster.domain.exception;

/**
 * Raised when an upload flow runs without a roster PDF attached.
 */
public class PdfFileRequiredException extends DomainException {

    public PdfFileRequiredException() {
        super("Please choose a roster PDF to upload.");
    }
}
