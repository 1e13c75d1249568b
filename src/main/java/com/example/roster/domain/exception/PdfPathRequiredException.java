package com.example.roster.domain.exception;

/**
 * Raised when a caller asks to extract a roster from a null {@link java.nio.file.Path}.
 */
public class PdfPathRequiredException extends DomainException {

    public PdfPathRequiredException() {
        super("PDF path is required.");
    }
}
