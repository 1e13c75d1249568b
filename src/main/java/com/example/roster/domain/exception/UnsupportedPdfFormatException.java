package com.example.roster.domain.exception;

/**
 * Raised when an upload is neither declared as {@code application/pdf} nor named {@code *.pdf}.
 */
public class UnsupportedPdfFormatException extends DomainException {

    public UnsupportedPdfFormatException(String fileName) {
        super(fileName == null
                ? "Rosters must be uploaded as PDF files."
                : "Rosters must be uploaded as PDF files, got: " + fileName);
    }
}
