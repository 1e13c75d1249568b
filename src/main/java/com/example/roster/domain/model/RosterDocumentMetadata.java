package com.example.roster.domain.model;

/**
 * Document-level provenance of an uploaded roster PDF.
 * Constructed by the PDFBox metadata reader and returned next to the parsed roster.
 */
public record RosterDocumentMetadata(
        String title,
        String author,
        String producer,
        String creationDate,
        int pageCount,
        String pdfVersion,
        boolean encrypted,
        long fileSizeBytes,
        String sha256
) {
}
