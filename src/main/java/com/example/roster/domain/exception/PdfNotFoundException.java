package com.example.roster.domain.exception;

/**
 * Raised when a roster PDF path does not exist on disk.
 */
public class PdfNotFoundException extends DomainException {

    private final String path;

	/**
	 * @param path absolute path that could not be resolved
	 */
    public PdfNotFoundException(String path) {
        super("Roster PDF not found: " + path);
        this.path = path;
    }

    public String getPath() {
        return path;
    }
}
