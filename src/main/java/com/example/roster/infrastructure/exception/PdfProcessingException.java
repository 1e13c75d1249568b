package com.example.roster.infrastructure.exception;

/**
 * PDFBox could not open a roster document or read the text of one of its pages.
 * Fatal for that document.
 */
public class PdfProcessingException extends InfrastructureException {

    private static final int WHOLE_DOCUMENT = 0;

    private final int pageNumber;

	/**
	 * @param message description shared with the application layer
	 * @param cause   low-level PDFBox exception
	 */
    public PdfProcessingException(String message, Throwable cause) {
        this(message, WHOLE_DOCUMENT, cause);
    }

    private PdfProcessingException(String message, int pageNumber, Throwable cause) {
        super(message, cause);
        this.pageNumber = pageNumber;
    }

	/**
	 * @param sourceName document being read
	 * @param pageNumber 1-based page whose text extraction failed
	 * @param cause      low-level PDFBox exception
	 * @return exception tied to that page
	 */
    public static PdfProcessingException forPage(String sourceName, int pageNumber, Throwable cause) {
        return new PdfProcessingException("Unable to read page " + pageNumber + " of " + sourceName, pageNumber, cause);
    }

	/**
	 * @return failing page, or 0 when the document as a whole could not be read
	 */
    public int getPageNumber() {
        return pageNumber;
    }
}
