package com.example.roster.application.exception;

import java.util.List;

/**
 * Raised when an assignment export cannot be produced from the cached roster.
 */
public class CsvExportValidationException extends UseCaseValidationException {

    public CsvExportValidationException(String message) {
        super(message);
    }

    public static CsvExportValidationException nothingToExport() {
        return new CsvExportValidationException("No parsed assignments available for export.");
    }

	/**
	 * @param committees committee names picked on the upload page
	 * @return exception naming the selection that matched no record
	 */
    public static CsvExportValidationException noMatchingCommittees(List<String> committees) {
        return new CsvExportValidationException("No assignments found for " + String.join("; ", committees) + ".");
    }
}
