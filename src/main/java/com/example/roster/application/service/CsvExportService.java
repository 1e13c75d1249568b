package com.example.roster.application.service;

import com.example.roster.application.exception.CsvExportValidationException;
import com.example.roster.domain.model.AssignmentRecord;
import com.example.roster.domain.model.RosterExtractionResult;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Application-layer service that turns parsed assignment records into downloadable CSV content.
 */
@Service
public class CsvExportService {

    private static final String HEADER = "Committee,Subcommittee,Rank,Name,State,Group,Role,Page\n";

	/**
	 * Exports the assignment records of a cached extraction, optionally limited to some committees.
	 *
	 * @param extractionResult cached extraction result stored in the session
	 * @param committees       main committees selected on the UI; {@code null} or empty exports all of them
	 * @return CSV content ready to stream to the browser
	 * @throws CsvExportValidationException when no records are available or none match the selection
	 */
    public String exportAssignments(RosterExtractionResult extractionResult, List<String> committees) {
        if (extractionResult == null || extractionResult.assignments() == null || extractionResult.assignments().isEmpty()) {
            throw CsvExportValidationException.nothingToExport();
        }

        List<AssignmentRecord> selected = committees == null || committees.isEmpty()
                ? extractionResult.assignments()
                : extractionResult.assignments().stream()
                        .filter(record -> committees.contains(record.committee()))
                        .toList();
        if (selected.isEmpty()) {
            throw CsvExportValidationException.noMatchingCommittees(committees);
        }

        return buildCsv(selected);
    }

    private String buildCsv(List<AssignmentRecord> records) {
        StringBuilder builder = new StringBuilder(HEADER);
        for (AssignmentRecord record : records) {
            builder.append(escape(record.committee())).append(',')
                    .append(escape(record.subcommittee())).append(',')
                    .append(record.rank() == AssignmentRecord.UNRANKED ? "" : String.valueOf(record.rank())).append(',')
                    .append(escape(record.member().name())).append(',')
                    .append(escape(record.member().state())).append(',')
                    .append(record.group() != null ? record.group().label() : "").append(',')
                    .append(escape(record.role())).append(',')
                    .append(record.page())
                    .append('\n');
        }
        return builder.toString();
    }

	/**
	 * Quotes values containing commas, quotes or newlines.
	 *
	 * @param value raw column value
	 * @return CSV-safe token
	 */
    private String escape(String value) {
        if (value == null) {
            return "";
        }
        String sanitized = value.replace("\"", "\"\"");
        if (sanitized.contains(",") || sanitized.contains("\"") || sanitized.contains("\n")) {
            return "\"" + sanitized + "\"";
        }
        return sanitized;
    }
}
