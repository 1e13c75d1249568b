package com.example.roster.application.service;

import com.example.roster.application.exception.UseCaseValidationException;
import com.example.roster.domain.model.AssignmentRecord;
import com.example.roster.domain.model.RosterExtractionResult;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Looks up the assignments of one member in a cached extraction, e.g. to check where a name ended up.
 */
@Service
public class MemberSearchService {

    /**
     * Returns the records whose member label contains every whitespace-separated token of the query,
     * ignoring case, ordered by page.
     *
     * @param extractionResult cached extraction result
     * @param query            e.g. {@code "sessions tx"}
     * @return matching records, possibly empty
     * @throws UseCaseValidationException when there is nothing to search or the query is blank
     */
    public List<AssignmentRecord> search(RosterExtractionResult extractionResult, String query) {
        if (extractionResult == null || extractionResult.assignments() == null) {
            throw UseCaseValidationException.noCachedRoster("searching members");
        }
        if (query == null || query.isBlank()) {
            throw new UseCaseValidationException("Search query is required.");
        }
        List<String> tokens = Arrays.stream(query.strip().split("\\s+"))
                .map(token -> token.toLowerCase(Locale.ROOT))
                .toList();

        return extractionResult.assignments().stream()
                .filter(record -> matches(record.member().label().toLowerCase(Locale.ROOT), tokens))
                .sorted(Comparator.comparingInt(AssignmentRecord::page))
                .toList();
    }

    private boolean matches(String label, List<String> tokens) {
        return tokens.stream().allMatch(label::contains);
    }
}
