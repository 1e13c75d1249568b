package com.example.roster.domain.model;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Domain DTO returned from {@code RosterExtractionService} to controllers.
 * Shaped for direct JSON serialization; optional parts are {@code null} when their feature was not requested.
 */
public record RosterExtractionResult(
        String fileName,
        int pageCount,
        LocalDate sourceDate,
        RunStatus status,
        List<String> warnings,
        Map<String, List<MemberKey>> committees,
        Map<String, Map<String, List<MemberKey>>> subcommittees,
        List<MemberKey> members,
        Map<MemberKey, List<AssignmentRecord>> memberAssignments,
        List<AssignmentRecord> assignments,
        Map<String, CommitteeType> committeeTypes,
        RosterDocumentMetadata documentMetadata,
        List<PageText> pageTexts
) {
}
