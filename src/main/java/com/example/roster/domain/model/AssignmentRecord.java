package com.example.roster.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Domain DTO describing one committee seat parsed from a roster line.
 * Immutable once produced; {@code subcommittee} is {@code null} for main-committee seats.
 */
public record AssignmentRecord(
        String committee,
        String subcommittee,
        int rank,
        int page,
        Group group,
        String role,
        String sourceLine,
        MemberKey member
) {
    public static final int UNRANKED = 0;
    public static final String DEFAULT_ROLE = "Member";

    @JsonIgnore
    public boolean isSubcommitteeSeat() {
        return subcommittee != null;
    }
}
