package com.example.roster.domain.model;

/**
 * Closed set of roles a single roster line can play during a scan.
 */
public enum LineKind {
    BLANK,
    SUBCOMMITTEE_SECTION_HEADER,
    COMMITTEE_HEADER,
    SUBCOMMITTEE_HEADER,
    GROUP_MARKER,
    SECTION_NOISE,
    ASSIGNMENT_CANDIDATE
}
