package com.example.roster.domain.model;

/**
 * Result of classifying one roster line. {@code name} is set for the three header kinds,
 * {@code group} only for {@link LineKind#GROUP_MARKER}. A section header whose committee name
 * wrapped onto the following line has a {@code null} name.
 */
public record LineClassification(LineKind kind, String text, String name, Group group) {

    public static LineClassification blank(String text) {
        return new LineClassification(LineKind.BLANK, text, null, null);
    }

    public static LineClassification subcommitteeSection(String text, String committee) {
        return new LineClassification(LineKind.SUBCOMMITTEE_SECTION_HEADER, text, committee, null);
    }

    public static LineClassification committeeHeader(String text) {
        return new LineClassification(LineKind.COMMITTEE_HEADER, text, text, null);
    }

    public static LineClassification subcommitteeHeader(String text) {
        return new LineClassification(LineKind.SUBCOMMITTEE_HEADER, text, text, null);
    }

    public static LineClassification groupMarker(String text, Group group) {
        return new LineClassification(LineKind.GROUP_MARKER, text, null, group);
    }

    public static LineClassification noise(String text) {
        return new LineClassification(LineKind.SECTION_NOISE, text, null, null);
    }

    public static LineClassification candidate(String text) {
        return new LineClassification(LineKind.ASSIGNMENT_CANDIDATE, text, null, null);
    }
}
