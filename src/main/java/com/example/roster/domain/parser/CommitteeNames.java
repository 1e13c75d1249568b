package com.example.roster.domain.parser;

import com.example.roster.domain.model.CommitteeType;

import java.util.Locale;
import java.util.Map;

/**
 * Helpers for committee names as they come out of the roster headers.
 */
public final class CommitteeNames {

    // Section headers wrap before the last word of these committees.
    private static final Map<String, String> TRUNCATED_NAMES = Map.of(
            "OVERSIGHT AND", "OVERSIGHT AND ACCOUNTABILITY",
            "SCIENCE, SPACE, AND", "SCIENCE, SPACE, AND TECHNOLOGY",
            "EDUCATION AND THE", "EDUCATION AND THE WORKFORCE",
            "TRANSPORTATION AND", "TRANSPORTATION AND INFRASTRUCTURE"
    );

    private CommitteeNames() {
    }

    /**
     * Restores the full committee name when a subcommittee section header was cut by the line wrap.
     *
     * @param name committee name taken from a section header
     * @return full name, or the input when it is not a known truncation
     */
    public static String completeTruncated(String name) {
        if (name == null) {
            return null;
        }
        return TRUNCATED_NAMES.getOrDefault(name.toUpperCase(Locale.ROOT), name);
    }

    /**
     * @param name main committee name
     * @return committee kind implied by the name
     */
    public static CommitteeType typeOf(String name) {
        String upper = name == null ? "" : name.toUpperCase(Locale.ROOT);
        if (upper.contains("SELECT COMMITTEE")) {
            return CommitteeType.SELECT;
        }
        if (upper.contains("JOINT")) {
            return CommitteeType.JOINT;
        }
        return CommitteeType.STANDING;
    }
}
