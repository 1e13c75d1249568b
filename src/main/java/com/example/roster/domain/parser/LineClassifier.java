package com.example.roster.domain.parser;

import com.example.roster.domain.model.Group;
import com.example.roster.domain.model.LineClassification;

import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Decides what a single roster line is: a subcommittee section header, a committee or subcommittee
 * heading, a majority/minority marker, boilerplate noise, or a candidate member line.
 * <p>
 * Checks run in a fixed order. Section headers are tested before the generic all-caps heading rule
 * because they are all-caps themselves, and boilerplate phrases are filtered before an all-caps line
 * is accepted as a heading.
 */
public class LineClassifier {

    public static final List<String> DEFAULT_NOISE_PHRASES = List.of(
            "STANDING COMMITTEES",
            "SELECT COMMITTEES",
            "JOINT COMMITTEES",
            "ALPHABETICAL LIST",
            "HOUSE OF REPRESENTATIVES",
            "ONE HUNDRED",
            "CONGRESS",
            "MAJORITY",
            "MINORITY",
            "DEMOCRATS",
            "REPUBLICANS",
            "RATIO",
            "WASHINGTON",
            "CONTENTS",
            "PREPARED UNDER"
    );

    private static final Pattern SUBCOMMITTEE_SECTION_PATTERN = Pattern.compile(
            "^SUBCOMMITTEES?\\s+OF\\s+THE\\s+COMMITTEE\\s+ON\\b\\s*(.*)$", Pattern.CASE_INSENSITIVE);
    private static final String SUBCOMMITTEE_PREFIX = "SUBCOMMITTEE";
    private static final String MAJORITY_MARKER = "MAJORITY";
    private static final String MINORITY_MARKER = "MINORITY";
    private static final int MIN_HEADING_LENGTH = 4;

    private final List<String> noisePhrases;

    public LineClassifier() {
        this(DEFAULT_NOISE_PHRASES);
    }

    /**
     * @param noisePhrases upper-case boilerplate phrases that disqualify an all-caps line as a heading
     */
    public LineClassifier(List<String> noisePhrases) {
        this.noisePhrases = noisePhrases == null || noisePhrases.isEmpty()
                ? DEFAULT_NOISE_PHRASES
                : noisePhrases.stream().map(phrase -> phrase.toUpperCase(Locale.ROOT)).toList();
    }

    /**
     * Classifies one line against the current scan context. The state is only read: a heading is a
     * subcommittee name while a subcommittee section of a known committee is open, otherwise it starts
     * a new main committee. A section header that ends right after {@code ON} has no committee name;
     * the next heading line then names the section's committee.
     *
     * @param rawLine line as delivered by the page text provider
     * @param state   context of the ongoing scan
     * @return classification carrying the trimmed line text
     */
    public LineClassification classify(String rawLine, ScanState state) {
        String line = rawLine == null ? "" : rawLine.strip();
        if (line.isEmpty()) {
            return LineClassification.blank(line);
        }

        Matcher sectionMatcher = SUBCOMMITTEE_SECTION_PATTERN.matcher(line);
        if (sectionMatcher.matches()) {
            String committee = sectionMatcher.group(1).strip();
            if (committee.isEmpty()) {
                // name wrapped onto the next heading line
                return LineClassification.subcommitteeSection(line, null);
            }
            return LineClassification.subcommitteeSection(line, CommitteeNames.completeTruncated(committee));
        }

        if (!isHeading(line) || line.startsWith(SUBCOMMITTEE_PREFIX)) {
            return LineClassification.candidate(line);
        }
        if (line.contains(MAJORITY_MARKER)) {
            return LineClassification.groupMarker(line, Group.MAJORITY);
        }
        if (line.contains(MINORITY_MARKER)) {
            return LineClassification.groupMarker(line, Group.MINORITY);
        }
        if (isNoise(line)) {
            return LineClassification.noise(line);
        }
        if (state.awaitingSectionCommittee()) {
            return LineClassification.subcommitteeSection(line, CommitteeNames.completeTruncated(line));
        }
        if (state.inSubcommitteeSection() && state.hasCommittee()) {
            return LineClassification.subcommitteeHeader(line);
        }
        return LineClassification.committeeHeader(line);
    }

    /**
     * Typographic heading test: longer than three characters, at least one letter, no lower-case letter.
     *
     * @param line trimmed line
     * @return {@code true} when the line looks like an all-caps heading
     */
    public static boolean isHeading(String line) {
        if (line == null || line.length() < MIN_HEADING_LENGTH) {
            return false;
        }
        boolean hasUpperCase = false;
        for (int i = 0; i < line.length(); ) {
            int codePoint = line.codePointAt(i);
            if (Character.isLowerCase(codePoint)) {
                return false;
            }
            if (Character.isUpperCase(codePoint)) {
                hasUpperCase = true;
            }
            i += Character.charCount(codePoint);
        }
        return hasUpperCase;
    }

    private boolean isNoise(String line) {
        for (String phrase : noisePhrases) {
            if (line.contains(phrase)) {
                return true;
            }
        }
        return false;
    }
}
