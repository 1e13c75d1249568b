package com.example.roster.domain.parser;

import com.example.roster.domain.model.AssignmentRecord;
import com.example.roster.domain.model.Group;
import com.example.roster.domain.model.MemberKey;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns a candidate member line into assignment records.
 * <p>
 * Two rules are tried in order and never combined on the same line:
 * <ol>
 *   <li>numbered entries such as {@code 3. Pete Sessions, TX}, possibly several per line;</li>
 *   <li>inside a subcommittee only, unnumbered {@code Name, ST} entries packed two per line, where the
 *       left column is the majority and every further entry the minority.</li>
 * </ol>
 * The column heuristic of the second rule is an approximation: the linearized text carries no other
 * signal about which side of the page an entry came from.
 * <p>
 * A rank longer than nine digits is not a rank; that entry is skipped and the rest of the line still parses.
 * The catch-all qualifier accepts any single word after the state, so in {@code Pete Sessions, TX, Juan Vargas, CA}
 * the word {@code Juan} is consumed as a qualifier and the second member comes out as {@code Vargas, CA}.
 * This is a known data-quality limit.
 */
public class MemberLineParser {

    private static final int MAX_RANK_DIGITS = 9;
    private static final String NAME = "[\\p{L}\\s.\\-'’]+?";
    private static final String NAME_SUFFIX = "(?:,\\s*(?:Jr\\.|Sr\\.|III|II|IV))?";
    private static final String STATE = "([A-Z]{2})";
    private static final String QUALIFIER =
            "(?:\\s*,\\s*(Ranking Member|Vice Chair(?:man|woman)?|Ex Officio|Chair(?:man|woman)?|\\p{L}+))?";

    static final Pattern NUMBERED_ENTRY_PATTERN = Pattern.compile(
            "(?<!\\d)(\\d{1," + MAX_RANK_DIGITS + "})\\.\\s*(" + NAME + NAME_SUFFIX + "),\\s*" + STATE + QUALIFIER);
    static final Pattern UNNUMBERED_ENTRY_PATTERN = Pattern.compile(
            "(\\p{Lu}" + NAME + NAME_SUFFIX + "),\\s*" + STATE + QUALIFIER);

    private static final Pattern ROLE_PATTERN = Pattern.compile(
            "Chair|Chairman|Chairwoman|Ranking Member|Vice Chair|Vice Chairman|Vice Chairwoman|Ex Officio",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+");
    private static final Pattern CASE_TRANSITION = Pattern.compile("(\\p{Ll})(\\p{Lu})");

    /**
     * Extracts every member entry of the line and binds it to the current committee context.
     *
     * @param line  trimmed candidate line
     * @param page  1-based page the line came from
     * @param state current scan context; must have a committee for any record to be produced
     * @return records in order of appearance, empty when the line is not a member line
     */
    public List<AssignmentRecord> parse(String line, int page, ScanState state) {
        if (line == null || line.isBlank() || !state.hasCommittee()) {
            return List.of();
        }
        List<AssignmentRecord> numbered = parseNumbered(line, page, state);
        if (!numbered.isEmpty()) {
            return numbered;
        }
        if (state.currentSubcommittee() == null) {
            return List.of();
        }
        return parseUnnumbered(line, page, state);
    }

    /**
     * @param line trimmed line
     * @return {@code true} when the line holds at least one numbered member entry
     */
    public boolean hasNumberedEntry(String line) {
        return line != null && NUMBERED_ENTRY_PATTERN.matcher(line).find();
    }

    private List<AssignmentRecord> parseNumbered(String line, int page, ScanState state) {
        List<AssignmentRecord> records = new ArrayList<>();
        Matcher matcher = NUMBERED_ENTRY_PATTERN.matcher(line);
        while (matcher.find()) {
            int rank = Integer.parseInt(matcher.group(1));
            String name = normalizeWhitespace(matcher.group(2));
            if (name.isEmpty()) {
                continue;
            }
            records.add(new AssignmentRecord(
                    state.currentCommittee(),
                    state.currentSubcommittee(),
                    rank,
                    page,
                    state.currentGroup(),
                    resolveRole(matcher.group(4)),
                    line,
                    new MemberKey(name, matcher.group(3))
            ));
        }
        return records;
    }

    private List<AssignmentRecord> parseUnnumbered(String line, int page, ScanState state) {
        List<AssignmentRecord> records = new ArrayList<>();
        Matcher matcher = UNNUMBERED_ENTRY_PATTERN.matcher(line);
        while (matcher.find()) {
            String name = repairConcatenation(normalizeWhitespace(matcher.group(1)));
            Group group = records.isEmpty() ? Group.MAJORITY : Group.MINORITY;
            records.add(new AssignmentRecord(
                    state.currentCommittee(),
                    state.currentSubcommittee(),
                    AssignmentRecord.UNRANKED,
                    page,
                    group,
                    resolveRole(matcher.group(3)),
                    line,
                    new MemberKey(name, matcher.group(2))
            ));
        }
        return records;
    }

    /**
     * Collapses whitespace runs to single spaces and trims the result.
     *
     * @param value raw name text
     * @return normalized name
     */
    static String normalizeWhitespace(String value) {
        if (value == null) {
            return "";
        }
        return WHITESPACE_RUN.matcher(value).replaceAll(" ").strip();
    }

    /**
     * Inserts a space at every lower-to-upper case transition, undoing words the text extraction glued together
     * ({@code PeteSessions} becomes {@code Pete Sessions}). Names spelled with an inner capital are split too.
     *
     * @param name whitespace-normalized name
     * @return repaired name
     */
    static String repairConcatenation(String name) {
        return CASE_TRANSITION.matcher(name).replaceAll("$1 $2");
    }

    private String resolveRole(String qualifier) {
        if (qualifier != null && ROLE_PATTERN.matcher(qualifier.strip()).matches()) {
            return qualifier.strip();
        }
        return AssignmentRecord.DEFAULT_ROLE;
    }
}
