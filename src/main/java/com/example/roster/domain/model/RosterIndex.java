package com.example.roster.domain.model;

import java.util.List;
import java.util.Map;

/**
 * Immutable snapshot of the aggregate views built from every assignment record of one scan.
 * Member lists keep document order; only {@code members} is sorted.
 *
 * @param committees        main committee -> member keys of main-committee seats
 * @param subcommittees     main committee -> subcommittee -> member keys
 * @param members           every distinct member key, sorted by label
 * @param memberAssignments member key -> that member's records in page order
 * @param assignments       all records in the order they were produced
 */
public record RosterIndex(
        Map<String, List<MemberKey>> committees,
        Map<String, Map<String, List<MemberKey>>> subcommittees,
        List<MemberKey> members,
        Map<MemberKey, List<AssignmentRecord>> memberAssignments,
        List<AssignmentRecord> assignments
) {

    public static RosterIndex empty() {
        return new RosterIndex(Map.of(), Map.of(), List.of(), Map.of(), List.of());
    }

    public int subcommitteeCount() {
        return subcommittees.values().stream().mapToInt(Map::size).sum();
    }
}
