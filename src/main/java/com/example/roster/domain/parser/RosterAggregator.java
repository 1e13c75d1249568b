package com.example.roster.domain.parser;

import com.example.roster.domain.model.AssignmentRecord;
import com.example.roster.domain.model.MemberKey;
import com.example.roster.domain.model.RosterIndex;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Accumulates assignment records into the committee, subcommittee and member views.
 * Lists keep insertion order so numbered rosters stay in their printed ranking.
 * Not thread-safe; one instance per document pass unless the caller deliberately shares it across documents.
 */
public final class RosterAggregator {

    private final Map<String, List<MemberKey>> committees = new LinkedHashMap<>();
    private final Map<String, Map<String, List<MemberKey>>> subcommittees = new LinkedHashMap<>();
    private final Map<MemberKey, List<AssignmentRecord>> memberAssignments = new LinkedHashMap<>();
    private final Set<MemberKey> members = new LinkedHashSet<>();
    private final List<AssignmentRecord> assignments = new ArrayList<>();

    /**
     * Adds one record to every view it belongs to.
     *
     * @param record parsed assignment
     */
    public void record(AssignmentRecord record) {
        MemberKey member = record.member();
        if (record.isSubcommitteeSeat()) {
            subcommittees
                    .computeIfAbsent(record.committee(), key -> new LinkedHashMap<>())
                    .computeIfAbsent(record.subcommittee(), key -> new ArrayList<>())
                    .add(member);
        } else {
            committees.computeIfAbsent(record.committee(), key -> new ArrayList<>()).add(member);
        }
        memberAssignments.computeIfAbsent(member, key -> new ArrayList<>()).add(record);
        members.add(member);
        assignments.add(record);
    }

    public int size() {
        return assignments.size();
    }

    /**
     * Freezes the current content into an immutable snapshot. Later records do not affect it.
     *
     * @return snapshot with the member set sorted by label
     */
    public RosterIndex snapshot() {
        Map<String, List<MemberKey>> committeeCopy = new LinkedHashMap<>();
        committees.forEach((committee, keys) -> committeeCopy.put(committee, List.copyOf(keys)));

        Map<String, Map<String, List<MemberKey>>> subcommitteeCopy = new LinkedHashMap<>();
        subcommittees.forEach((committee, bySubcommittee) -> {
            Map<String, List<MemberKey>> inner = new LinkedHashMap<>();
            bySubcommittee.forEach((subcommittee, keys) -> inner.put(subcommittee, List.copyOf(keys)));
            subcommitteeCopy.put(committee, Collections.unmodifiableMap(inner));
        });

        Map<MemberKey, List<AssignmentRecord>> assignmentCopy = new LinkedHashMap<>();
        memberAssignments.forEach((member, records) -> assignmentCopy.put(member, List.copyOf(records)));

        List<MemberKey> sortedMembers = members.stream().sorted().toList();

        return new RosterIndex(
                Collections.unmodifiableMap(committeeCopy),
                Collections.unmodifiableMap(subcommitteeCopy),
                sortedMembers,
                Collections.unmodifiableMap(assignmentCopy),
                List.copyOf(assignments)
        );
    }
}
