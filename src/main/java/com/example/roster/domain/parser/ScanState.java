package com.example.roster.domain.parser;

import com.example.roster.domain.model.Group;
import com.example.roster.domain.model.LineClassification;

/**
 * Mutable context of one document pass: which committee, subcommittee and party group
 * the next member line belongs to. Created per scan and never shared between scans.
 */
public final class ScanState {

    private String currentCommittee;
    private String currentSubcommittee;
    private boolean inSubcommitteeSection;
    private boolean awaitingSectionCommittee;
    private Group currentGroup = Group.MAJORITY;

    /**
     * Advances the state for a classified line. Lines that carry no structure leave it untouched.
     *
     * @param classification classifier output for the line being consumed
     */
    public void apply(LineClassification classification) {
        switch (classification.kind()) {
            case SUBCOMMITTEE_SECTION_HEADER -> {
                if (classification.name() != null) {
                    currentCommittee = classification.name();
                }
                currentSubcommittee = null;
                inSubcommitteeSection = true;
                awaitingSectionCommittee = classification.name() == null;
            }
            case SUBCOMMITTEE_HEADER -> currentSubcommittee = classification.name();
            case COMMITTEE_HEADER -> {
                currentCommittee = classification.name();
                currentSubcommittee = null;
                inSubcommitteeSection = false;
                awaitingSectionCommittee = false;
                currentGroup = Group.MAJORITY;
            }
            case GROUP_MARKER -> currentGroup = classification.group();
            default -> {
                // blank, noise and member lines do not move the state
            }
        }
    }

    public String currentCommittee() {
        return currentCommittee;
    }

    public String currentSubcommittee() {
        return currentSubcommittee;
    }

    public boolean inSubcommitteeSection() {
        return inSubcommitteeSection;
    }

    /**
     * @return {@code true} after a section header whose committee name is still to come on a later line
     */
    public boolean awaitingSectionCommittee() {
        return awaitingSectionCommittee;
    }

    public Group currentGroup() {
        return currentGroup;
    }

    public boolean hasCommittee() {
        return currentCommittee != null;
    }

    @Override
    public String toString() {
        return "ScanState{committee=" + currentCommittee
                + ", subcommittee=" + currentSubcommittee
                + ", inSubcommitteeSection=" + inSubcommitteeSection
                + ", awaitingSectionCommittee=" + awaitingSectionCommittee
                + ", group=" + currentGroup + '}';
    }
}
