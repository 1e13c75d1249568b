package com.example.roster.domain.parser;

import com.example.roster.domain.model.Group;
import com.example.roster.domain.model.LineClassification;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ScanStateTest {

    @Test
    void startsEmptyWithMajority() {
        ScanState state = new ScanState();

        assertThat(state.hasCommittee()).isFalse();
        assertThat(state.currentSubcommittee()).isNull();
        assertThat(state.inSubcommitteeSection()).isFalse();
        assertThat(state.currentGroup()).isEqualTo(Group.MAJORITY);
    }

    @Test
    void sectionHeaderOpensSectionWithoutSubcommittee() {
        ScanState state = new ScanState();

        state.apply(LineClassification.subcommitteeSection("SUBCOMMITTEES OF THE COMMITTEE ON RULES", "RULES"));

        assertThat(state.currentCommittee()).isEqualTo("RULES");
        assertThat(state.inSubcommitteeSection()).isTrue();
        assertThat(state.currentSubcommittee()).isNull();
    }

    @Test
    void unnamedSectionHeaderKeepsCommitteeUntilTheNameArrives() {
        ScanState state = new ScanState();
        state.apply(LineClassification.committeeHeader("RULES"));

        state.apply(LineClassification.subcommitteeSection("SUBCOMMITTEES OF THE COMMITTEE ON", null));

        assertThat(state.currentCommittee()).isEqualTo("RULES");
        assertThat(state.inSubcommitteeSection()).isTrue();
        assertThat(state.awaitingSectionCommittee()).isTrue();

        state.apply(LineClassification.subcommitteeSection("RULES", "RULES"));

        assertThat(state.awaitingSectionCommittee()).isFalse();
    }

    @Test
    void committeeHeaderResetsSubcommitteeSectionAndGroup() {
        ScanState state = new ScanState();
        state.apply(LineClassification.subcommitteeSection("SUBCOMMITTEES OF THE COMMITTEE ON RULES", "RULES"));
        state.apply(LineClassification.subcommitteeHeader("LEGISLATIVE AND BUDGET PROCESS"));
        state.apply(LineClassification.groupMarker("MINORITY", Group.MINORITY));

        state.apply(LineClassification.committeeHeader("BUDGET"));

        assertThat(state.currentCommittee()).isEqualTo("BUDGET");
        assertThat(state.currentSubcommittee()).isNull();
        assertThat(state.inSubcommitteeSection()).isFalse();
        assertThat(state.currentGroup()).isEqualTo(Group.MAJORITY);
    }

    @Test
    void sectionHeaderKeepsTheGroup() {
        ScanState state = new ScanState();
        state.apply(LineClassification.committeeHeader("RULES"));
        state.apply(LineClassification.groupMarker("MINORITY", Group.MINORITY));

        state.apply(LineClassification.subcommitteeSection("SUBCOMMITTEES OF THE COMMITTEE ON RULES", "RULES"));

        assertThat(state.currentGroup()).isEqualTo(Group.MINORITY);
    }

    @Test
    void candidatesNoiseAndBlanksLeaveStateUntouched() {
        ScanState state = new ScanState();
        state.apply(LineClassification.committeeHeader("RULES"));
        String before = state.toString();

        state.apply(LineClassification.candidate("1. Pete Sessions, TX"));
        state.apply(LineClassification.noise("STANDING COMMITTEES"));
        state.apply(LineClassification.blank(""));

        assertThat(state).hasToString(before);
    }
}
