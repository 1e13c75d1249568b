package com.example.roster.domain.parser;

import com.example.roster.domain.model.Group;
import com.example.roster.domain.model.LineClassification;
import com.example.roster.domain.model.LineKind;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for line classification and its ordering rules.
 */
class LineClassifierTest {

    private final LineClassifier classifier = new LineClassifier();

    @Test
    void blankAndWhitespaceLinesAreBlank() {
        assertThat(classifier.classify("", new ScanState()).kind()).isEqualTo(LineKind.BLANK);
        assertThat(classifier.classify("   \t", new ScanState()).kind()).isEqualTo(LineKind.BLANK);
        assertThat(classifier.classify(null, new ScanState()).kind()).isEqualTo(LineKind.BLANK);
    }

    @Test
    void subcommitteeSectionHeaderExtractsOwningCommittee() {
        LineClassification classification = classifier.classify("SUBCOMMITTEES OF THE COMMITTEE ON RULES", new ScanState());

        assertThat(classification.kind()).isEqualTo(LineKind.SUBCOMMITTEE_SECTION_HEADER);
        assertThat(classification.name()).isEqualTo("RULES");
    }

    @Test
    void subcommitteeSectionHeaderIsCaseInsensitiveAndAcceptsSingular() {
        LineClassification classification = classifier.classify("Subcommittee of the Committee on Ways and Means", new ScanState());

        assertThat(classification.kind()).isEqualTo(LineKind.SUBCOMMITTEE_SECTION_HEADER);
        assertThat(classification.name()).isEqualTo("Ways and Means");
    }

    @Test
    void truncatedSectionHeaderIsCompleted() {
        LineClassification classification = classifier.classify("SUBCOMMITTEES OF THE COMMITTEE ON SCIENCE, SPACE, AND", new ScanState());

        assertThat(classification.name()).isEqualTo("SCIENCE, SPACE, AND TECHNOLOGY");
    }

    @Test
    void sectionHeaderEndingAfterOnTakesCommitteeFromNextHeading() {
        ScanState state = new ScanState();
        state.apply(classifier.classify("RULES", state));

        LineClassification wrapped = classifier.classify("SUBCOMMITTEES OF THE COMMITTEE ON", state);
        state.apply(wrapped);
        LineClassification continuation = classifier.classify("RULES", state);
        state.apply(continuation);

        assertThat(wrapped.kind()).isEqualTo(LineKind.SUBCOMMITTEE_SECTION_HEADER);
        assertThat(wrapped.name()).isNull();
        assertThat(continuation.kind()).isEqualTo(LineKind.SUBCOMMITTEE_SECTION_HEADER);
        assertThat(continuation.name()).isEqualTo("RULES");
        assertThat(classifier.classify("LEGISLATIVE AND BUDGET PROCESS", state).kind()).isEqualTo(LineKind.SUBCOMMITTEE_HEADER);
    }

    @Test
    void committeeWordsStartingWithOnDoNotOpenASection() {
        assertThat(classifier.classify("SUBCOMMITTEES OF THE COMMITTEE ONE", new ScanState()).kind())
                .isNotEqualTo(LineKind.SUBCOMMITTEE_SECTION_HEADER);
    }

    @Test
    void allCapsLineOutsideSectionIsCommitteeHeader() {
        LineClassification classification = classifier.classify("  ENERGY AND COMMERCE  ", new ScanState());

        assertThat(classification.kind()).isEqualTo(LineKind.COMMITTEE_HEADER);
        assertThat(classification.name()).isEqualTo("ENERGY AND COMMERCE");
    }

    @Test
    void allCapsLineInsideSectionIsSubcommitteeHeader() {
        ScanState state = new ScanState();
        state.apply(classifier.classify("SUBCOMMITTEES OF THE COMMITTEE ON RULES", state));

        LineClassification classification = classifier.classify("LEGISLATIVE AND BUDGET PROCESS", state);

        assertThat(classification.kind()).isEqualTo(LineKind.SUBCOMMITTEE_HEADER);
        assertThat(classification.name()).isEqualTo("LEGISLATIVE AND BUDGET PROCESS");
    }

    @Test
    void shortAllCapsLineFallsThroughToCandidate() {
        assertThat(classifier.classify("XYZ", new ScanState()).kind()).isEqualTo(LineKind.ASSIGNMENT_CANDIDATE);
        assertThat(classifier.classify("AB", new ScanState()).kind()).isEqualTo(LineKind.ASSIGNMENT_CANDIDATE);
        assertThat(classifier.classify("XYZW", new ScanState()).kind()).isEqualTo(LineKind.COMMITTEE_HEADER);
    }

    @Test
    void subcommitteeLiteralPrefixIsNeverAHeading() {
        LineClassification classification = classifier.classify("SUBCOMMITTEE ASSIGNMENTS PENDING", new ScanState());

        assertThat(classification.kind()).isEqualTo(LineKind.ASSIGNMENT_CANDIDATE);
    }

    @Test
    void groupMarkersCarryTheirGroup() {
        LineClassification minority = classifier.classify("MINORITY", new ScanState());
        LineClassification majority = classifier.classify("MAJORITY MEMBERS", new ScanState());

        assertThat(minority.kind()).isEqualTo(LineKind.GROUP_MARKER);
        assertThat(minority.group()).isEqualTo(Group.MINORITY);
        assertThat(majority.group()).isEqualTo(Group.MAJORITY);
    }

    @Test
    void boilerplateIsNoise() {
        assertThat(classifier.classify("STANDING COMMITTEES", new ScanState()).kind()).isEqualTo(LineKind.SECTION_NOISE);
        assertThat(classifier.classify("ONE HUNDRED NINETEENTH CONGRESS", new ScanState()).kind()).isEqualTo(LineKind.SECTION_NOISE);
    }

    @Test
    void mixedCaseLinesAreCandidates() {
        assertThat(classifier.classify("1. Pete Sessions, TX", new ScanState()).kind()).isEqualTo(LineKind.ASSIGNMENT_CANDIDATE);
        assertThat(classifier.classify("Ratio 29/25", new ScanState()).kind()).isEqualTo(LineKind.ASSIGNMENT_CANDIDATE);
    }

    @Test
    void customNoisePhrasesReplaceDefaults() {
        LineClassifier custom = new LineClassifier(List.of("internal draft"));

        assertThat(custom.classify("INTERNAL DRAFT", new ScanState()).kind()).isEqualTo(LineKind.SECTION_NOISE);
        assertThat(custom.classify("STANDING COMMITTEES", new ScanState()).kind()).isEqualTo(LineKind.COMMITTEE_HEADER);
    }

    @Test
    void headingTestHandlesNonAsciiLetters() {
        assertThat(LineClassifier.isHeading("ÉDUCATION")).isTrue();
        assertThat(LineClassifier.isHeading("Éducation")).isFalse();
        assertThat(LineClassifier.isHeading("2025")).isFalse();
    }
}
