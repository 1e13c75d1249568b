package com.example.roster.domain.parser;

import com.example.roster.domain.exception.EmptyRosterDocumentException;
import com.example.roster.domain.model.AssignmentRecord;
import com.example.roster.domain.model.CommitteeType;
import com.example.roster.domain.model.LineClassification;
import com.example.roster.domain.model.PageText;
import com.example.roster.domain.model.RosterIndex;
import com.example.roster.domain.model.RosterScanReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Runs one strictly sequential pass over a roster: pages in order, lines in order, entries in order.
 * Committee context is carried forward from line to line and never rolled back.
 * <p>
 * A line that cannot be interpreted yields no record; only a source without any page, or a provider
 * that fails to deliver pages, ends the scan with an exception.
 */
public class RosterScanner {

    private static final Logger log = LoggerFactory.getLogger(RosterScanner.class);
    private static final int COVER_PAGE = 1;

    private final LineClassifier classifier;
    private final MemberLineParser memberLineParser;
    private final CoverDateExtractor coverDateExtractor;

    public RosterScanner() {
        this(new LineClassifier(), new MemberLineParser(), new CoverDateExtractor());
    }

    public RosterScanner(LineClassifier classifier, MemberLineParser memberLineParser, CoverDateExtractor coverDateExtractor) {
        this.classifier = classifier;
        this.memberLineParser = memberLineParser;
        this.coverDateExtractor = coverDateExtractor;
    }

    /**
     * Scans every page with a fresh {@link ScanState} and {@link RosterAggregator}.
     *
     * @param provider page source
     * @return aggregate views plus scan diagnostics
     * @throws EmptyRosterDocumentException when the provider delivers no page at all
     */
    public RosterScanReport scan(PageTextProvider provider) {
        return scan(provider, new RosterAggregator());
    }

    /**
     * Scans every page with a fresh {@link ScanState}, feeding records into the supplied aggregator.
     * Sharing an aggregator between documents unifies members across them.
     *
     * @param provider   page source
     * @param aggregator destination of the produced records
     * @return aggregate views of everything the aggregator holds, plus diagnostics of this pass
     * @throws EmptyRosterDocumentException when the provider delivers no page at all
     */
    public RosterScanReport scan(PageTextProvider provider, RosterAggregator aggregator) {
        ScanState state = new ScanState();
        Map<String, CommitteeType> committeeTypes = new LinkedHashMap<>();
        LocalDate sourceDate = null;
        int pagesSeen = 0;
        int pagesScanned = 0;
        int orphanMemberLines = 0;

        try (Stream<PageText> pages = provider.pages()) {
            Iterator<PageText> iterator = pages.iterator();
            while (iterator.hasNext()) {
                PageText page = iterator.next();
                pagesSeen++;
                if (!page.hasText()) {
                    log.debug("Page {} of {} has no text; skipping", page.pageNumber(), provider.sourceName());
                    continue;
                }
                pagesScanned++;
                if (page.pageNumber() == COVER_PAGE) {
                    sourceDate = coverDateExtractor.extract(page.lines());
                }
                for (String line : page.lines()) {
                    try {
                        if (scanLine(line, page.pageNumber(), state, aggregator, committeeTypes)) {
                            orphanMemberLines++;
                        }
                    } catch (RuntimeException ex) {
                        log.warn("Skipping unreadable line on page {}: '{}'", page.pageNumber(), line, ex);
                    }
                }
            }
        }

        if (pagesSeen == 0) {
            throw new EmptyRosterDocumentException(provider.sourceName());
        }

        RosterIndex index = aggregator.snapshot();
        log.info("Scanned {}: {} pages with text, {} skipped, {} committees, {} subcommittees, {} members, {} assignments",
                provider.sourceName(),
                pagesScanned,
                pagesSeen - pagesScanned,
                committeeTypes.size(),
                index.subcommitteeCount(),
                index.members().size(),
                index.assignments().size());

        return new RosterScanReport(
                index,
                Collections.unmodifiableMap(committeeTypes),
                sourceDate,
                pagesScanned,
                pagesSeen - pagesScanned,
                orphanMemberLines
        );
    }

    /**
     * Classifies one line, advances the state and records any member entries.
     *
     * @return {@code true} when the line held numbered members but no committee was open yet
     */
    private boolean scanLine(String line,
                             int pageNumber,
                             ScanState state,
                             RosterAggregator aggregator,
                             Map<String, CommitteeType> committeeTypes) {
        LineClassification classification = classifier.classify(line, state);
        state.apply(classification);

        switch (classification.kind()) {
            case SUBCOMMITTEE_SECTION_HEADER, COMMITTEE_HEADER -> {
                if (classification.name() != null) {
                    committeeTypes.putIfAbsent(classification.name(), CommitteeNames.typeOf(classification.name()));
                }
                log.debug("Page {}: {} -> {}", pageNumber, classification.kind(), classification.name());
            }
            case SUBCOMMITTEE_HEADER ->
                    log.debug("Page {}: subcommittee '{}' of {}", pageNumber, classification.name(), state.currentCommittee());
            case ASSIGNMENT_CANDIDATE -> {
                if (!state.hasCommittee()) {
                    return memberLineParser.hasNumberedEntry(classification.text());
                }
                List<AssignmentRecord> records = memberLineParser.parse(classification.text(), pageNumber, state);
                records.forEach(aggregator::record);
            }
            default -> {
                // blank lines, noise and group markers only affect the state
            }
        }
        return false;
    }
}
