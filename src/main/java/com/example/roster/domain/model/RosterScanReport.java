package com.example.roster.domain.model;

import java.time.LocalDate;
import java.util.Map;

/**
 * Everything a single scan pass learned about a roster document.
 *
 * @param index             aggregate views over the produced assignment records
 * @param committeeTypes    every main committee seen in a header, in first-seen order
 * @param sourceDate        roster date printed on the cover page, or {@code null}
 * @param pagesScanned      pages that carried text
 * @param pagesSkipped      pages without extractable text
 * @param orphanMemberLines numbered member lines met before any committee header
 */
public record RosterScanReport(
        RosterIndex index,
        Map<String, CommitteeType> committeeTypes,
        LocalDate sourceDate,
        int pagesScanned,
        int pagesSkipped,
        int orphanMemberLines
) {
}
