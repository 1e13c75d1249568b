package com.example.roster.domain.parser;

import com.example.roster.domain.model.PageInspection;
import com.example.roster.domain.model.PageText;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Debug helper that dumps headings and needle hits for selected pages of a roster,
 * for checking by eye why a member landed under a given committee.
 */
public class RosterInspector {

    /**
     * @param provider page source
     * @param pages    1-based page numbers to inspect; {@code null} or empty inspects every page
     * @param needle   case-sensitive text to look for; {@code null} or blank reports headings only
     * @return one entry per inspected page that carries text
     */
    public List<PageInspection> inspect(PageTextProvider provider, Set<Integer> pages, String needle) {
        boolean allPages = pages == null || pages.isEmpty();
        boolean searching = needle != null && !needle.isBlank();
        List<PageInspection> inspections = new ArrayList<>();

        try (Stream<PageText> stream = provider.pages()) {
            stream.filter(page -> allPages || pages.contains(page.pageNumber()))
                    .filter(PageText::hasText)
                    .forEach(page -> inspections.add(inspectPage(page, searching ? needle : null)));
        }
        return inspections;
    }

    private PageInspection inspectPage(PageText page, String needle) {
        List<String> lines = page.lines();
        List<String> headings = new ArrayList<>();
        List<PageInspection.LineContext> matches = new ArrayList<>();
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i).strip();
            if (LineClassifier.isHeading(line)) {
                headings.add(line);
            }
            if (needle != null && line.contains(needle)) {
                String previous = i > 0 ? lines.get(i - 1).strip() : null;
                String next = i < lines.size() - 1 ? lines.get(i + 1).strip() : null;
                matches.add(new PageInspection.LineContext(i + 1, line, previous, next));
            }
        }
        return new PageInspection(page.pageNumber(), List.copyOf(headings), List.copyOf(matches));
    }
}
