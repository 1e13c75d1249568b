package com.example.roster.domain.model;

import java.util.List;

/**
 * Debug view of one page: the heading lines it carries and the lines that mention a search needle.
 */
public record PageInspection(int pageNumber, List<String> headings, List<LineContext> matches) {

    /**
     * One matching line with its neighbours on the same page.
     *
     * @param lineNumber 1-based line number within the page
     * @param line       matching line
     * @param previous   line above, or {@code null} on the first line
     * @param next       line below, or {@code null} on the last line
     */
    public record LineContext(int lineNumber, String line, String previous, String next) {
    }
}
