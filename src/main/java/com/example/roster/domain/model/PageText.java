package com.example.roster.domain.model;

import java.util.List;

/**
 * Ordered text lines of one source page. Page numbers are 1-based.
 */
public record PageText(int pageNumber, List<String> lines) {

    public PageText {
        lines = lines == null ? List.of() : List.copyOf(lines);
    }

    /**
     * @return {@code true} when at least one line carries non-whitespace text
     */
    public boolean hasText() {
        return lines.stream().anyMatch(line -> !line.isBlank());
    }
}
