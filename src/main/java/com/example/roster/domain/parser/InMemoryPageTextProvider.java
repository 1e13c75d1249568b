package com.example.roster.domain.parser;

import com.example.roster.domain.model.PageText;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * {@link PageTextProvider} over pages that are already split into lines.
 */
public final class InMemoryPageTextProvider implements PageTextProvider {

    private static final String PAGE_BREAK = "\f";

    private final String sourceName;
    private final List<PageText> pages;

    public InMemoryPageTextProvider(String sourceName, List<PageText> pages) {
        this.sourceName = sourceName;
        this.pages = pages == null ? List.of() : List.copyOf(pages);
    }

    /**
     * Splits plain text into pages on form feed characters and each page into lines.
     *
     * @param sourceName name reported in logs
     * @param text       roster text, pages separated by {@code \f}
     * @return provider with one page per form-feed separated block
     */
    public static InMemoryPageTextProvider fromText(String sourceName, String text) {
        if (text == null || text.isEmpty()) {
            return new InMemoryPageTextProvider(sourceName, List.of());
        }
        String[] blocks = text.split(PAGE_BREAK, -1);
        List<PageText> pages = new ArrayList<>(blocks.length);
        for (int i = 0; i < blocks.length; i++) {
            pages.add(new PageText(i + 1, blocks[i].lines().toList()));
        }
        return new InMemoryPageTextProvider(sourceName, pages);
    }

    /**
     * Builds a provider where each argument is the full text of one page.
     *
     * @param pageTexts page bodies in page order
     * @return provider numbering the pages from 1
     */
    public static InMemoryPageTextProvider ofPages(String... pageTexts) {
        List<PageText> pages = new ArrayList<>(pageTexts.length);
        for (int i = 0; i < pageTexts.length; i++) {
            pages.add(new PageText(i + 1, pageTexts[i].lines().toList()));
        }
        return new InMemoryPageTextProvider("in-memory", pages);
    }

    public int pageCount() {
        return pages.size();
    }

    @Override
    public Stream<PageText> pages() {
        return pages.stream();
    }

    @Override
    public String sourceName() {
        return sourceName;
    }
}
