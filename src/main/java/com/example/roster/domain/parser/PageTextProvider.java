package com.example.roster.domain.parser;

import com.example.roster.domain.model.PageText;

import java.util.stream.Stream;

/**
 * Source of linearized roster text, one entry per page in page order.
 * Every call to {@link #pages()} starts a new pass over the same pages.
 */
public interface PageTextProvider {

    /**
     * @return lazily produced pages; callers close the stream when done
     */
    Stream<PageText> pages();

    /**
     * @return short description of the source, used in logs and error messages
     */
    String sourceName();
}
