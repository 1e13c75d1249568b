package com.example.roster.domain.parser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.Month;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the roster date printed on the cover page, e.g. {@code SEPTEMBER 16, 2025}.
 * The date may be glued to preceding text such as a URL.
 */
public class CoverDateExtractor {

    private static final Logger log = LoggerFactory.getLogger(CoverDateExtractor.class);
    private static final Pattern COVER_DATE_PATTERN = Pattern.compile(
            "(JANUARY|FEBRUARY|MARCH|APRIL|MAY|JUNE|JULY|AUGUST|SEPTEMBER|OCTOBER|NOVEMBER|DECEMBER)\\s+(\\d{1,2}),\\s+(\\d{4})",
            Pattern.CASE_INSENSITIVE);

    /**
     * @param coverLines lines of the cover page
     * @return first valid date on the page or {@code null}
     */
    public LocalDate extract(List<String> coverLines) {
        if (coverLines == null || coverLines.isEmpty()) {
            return null;
        }
        Matcher matcher = COVER_DATE_PATTERN.matcher(String.join("\n", coverLines));
        while (matcher.find()) {
            try {
                Month month = Month.valueOf(matcher.group(1).toUpperCase(Locale.ROOT));
                return LocalDate.of(Integer.parseInt(matcher.group(3)), month, Integer.parseInt(matcher.group(2)));
            } catch (DateTimeException ex) {
                log.warn("Ignoring invalid cover date '{}': {}", matcher.group(), ex.getMessage());
            }
        }
        log.debug("No cover date found on the first page");
        return null;
    }
}
