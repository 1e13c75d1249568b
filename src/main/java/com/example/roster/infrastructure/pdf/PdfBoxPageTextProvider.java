package com.example.roster.infrastructure.pdf;

import com.example.roster.domain.model.PageText;
import com.example.roster.domain.parser.PageTextProvider;
import com.example.roster.infrastructure.exception.PdfProcessingException;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;

import java.io.IOException;
import java.util.stream.IntStream;
import java.util.stream.Stream;

/**
 * Serves the pages of an open {@link PDDocument} one at a time, in page order.
 * Text is extracted lazily as the stream is consumed; the caller keeps ownership of the document.
 */
public class PdfBoxPageTextProvider implements PageTextProvider {

    private final PDDocument document;
    private final String sourceName;

    public PdfBoxPageTextProvider(PDDocument document, String sourceName) {
        this.document = document;
        this.sourceName = sourceName;
    }

    @Override
    public Stream<PageText> pages() {
        PDFTextStripper stripper = createStripper();
        return IntStream.rangeClosed(1, document.getNumberOfPages())
                .mapToObj(pageNumber -> extractPage(stripper, pageNumber));
    }

    @Override
    public String sourceName() {
        return sourceName;
    }

    /**
     * Extracts a single page. A page without a text layer yields an empty line list.
     *
     * @param stripper   stripper reused across the pages of one stream
     * @param pageNumber 1-based page number
     * @return page lines in reading order
     * @throws PdfProcessingException when PDFBox fails on the page content
     */
    private PageText extractPage(PDFTextStripper stripper, int pageNumber) {
        stripper.setStartPage(pageNumber);
        stripper.setEndPage(pageNumber);
        try {
            String text = stripper.getText(document);
            return new PageText(pageNumber, text.lines().toList());
        } catch (IOException e) {
            throw PdfProcessingException.forPage(sourceName, pageNumber, e);
        }
    }

    private PDFTextStripper createStripper() {
        PDFTextStripper stripper = new PDFTextStripper();
        stripper.setSortByPosition(true);
        stripper.setShouldSeparateByBeads(true);
        stripper.setSuppressDuplicateOverlappingText(false);
        stripper.setLineSeparator("\n");
        return stripper;
    }
}
