package com.example.roster.infrastructure.pdf;

import com.example.roster.RosterPdfs;
import com.example.roster.domain.model.PageText;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

class PdfBoxPageTextProviderTest {

    @Test
    void servesOnePageTextPerPdfPageInOrder() throws Exception {
        byte[] pdf = RosterPdfs.createPdf("Roster", List.of("RULES\n1. Virginia Foxx, NC, Chairwoman", "", "BUDGET"));

        try (PDDocument document = Loader.loadPDF(pdf)) {
            PdfBoxPageTextProvider provider = new PdfBoxPageTextProvider(document, "roster.pdf");

            List<PageText> pages;
            try (Stream<PageText> stream = provider.pages()) {
                pages = stream.toList();
            }

            assertThat(provider.sourceName()).isEqualTo("roster.pdf");
            assertThat(pages).extracting(PageText::pageNumber).containsExactly(1, 2, 3);
            assertThat(pages.get(0).lines()).extracting(String::strip)
                    .containsSubsequence("RULES", "1. Virginia Foxx, NC, Chairwoman");
            assertThat(pages.get(1).hasText()).isFalse();
            assertThat(pages.get(2).lines()).extracting(String::strip).contains("BUDGET");
        }
    }

    @Test
    void pagesCanBeStreamedMoreThanOnce() throws Exception {
        byte[] pdf = RosterPdfs.createPdf("Roster", List.of("RULES", "BUDGET"));

        try (PDDocument document = Loader.loadPDF(pdf)) {
            PdfBoxPageTextProvider provider = new PdfBoxPageTextProvider(document, "roster.pdf");

            assertThat(provider.pages().count()).isEqualTo(2);
            assertThat(provider.pages().map(PageText::pageNumber).toList()).containsExactly(1, 2);
        }
    }
}
