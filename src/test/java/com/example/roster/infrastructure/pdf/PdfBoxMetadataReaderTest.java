package com.example.roster.infrastructure.pdf;

import com.example.roster.RosterPdfs;
import com.example.roster.domain.model.RosterDocumentMetadata;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.common.PDMetadata;
import org.apache.xmpbox.XMPMetadata;
import org.apache.xmpbox.schema.DublinCoreSchema;
import org.apache.xmpbox.xml.XmpSerializer;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PdfBoxMetadataReaderTest {

    private final PdfBoxMetadataReader reader = new PdfBoxMetadataReader();

    @Test
    void readsInfoDictionaryAndHashesContent() throws Exception {
        byte[] pdf = RosterPdfs.createPdf("Committee Assignments", List.of("RULES", "BUDGET"));

        try (PDDocument document = Loader.loadPDF(pdf)) {
            RosterDocumentMetadata metadata = reader.readMetadata(document, pdf);

            assertThat(metadata.title()).isEqualTo("Committee Assignments");
            assertThat(metadata.pageCount()).isEqualTo(2);
            assertThat(metadata.fileSizeBytes()).isEqualTo(pdf.length);
            assertThat(metadata.sha256()).hasSize(64).matches("[0-9a-f]+");
            assertThat(metadata.encrypted()).isFalse();
        }
    }

    @Test
    void fallsBackToXmpTitleWhenInfoTitleIsMissing() throws Exception {
        byte[] pdf = pdfWithXmpTitleOnly("Committee Assignments, 119th Congress");

        try (PDDocument document = Loader.loadPDF(pdf)) {
            RosterDocumentMetadata metadata = reader.readMetadata(document, pdf);

            assertThat(metadata.title()).isEqualTo("Committee Assignments, 119th Congress");
            assertThat(metadata.pageCount()).isEqualTo(1);
        }
    }

    @Test
    void sameBytesGiveSameHash() throws Exception {
        byte[] pdf = RosterPdfs.createPdf("Committee Assignments", List.of("RULES"));

        try (PDDocument first = Loader.loadPDF(pdf); PDDocument second = Loader.loadPDF(pdf)) {
            assertThat(reader.readMetadata(first, pdf).sha256()).isEqualTo(reader.readMetadata(second, pdf).sha256());
        }
    }

    @Test
    void missingDocumentYieldsNull() {
        assertThat(reader.readMetadata(null, new byte[0])).isNull();
    }

    private static byte[] pdfWithXmpTitleOnly(String title) throws Exception {
        try (PDDocument document = new PDDocument();
             ByteArrayOutputStream xmpBytes = new ByteArrayOutputStream();
             ByteArrayOutputStream pdfBytes = new ByteArrayOutputStream()) {
            document.addPage(new PDPage());

            XMPMetadata xmp = XMPMetadata.createXMPMetadata();
            DublinCoreSchema dublinCore = xmp.createAndAddDublinCoreSchema();
            dublinCore.setTitle(title);
            new XmpSerializer().serialize(xmp, xmpBytes, true);

            PDMetadata metadata = new PDMetadata(document);
            metadata.importXMPMetadata(xmpBytes.toByteArray());
            document.getDocumentCatalog().setMetadata(metadata);

            document.save(pdfBytes);
            return pdfBytes.toByteArray();
        }
    }
}
