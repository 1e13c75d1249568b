package com.example.roster.infrastructure.pdf;

import com.example.roster.domain.model.RosterDocumentMetadata;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDDocumentCatalog;
import org.apache.pdfbox.pdmodel.PDDocumentInformation;
import org.apache.pdfbox.pdmodel.common.PDMetadata;
import org.apache.xmpbox.XMPMetadata;
import org.apache.xmpbox.schema.DublinCoreSchema;
import org.apache.xmpbox.type.BadFieldValueException;
import org.apache.xmpbox.xml.DomXmpParser;
import org.apache.xmpbox.xml.XmpParsingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Calendar;
import java.util.HexFormat;

/**
 * Infrastructure service that turns PDFBox metadata into the provenance DTO returned with a roster.
 * The info dictionary wins; XMP is only consulted for a missing title.
 */
@Service
public class PdfBoxMetadataReader {

    private static final Logger log = LoggerFactory.getLogger(PdfBoxMetadataReader.class);
    private static final DateTimeFormatter CALENDAR_FORMATTER =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss z");

    /**
     * Reads the metadata of an open document.
     *
     * @param document already opened PDF document
     * @param bytes    raw file content, hashed for provenance
     * @return metadata or {@code null} when the document is missing
     */
    public RosterDocumentMetadata readMetadata(PDDocument document, byte[] bytes) {
        if (document == null) {
            return null;
        }
        PDDocumentInformation info = document.getDocumentInformation();
        String title = info != null ? info.getTitle() : null;
        if (title == null || title.isBlank()) {
            title = readXmpTitle(document.getDocumentCatalog());
        }

        return new RosterDocumentMetadata(
                title,
                info != null ? info.getAuthor() : null,
                info != null ? info.getProducer() : null,
                info != null ? formatCalendar(info.getCreationDate()) : null,
                document.getNumberOfPages(),
                String.valueOf(document.getDocument().getVersion()),
                document.isEncrypted(),
                bytes != null ? bytes.length : 0L,
                bytes != null ? sha256(bytes) : null
        );
    }

    private String readXmpTitle(PDDocumentCatalog catalog) {
        if (catalog == null || catalog.getMetadata() == null) {
            return null;
        }
        PDMetadata pdMetadata = catalog.getMetadata();
        try (InputStream metadataStream = pdMetadata.exportXMPMetadata()) {
            if (metadataStream == null) {
                return null;
            }
            DomXmpParser parser = new DomXmpParser();
            parser.setStrictParsing(false);
            XMPMetadata xmp = parser.parse(metadataStream);
            DublinCoreSchema dc = xmp.getDublinCoreSchema();
            return dc != null ? dc.getTitle() : null;
        } catch (IOException | XmpParsingException | BadFieldValueException ex) {
            log.warn("Failed to parse XMP metadata", ex);
            return null;
        }
    }

    private String formatCalendar(Calendar calendar) {
        if (calendar == null) {
            return null;
        }
        return CALENDAR_FORMATTER.format(calendar.toInstant().atZone(ZoneId.systemDefault()));
    }

    private static String sha256(byte[] bytes) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(bytes));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available on this JVM", e);
        }
    }
}
