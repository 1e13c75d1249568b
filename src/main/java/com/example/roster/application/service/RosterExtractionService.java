package com.example.roster.application.service;

import com.example.roster.config.RosterParserProperties;
import com.example.roster.domain.exception.EmptyRosterDocumentException;
import com.example.roster.domain.exception.PdfFileRequiredException;
import com.example.roster.domain.exception.PdfNotFoundException;
import com.example.roster.domain.exception.PdfPathRequiredException;
import com.example.roster.domain.exception.RosterTextRequiredException;
import com.example.roster.domain.exception.UnsupportedPdfFormatException;
import com.example.roster.domain.model.CommitteeType;
import com.example.roster.domain.model.PageInspection;
import com.example.roster.domain.model.PageText;
import com.example.roster.domain.model.RosterDocumentMetadata;
import com.example.roster.domain.model.RosterExtractionResult;
import com.example.roster.domain.model.RosterFeature;
import com.example.roster.domain.model.RosterIndex;
import com.example.roster.domain.model.RosterScanReport;
import com.example.roster.domain.model.RunStatus;
import com.example.roster.domain.parser.CoverDateExtractor;
import com.example.roster.domain.parser.InMemoryPageTextProvider;
import com.example.roster.domain.parser.LineClassifier;
import com.example.roster.domain.parser.MemberLineParser;
import com.example.roster.domain.parser.PageTextProvider;
import com.example.roster.domain.parser.RosterInspector;
import com.example.roster.domain.parser.RosterScanner;
import com.example.roster.infrastructure.exception.PdfProcessingException;
import com.example.roster.infrastructure.pdf.PdfBoxMetadataReader;
import com.example.roster.infrastructure.pdf.PdfBoxPageTextProvider;

import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Application-layer service that orchestrates committee roster extraction.
 * It validates inputs, opens documents through PDFBox, runs the roster scanner and grades the run.
 */
@Service
public class RosterExtractionService {

    private static final Logger log = LoggerFactory.getLogger(RosterExtractionService.class);

    private final PdfBoxMetadataReader metadataReader;
    private final RosterParserProperties properties;
    private final RosterScanner scanner;
    private final CoverDateExtractor coverDateExtractor = new CoverDateExtractor();
    private final RosterInspector inspector = new RosterInspector();

    /**
     * @param metadataReader helper turning PDFBox metadata into the provenance DTO
     * @param properties     parser tunables bound from {@code roster.parser.*}
     */
    public RosterExtractionService(PdfBoxMetadataReader metadataReader, RosterParserProperties properties) {
        this.metadataReader = metadataReader;
        this.properties = properties;
        this.scanner = new RosterScanner(
                new LineClassifier(properties.getNoisePhrases()),
                new MemberLineParser(),
                coverDateExtractor
        );
    }

    /**
     * Extracts every feature from the uploaded roster.
     *
     * @param file uploaded PDF file
     * @return extraction result
     */
    public RosterExtractionResult extract(MultipartFile file) {
        return extract(file, RosterFeature.allFeatures());
    }

    /**
     * Extracts only the requested features from the uploaded roster.
     *
     * @param file     uploaded file
     * @param features subset of {@link RosterFeature} to compute
     * @return extraction result containing only the requested payloads
     * @throws PdfFileRequiredException      when the file is null or empty
     * @throws UnsupportedPdfFormatException when the MIME type/name does not look like a PDF
     * @throws EmptyRosterDocumentException  when the PDF has no pages
     * @throws PdfProcessingException        when PDFBox cannot read the bytes
     */
    public RosterExtractionResult extract(MultipartFile file, Set<RosterFeature> features) {
        validateUpload(file);
        try {
            return extractInternal(file.getBytes(), resolveFileName(file), normalizeFeatures(features));
        } catch (IOException e) {
            throw new PdfProcessingException("Unable to process the uploaded PDF file.", e);
        }
    }

    public RosterExtractionResult extract(Path pdfPath) {
        return extract(pdfPath, RosterFeature.allFeatures());
    }

    /**
     * Reads a roster PDF from the filesystem and extracts the requested features.
     *
     * @param pdfPath  path pointing to a PDF file on disk
     * @param features subset of {@link RosterFeature}
     * @return extraction result containing only the requested payloads
     * @throws PdfPathRequiredException when {@code pdfPath} is null
     * @throws PdfNotFoundException     when the path does not exist
     * @throws PdfProcessingException   when the file cannot be read
     */
    public RosterExtractionResult extract(Path pdfPath, Set<RosterFeature> features) {
        if (pdfPath == null) {
            throw new PdfPathRequiredException();
        }
        if (!Files.exists(pdfPath)) {
            throw new PdfNotFoundException(pdfPath.toAbsolutePath().toString());
        }
        try {
            byte[] pdfBytes = Files.readAllBytes(pdfPath);
            String fileName = pdfPath.getFileName() != null ? pdfPath.getFileName().toString() : "roster.pdf";
            return extractInternal(pdfBytes, fileName, normalizeFeatures(features));
        } catch (IOException e) {
            throw new PdfProcessingException("Unable to process the PDF at " + pdfPath, e);
        }
    }

    /**
     * Runs the same pipeline over roster text that was extracted elsewhere.
     * Pages are separated by form feed characters.
     *
     * @param fileName logical name used for display and logging
     * @param text     roster text
     * @return extraction result without document metadata
     * @throws RosterTextRequiredException when the text is blank
     */
    public RosterExtractionResult extractFromText(String fileName, String text) {
        if (text == null || text.isBlank()) {
            throw new RosterTextRequiredException();
        }
        String sourceName = fileName == null || fileName.isBlank() ? "roster.txt" : fileName;
        InMemoryPageTextProvider provider = InMemoryPageTextProvider.fromText(sourceName, text);
        return buildResult(sourceName, provider.pageCount(), provider, RosterFeature.allFeatures(), null);
    }

    /**
     * Lists headings and needle hits for chosen pages of an uploaded roster.
     *
     * @param file   uploaded PDF file
     * @param pages  1-based pages to inspect, all pages when empty
     * @param needle text to look for, headings only when blank
     * @return one inspection per inspected page with text
     */
    public List<PageInspection> inspect(MultipartFile file, Set<Integer> pages, String needle) {
        validateUpload(file);
        try (PDDocument document = Loader.loadPDF(file.getBytes())) {
            return inspector.inspect(new PdfBoxPageTextProvider(document, resolveFileName(file)), pages, needle);
        } catch (IOException e) {
            throw new PdfProcessingException("Unable to process the uploaded PDF file.", e);
        }
    }

    private RosterExtractionResult extractInternal(byte[] bytes, String fileName, EnumSet<RosterFeature> features) throws IOException {
        try (PDDocument document = Loader.loadPDF(bytes)) {
            if (document.getNumberOfPages() == 0) {
                throw new EmptyRosterDocumentException(fileName);
            }
            RosterDocumentMetadata metadata = features.contains(RosterFeature.DOCUMENT_METADATA)
                    ? metadataReader.readMetadata(document, bytes)
                    : null;
            PdfBoxPageTextProvider provider = new PdfBoxPageTextProvider(document, fileName);
            return buildResult(fileName, document.getNumberOfPages(), provider, features, metadata);
        }
    }

    private RosterExtractionResult buildResult(String fileName,
                                               int pageCount,
                                               PageTextProvider provider,
                                               EnumSet<RosterFeature> features,
                                               RosterDocumentMetadata metadata) {
        RosterIndex index = RosterIndex.empty();
        Map<String, CommitteeType> committeeTypes = Map.of();
        LocalDate sourceDate = null;
        RunStatus status = null;
        List<String> warnings = List.of();

        if (features.contains(RosterFeature.MEMBER_ASSIGNMENTS)) {
            RosterScanReport report = scanner.scan(provider);
            index = report.index();
            committeeTypes = report.committeeTypes();
            sourceDate = report.sourceDate();
            warnings = evaluateRun(report);
            status = warnings.isEmpty() ? RunStatus.SUCCESS : RunStatus.DEGRADED;
            if (status == RunStatus.DEGRADED) {
                log.warn("Roster {} parsed with warnings: {}", fileName, String.join("; ", warnings));
            }
        } else if (features.contains(RosterFeature.COVER_DATE)) {
            sourceDate = readCoverDate(provider);
        }

        List<PageText> pageTexts = features.contains(RosterFeature.RAW_TEXT) ? readPages(provider) : null;

        return new RosterExtractionResult(
                fileName,
                pageCount,
                features.contains(RosterFeature.COVER_DATE) ? sourceDate : null,
                status,
                warnings,
                index.committees(),
                index.subcommittees(),
                index.members(),
                index.memberAssignments(),
                index.assignments(),
                committeeTypes,
                metadata,
                pageTexts
        );
    }

    /**
     * Grades a finished scan. Every warning marks the run as degraded; the data is returned regardless.
     *
     * @param report scan outcome
     * @return warnings in a stable order, empty for a clean run
     */
    List<String> evaluateRun(RosterScanReport report) {
        List<String> warnings = new ArrayList<>();
        int committeeCount = report.committeeTypes().size();
        if (committeeCount < properties.getMinimumCommittees()) {
            warnings.add(String.format(Locale.ROOT, "Only %d committees found (expected at least %d).",
                    committeeCount, properties.getMinimumCommittees()));
        }
        if (properties.isRequireSubcommittees() && report.index().subcommitteeCount() == 0) {
            warnings.add("No subcommittees found.");
        }
        if (report.orphanMemberLines() > 0) {
            warnings.add(String.format(Locale.ROOT, "%d member lines appeared before any committee header.",
                    report.orphanMemberLines()));
        }
        return List.copyOf(warnings);
    }

    private LocalDate readCoverDate(PageTextProvider provider) {
        try (Stream<PageText> pages = provider.pages()) {
            return pages.findFirst()
                    .map(page -> coverDateExtractor.extract(page.lines()))
                    .orElse(null);
        }
    }

    private List<PageText> readPages(PageTextProvider provider) {
        try (Stream<PageText> pages = provider.pages()) {
            return pages.toList();
        }
    }

    private void validateUpload(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new PdfFileRequiredException();
        }
        if (!looksLikePdf(file)) {
            throw new UnsupportedPdfFormatException(file.getOriginalFilename());
        }
    }

    private EnumSet<RosterFeature> normalizeFeatures(Set<RosterFeature> features) {
        if (features == null || features.isEmpty()) {
            return RosterFeature.allFeatures();
        }
        return features instanceof EnumSet<RosterFeature> enumSet
                ? enumSet.clone()
                : EnumSet.copyOf(features);
    }

    /**
     * Performs a lightweight PDF detection check based on MIME type and file name.
     *
     * @param file uploaded file
     * @return {@code true} when the content type or suffix indicates a PDF
     */
    private boolean looksLikePdf(MultipartFile file) {
        String contentType = file.getContentType();
        if (contentType != null && contentType.equalsIgnoreCase("application/pdf")) {
            return true;
        }
        String fileName = file.getOriginalFilename();
        return fileName != null && fileName.toLowerCase(Locale.ROOT).endsWith(".pdf");
    }

    private String resolveFileName(MultipartFile file) {
        String fileName = file.getOriginalFilename();
        if (fileName == null || fileName.isBlank()) {
            return "roster.pdf";
        }
        return fileName;
    }
}
