package com.example.roster.interfaces.api;

import com.example.roster.application.exception.ApplicationException;
import com.example.roster.application.service.CsvExportService;
import com.example.roster.application.service.MemberSearchService;
import com.example.roster.application.service.RosterExtractionService;
import com.example.roster.domain.exception.DomainException;
import com.example.roster.domain.model.AssignmentRecord;
import com.example.roster.domain.model.PageInspection;
import com.example.roster.domain.model.RosterExtractionResult;
import com.example.roster.domain.model.RosterFeature;
import com.example.roster.infrastructure.exception.InfrastructureException;
import jakarta.servlet.http.HttpSession;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Controller;
import org.springframework.ui.Model;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseBody;
import org.springframework.web.multipart.MultipartFile;

import java.nio.charset.StandardCharsets;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Interfaces-layer MVC controller for roster uploads, CSV exports and the inspection endpoints.
 * The latest extraction is cached in the HTTP session so exports and searches can reuse it.
 */
@Controller
public class RosterUploadController {

    private static final String SESSION_RESULT_KEY = "LATEST_ROSTER_RESULT";
    private static final String SESSION_FEATURES_KEY = "LATEST_ROSTER_FEATURES";

    private final RosterExtractionService extractionService;
    private final CsvExportService csvExportService;
    private final MemberSearchService memberSearchService;

    public RosterUploadController(RosterExtractionService extractionService,
                                  CsvExportService csvExportService,
                                  MemberSearchService memberSearchService) {
        this.extractionService = extractionService;
        this.csvExportService = csvExportService;
        this.memberSearchService = memberSearchService;
    }

    /**
     * Renders the upload page and pre-populates it with any cached result from the session.
     *
     * @param model   model used to expose attributes to the Thymeleaf view
     * @param session HTTP session storing the last extraction result
     * @return upload view name
     */
    @GetMapping("/")
    public String showUploadForm(Model model, HttpSession session) {
        model.addAttribute("result", cachedResult(session));
        model.addAttribute("error", null);
        model.addAttribute("availableFeatures", RosterFeature.values());
        model.addAttribute("selectedFeatures", resolveSessionFeatures(session));
        return "upload";
    }

    /**
     * Handles form submissions. Failures are shown on the page instead of an error payload.
     *
     * @param file          uploaded roster PDF
     * @param featureParams selected feature list from the checkbox group (optional)
     * @param model         model used for view rendering
     * @param session       HTTP session for caching the result
     * @return upload view name populated with success or error data
     */
    @PostMapping("/extract")
    public String handleUpload(@RequestParam("file") MultipartFile file,
                               @RequestParam(value = "features", required = false) List<String> featureParams,
                               Model model,
                               HttpSession session) {
        EnumSet<RosterFeature> features = RosterFeature.fromStrings(featureParams);
        model.addAttribute("availableFeatures", RosterFeature.values());
        model.addAttribute("selectedFeatures", features);

        try {
            RosterExtractionResult result = extractionService.extract(file, features);
            cache(session, result, features);
            model.addAttribute("result", result);
            model.addAttribute("error", null);
        } catch (DomainException | ApplicationException ex) {
            model.addAttribute("result", null);
            model.addAttribute("error", ex.getMessage());
        } catch (InfrastructureException ex) {
            model.addAttribute("result", null);
            model.addAttribute("error", "We couldn't read that PDF. Please try another file.");
        }
        return "upload";
    }

    /**
     * JSON variant of the upload form.
     *
     * @param file          uploaded roster PDF
     * @param featureParams requested feature list (optional)
     * @param session       HTTP session for caching the result
     * @return extraction result
     */
    @PostMapping(value = "/api/extract", produces = MediaType.APPLICATION_JSON_VALUE)
    @ResponseBody
    public ResponseEntity<RosterExtractionResult> handleUploadApi(@RequestParam("file") MultipartFile file,
                                                                  @RequestParam(value = "features", required = false) List<String> featureParams,
                                                                  HttpSession session) {
        EnumSet<RosterFeature> features = RosterFeature.fromStrings(featureParams);
        RosterExtractionResult result = extractionService.extract(file, features);
        cache(session, result, features);
        return ResponseEntity.ok(result);
    }

    /**
     * Parses roster text posted as the request body; pages are separated by form feeds.
     *
     * @param text     roster text
     * @param fileName optional name reported in the result
     * @param session  HTTP session for caching the result
     * @return extraction result
     */
    @PostMapping(value = "/api/extract-text", consumes = MediaType.TEXT_PLAIN_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    @ResponseBody
    public ResponseEntity<RosterExtractionResult> handleTextApi(@RequestBody(required = false) String text,
                                                                @RequestParam(value = "fileName", required = false) String fileName,
                                                                HttpSession session) {
        RosterExtractionResult result = extractionService.extractFromText(fileName, text);
        cache(session, result, RosterFeature.allFeatures());
        return ResponseEntity.ok(result);
    }

    /**
     * Streams the assignment records of the cached result as a CSV download.
     *
     * @param committees committees to include; all when omitted
     * @param session    HTTP session storing the cached extraction result
     * @return CSV document
     */
    @PostMapping("/export")
    public ResponseEntity<byte[]> exportCsv(@RequestParam(name = "committees", required = false) List<String> committees,
                                            HttpSession session) {
        String csv = csvExportService.exportAssignments(cachedResult(session), committees);
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"committee-assignments.csv\"")
                .contentType(MediaType.TEXT_PLAIN)
                .body(csv.getBytes(StandardCharsets.UTF_8));
    }

    @GetMapping(value = "/api/members", produces = MediaType.APPLICATION_JSON_VALUE)
    @ResponseBody
    public ResponseEntity<List<AssignmentRecord>> searchMembers(@RequestParam("query") String query, HttpSession session) {
        return ResponseEntity.ok(memberSearchService.search(cachedResult(session), query));
    }

    /**
     * Lists heading lines and needle hits for chosen pages of an uploaded roster.
     *
     * @param file   uploaded roster PDF
     * @param pages  1-based pages to inspect (optional)
     * @param needle text to search for (optional)
     * @return one inspection per page
     */
    @PostMapping(value = "/api/inspect", produces = MediaType.APPLICATION_JSON_VALUE)
    @ResponseBody
    public ResponseEntity<List<PageInspection>> inspect(@RequestParam("file") MultipartFile file,
                                                        @RequestParam(value = "pages", required = false) List<Integer> pages,
                                                        @RequestParam(value = "needle", required = false) String needle) {
        return ResponseEntity.ok(extractionService.inspect(
                file,
                pages == null ? null : new LinkedHashSet<>(pages),
                needle));
    }

    private void cache(HttpSession session, RosterExtractionResult result, EnumSet<RosterFeature> features) {
        session.setAttribute(SESSION_RESULT_KEY, result);
        session.setAttribute(SESSION_FEATURES_KEY, features);
    }

    private RosterExtractionResult cachedResult(HttpSession session) {
        Object cached = session.getAttribute(SESSION_RESULT_KEY);
        return cached instanceof RosterExtractionResult result ? result : null;
    }

    /**
     * Resolves the cached feature selection stored in the session.
     *
     * @param session HTTP session
     * @return feature set ready to pre-populate checkboxes
     */
    private EnumSet<RosterFeature> resolveSessionFeatures(HttpSession session) {
        Object cached = session.getAttribute(SESSION_FEATURES_KEY);
        if (cached instanceof EnumSet<?> enumSet && !enumSet.isEmpty()) {
            EnumSet<RosterFeature> copy = EnumSet.noneOf(RosterFeature.class);
            enumSet.forEach(value -> {
                if (value instanceof RosterFeature feature) {
                    copy.add(feature);
                }
            });
            if (!copy.isEmpty()) {
                return copy;
            }
        }
        return RosterFeature.allFeatures();
    }
}
