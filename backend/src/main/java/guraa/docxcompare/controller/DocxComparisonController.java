package guraa.docxcompare.controller;

import guraa.docxcompare.core.MoveDetectionSettings;
import guraa.docxcompare.model.CompareOptions;
import guraa.docxcompare.model.CompareResult;
import guraa.docxcompare.model.CompareStats;
import guraa.docxcompare.model.ComparisonEngineType;
import guraa.docxcompare.model.ReconstructionMode;
import guraa.docxcompare.service.DocxComparisonService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;

/**
 * Controller for DOCX comparison operations.
 */
@Slf4j
@RestController
@RequestMapping("/api/docx")
@RequiredArgsConstructor
public class DocxComparisonController {

    static final MediaType DOCX_MEDIA_TYPE = MediaType.parseMediaType(
            "application/vnd.openxmlformats-officedocument.wordprocessingml.document");

    static final String HEADER_INSERTIONS = "X-Comparison-Insertions";
    static final String HEADER_DELETIONS = "X-Comparison-Deletions";
    static final String HEADER_MODIFICATIONS = "X-Comparison-Modifications";
    static final String HEADER_MOVES = "X-Comparison-Moves";
    static final String HEADER_FORMAT_CHANGES = "X-Comparison-Format-Changes";
    static final String HEADER_ENGINE = "X-Comparison-Engine";
    static final String HEADER_MODE_USED = "X-Reconstruction-Mode";
    static final String HEADER_FALLBACK_REASON = "X-Reconstruction-Fallback";

    private final DocxComparisonService comparisonService;

    /**
     * Compare two DOCX documents and return the document with track changes.
     *
     * @return The output document, with change counts in response headers
     */
    @PostMapping("/compare")
    public ResponseEntity<byte[]> compare(
            @RequestParam("original") MultipartFile original,
            @RequestParam("revised") MultipartFile revised,
            @RequestParam(value = "author", required = false) String author,
            @RequestParam(value = "engine", required = false) ComparisonEngineType engine,
            @RequestParam(value = "reconstructionMode", required = false) ReconstructionMode reconstructionMode,
            @RequestParam(value = "ignoreFormatting", required = false) Boolean ignoreFormatting,
            @RequestParam(value = "premergeRuns", required = false) Boolean premergeRuns,
            @RequestParam(value = "detectMoves", required = false) Boolean detectMoves) throws IOException {
        log.info("Received comparison request: original={}, revised={}",
                original.getOriginalFilename(), revised.getOriginalFilename());
        CompareOptions options = buildOptions(author, engine, reconstructionMode, ignoreFormatting, premergeRuns, detectMoves);
        CompareResult result = comparisonService.compareDocuments(original.getBytes(), revised.getBytes(), options);

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(DOCX_MEDIA_TYPE);
        headers.setContentDisposition(ContentDisposition.attachment().filename("comparison.docx").build());
        CompareStats stats = result.getStats();
        headers.add(HEADER_INSERTIONS, String.valueOf(stats.getInsertions()));
        headers.add(HEADER_DELETIONS, String.valueOf(stats.getDeletions()));
        headers.add(HEADER_MODIFICATIONS, String.valueOf(stats.getModifications()));
        headers.add(HEADER_MOVES, String.valueOf(stats.getMoves()));
        headers.add(HEADER_FORMAT_CHANGES, String.valueOf(stats.getFormatChanges()));
        headers.add(HEADER_ENGINE, result.getEngine().name());
        if (result.getReconstructionModeUsed() != null) {
            headers.add(HEADER_MODE_USED, result.getReconstructionModeUsed().name());
        }
        if (result.getFallbackReason() != null) {
            headers.add(HEADER_FALLBACK_REASON, result.getFallbackReason());
        }
        return ResponseEntity.ok().headers(headers).body(result.getDocument());
    }

    /**
     * Compare two DOCX documents and return only statistics and diagnostics.
     */
    @PostMapping("/compare/summary")
    public ResponseEntity<CompareResult> compareSummary(
            @RequestParam("original") MultipartFile original,
            @RequestParam("revised") MultipartFile revised,
            @RequestParam(value = "author", required = false) String author,
            @RequestParam(value = "engine", required = false) ComparisonEngineType engine,
            @RequestParam(value = "reconstructionMode", required = false) ReconstructionMode reconstructionMode,
            @RequestParam(value = "ignoreFormatting", required = false) Boolean ignoreFormatting,
            @RequestParam(value = "premergeRuns", required = false) Boolean premergeRuns,
            @RequestParam(value = "detectMoves", required = false) Boolean detectMoves) throws IOException {
        CompareOptions options = buildOptions(author, engine, reconstructionMode, ignoreFormatting, premergeRuns, detectMoves);
        return ResponseEntity.ok(comparisonService.compareDocuments(original.getBytes(), revised.getBytes(), options));
    }

    private CompareOptions buildOptions(String author, ComparisonEngineType engine, ReconstructionMode reconstructionMode,
                                        Boolean ignoreFormatting, Boolean premergeRuns, Boolean detectMoves) {
        CompareOptions options = comparisonService.optionsBuilder().build();
        if (author != null && !author.isBlank()) {
            options.setAuthor(author);
        }
        if (engine != null) {
            options.setEngine(engine);
        }
        if (reconstructionMode != null) {
            options.setReconstructionMode(reconstructionMode);
        }
        if (ignoreFormatting != null) {
            options.setIgnoreFormatting(ignoreFormatting);
        }
        if (premergeRuns != null) {
            options.setPremergeRuns(premergeRuns);
        }
        if (detectMoves != null) {
            MoveDetectionSettings moveDetection = options.getMoveDetection().toBuilder().build();
            moveDetection.setDetectMoves(detectMoves);
            options.setMoveDetection(moveDetection);
        }
        return options;
    }
}
