package guraa.docxcompare.service;

import guraa.docxcompare.exception.MalformedDocumentException;
import guraa.docxcompare.model.AttemptDiagnostics;
import guraa.docxcompare.model.CompareOptions;
import guraa.docxcompare.model.CompareResult;
import guraa.docxcompare.model.ComparisonEngineType;
import guraa.docxcompare.model.InPlacePass;
import guraa.docxcompare.model.ReconstructionMode;
import guraa.docxcompare.reconstruction.RoundTripSafetyChecker;
import guraa.docxcompare.reconstruction.SafetyCheckResult;
import guraa.docxcompare.reconstruction.TrackChangesSimulator;
import guraa.docxcompare.util.DocxPackage;
import guraa.docxcompare.util.WmlNodes;
import guraa.docxcompare.util.WmlXml;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.w3c.dom.Document;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static guraa.docxcompare.util.DocxFixtures.boldParagraph;
import static guraa.docxcompare.util.DocxFixtures.docxOf;
import static guraa.docxcompare.util.DocxFixtures.paragraph;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DisplayName("Atomizer Comparison Engine Tests")
class AtomizerComparisonEngineTest {

    private static final Instant DATE = Instant.parse("2024-05-01T08:00:00Z");

    private AtomizerComparisonEngine engine;
    private TrackChangesSimulator simulator;
    private CompareOptions options;

    @BeforeEach
    void setUp() {
        engine = new AtomizerComparisonEngine();
        simulator = new TrackChangesSimulator();
        options = CompareOptions.builder().author("Reviewer").date(DATE).build();
    }

    private String acceptedText(CompareResult result) throws IOException {
        return TrackChangesSimulator.extractTextWithParagraphs(
                simulator.acceptAll(DocxPackage.readMainDocument(result.getDocument())));
    }

    private String rejectedText(CompareResult result) throws IOException {
        return TrackChangesSimulator.extractTextWithParagraphs(
                simulator.rejectAll(DocxPackage.readMainDocument(result.getDocument())));
    }

    @Test
    @DisplayName("Should report one deletion and one insertion for a changed word")
    void shouldCountWordChange_whenOneWordDiffers() throws IOException {
        CompareResult result = engine.compare(
                docxOf(paragraph("Hello World")), docxOf(paragraph("Hello Word")), options);

        assertThat(result.getEngine()).isEqualTo(ComparisonEngineType.ATOMIZER);
        assertThat(result.getStats().getDeletions()).isEqualTo(1);
        assertThat(result.getStats().getInsertions()).isEqualTo(1);
        assertThat(result.getStats().getModifications()).isEqualTo(1);
        assertThat(result.getStats().getMoves()).isZero();
        assertThat(result.getReconstructionModeUsed()).isEqualTo(ReconstructionMode.REBUILD);
        assertThat(result.getFallbackReason()).isNull();
        assertThat(acceptedText(result)).isEqualTo("Hello Word");
        assertThat(rejectedText(result)).isEqualTo("Hello World");
    }

    @Test
    @DisplayName("Should stamp revisions with the configured author and date")
    void shouldUseAuthorAndDate_whenWritingRevisions() throws IOException {
        CompareResult result = engine.compare(
                docxOf(paragraph("Hello World")), docxOf(paragraph("Hello Word")), options);

        Document output = DocxPackage.readMainDocument(result.getDocument());
        assertThat(WmlNodes.findAll(output.getDocumentElement(), WmlNodes.INS))
                .allSatisfy(ins -> {
                    assertThat(ins.getAttribute(WmlNodes.ATTR_AUTHOR)).isEqualTo("Reviewer");
                    assertThat(ins.getAttribute(WmlNodes.ATTR_DATE)).isEqualTo("2024-05-01T08:00:00Z");
                });
    }

    @Test
    @DisplayName("Should count a relocated paragraph as one move")
    void shouldCountMove_whenParagraphIsRelocated() throws IOException {
        CompareResult result = engine.compare(
                docxOf(paragraph("Alpha Beta Gamma Delta Epsilon"), paragraph("Zeta Eta Theta Iota Kappa")),
                docxOf(paragraph("Zeta Eta Theta Iota Kappa"), paragraph("Alpha Beta Gamma Delta Epsilon")),
                options);

        assertThat(result.getStats().getMoves()).isEqualTo(1);
        assertThat(result.getStats().getInsertions()).isZero();
        assertThat(result.getStats().getDeletions()).isZero();
        assertThat(acceptedText(result)).isEqualTo("Zeta Eta Theta Iota Kappa\nAlpha Beta Gamma Delta Epsilon");
        assertThat(rejectedText(result)).isEqualTo("Alpha Beta Gamma Delta Epsilon\nZeta Eta Theta Iota Kappa");
    }

    @ParameterizedTest
    @EnumSource(ReconstructionMode.class)
    @DisplayName("Should keep a bookmark on a moved paragraph through accept and reject")
    void shouldKeepBookmark_whenBookmarkedParagraphMoves(ReconstructionMode mode) throws IOException {
        String clause = "<w:p><w:bookmarkStart w:id=\"0\" w:name=\"Clause\"/>"
                + "<w:r><w:t xml:space=\"preserve\">Alpha Beta Gamma Delta Epsilon</w:t></w:r>"
                + "<w:bookmarkEnd w:id=\"0\"/></w:p>";
        byte[] original = docxOf(paragraph("First clause text"), clause, paragraph("Closing words here"));
        byte[] revised = docxOf(paragraph("Intro text"), paragraph("First clause text"),
                paragraph("Closing words here"), clause);

        CompareResult result = engine.compare(original, revised,
                options.toBuilder().reconstructionMode(mode).build());

        assertThat(result.getStats().getMoves()).isPositive();
        assertThat(result.getReconstructionModeRequested()).isEqualTo(mode);
        Document output = DocxPackage.readMainDocument(result.getDocument());
        RoundTripSafetyChecker checker = new RoundTripSafetyChecker();
        SafetyCheckResult safety = checker.check(
                checker.baseline(DocxPackage.readMainDocument(original), DocxPackage.readMainDocument(revised)),
                output);
        assertThat(safety.getFailedChecks()).isEmpty();
        assertThat(safety.isSafe()).isTrue();
        assertThat(WmlNodes.findAll(simulator.rejectAll(output).getDocumentElement(), WmlNodes.BOOKMARK_START))
                .extracting(start -> start.getAttribute(WmlNodes.ATTR_NAME))
                .containsExactly("Clause");
        assertThat(WmlNodes.findAll(simulator.acceptAll(output).getDocumentElement(), WmlNodes.BOOKMARK_START))
                .extracting(start -> start.getAttribute(WmlNodes.ATTR_NAME))
                .containsExactly("Clause");
    }

    @Test
    @DisplayName("Should not report a move when move detection is disabled")
    void shouldReportInsertAndDelete_whenMoveDetectionIsOff() throws IOException {
        CompareOptions noMoves = options.toBuilder()
                .moveDetection(options.getMoveDetection().toBuilder().detectMoves(false).build())
                .build();

        CompareResult result = engine.compare(
                docxOf(paragraph("Alpha Beta Gamma Delta Epsilon"), paragraph("Zeta Eta Theta Iota Kappa")),
                docxOf(paragraph("Zeta Eta Theta Iota Kappa"), paragraph("Alpha Beta Gamma Delta Epsilon")),
                noMoves);

        assertThat(result.getStats().getMoves()).isZero();
        assertThat(result.getStats().getInsertions()).isPositive();
        assertThat(result.getStats().getDeletions()).isPositive();
    }

    @Test
    @DisplayName("Should report a format change when bold is removed")
    void shouldCountFormatChange_whenBoldIsRemoved() throws IOException {
        CompareResult result = engine.compare(docxOf(boldParagraph("Total")), docxOf(paragraph("Total")), options);

        assertThat(result.getStats().getFormatChanges()).isEqualTo(1);
        assertThat(result.getStats().getModifications()).isEqualTo(1);
        assertThat(result.getStats().getInsertions()).isZero();
        assertThat(result.getStats().getDeletions()).isZero();
    }

    @Test
    @DisplayName("Should skip format detection when formatting is ignored")
    void shouldIgnoreFormatChange_whenIgnoreFormattingIsSet() throws IOException {
        CompareResult result = engine.compare(docxOf(boldParagraph("Total")), docxOf(paragraph("Total")),
                options.toBuilder().ignoreFormatting(true).build());

        assertThat(result.getStats().getFormatChanges()).isZero();
        assertThat(result.getStats().getModifications()).isZero();
    }

    @Test
    @DisplayName("Should produce the same text with runs pre-merged")
    void shouldProduceSameText_whenPremergingRuns() throws IOException {
        byte[] original = docxOf("<w:p><w:r><w:t>Hel</w:t></w:r><w:r><w:t xml:space=\"preserve\">lo World</w:t></w:r></w:p>");
        byte[] revised = docxOf(paragraph("Hello Word"));

        CompareResult result = engine.compare(original, revised, options.toBuilder().premergeRuns(true).build());

        assertThat(acceptedText(result)).isEqualTo("Hello Word");
        assertThat(rejectedText(result)).isEqualTo("Hello World");
    }

    @Test
    @DisplayName("Should return either safe in-place output or a rebuild fallback")
    void shouldReturnResult_whenInPlaceIsRequested() throws IOException {
        CompareResult result = engine.compare(docxOf(paragraph("Hello World")), docxOf(paragraph("Hello Word")),
                options.toBuilder().reconstructionMode(ReconstructionMode.INPLACE).build());

        assertThat(result.getReconstructionModeRequested()).isEqualTo(ReconstructionMode.INPLACE);
        if (result.getReconstructionModeUsed() == ReconstructionMode.INPLACE) {
            assertThat(result.getFallbackReason()).isNull();
            assertThat(result.getFallbackDiagnostics()).isNull();
        } else {
            assertThat(result.getFallbackReason()).isEqualTo(CompareResult.FALLBACK_ROUND_TRIP_FAILED);
            assertThat(result.getFallbackDiagnostics().getAttempts()).hasSize(2);
        }
        assertThat(acceptedText(result)).isEqualTo("Hello Word");
        assertThat(rejectedText(result)).isEqualTo("Hello World");
    }

    @Test
    @DisplayName("Should fall back to rebuild with diagnostics when every in-place pass fails")
    void shouldFallBackToRebuild_whenSafetyChecksFail() throws IOException {
        RoundTripSafetyChecker checker = mock(RoundTripSafetyChecker.class);
        SafetyCheckResult unsafe = SafetyCheckResult.builder()
                .safe(false)
                .checks(Map.of(SafetyCheckResult.ACCEPT_TEXT, false))
                .failedChecks(List.of(SafetyCheckResult.ACCEPT_TEXT))
                .failureSummary(Map.of(SafetyCheckResult.ACCEPT_TEXT, Map.of("firstDifferingParagraphIndex", 0)))
                .build();
        when(checker.check(any(), any())).thenReturn(unsafe);
        AtomizerComparisonEngine failingEngine = new AtomizerComparisonEngine(checker);

        CompareResult result = failingEngine.compare(docxOf(paragraph("Hello World")), docxOf(paragraph("Hello Word")),
                options.toBuilder().reconstructionMode(ReconstructionMode.INPLACE).build());

        assertThat(result.getReconstructionModeUsed()).isEqualTo(ReconstructionMode.REBUILD);
        assertThat(result.getFallbackReason()).isEqualTo("round_trip_safety_check_failed");
        assertThat(result.getFallbackDiagnostics().getAttempts())
                .extracting(AttemptDiagnostics::getPass)
                .containsExactly(InPlacePass.INPLACE_WORD_SPLIT, InPlacePass.INPLACE_RUN_LEVEL);
        assertThat(result.getFallbackDiagnostics().getAttempts().get(0).getFailedChecks())
                .containsExactly(SafetyCheckResult.ACCEPT_TEXT);
        assertThat(rejectedText(result)).isEqualTo("Hello World");
    }

    @Test
    @DisplayName("Should reject bytes that are not a DOCX package")
    void shouldThrow_whenInputIsNotDocx() {
        byte[] garbage = "not a zip".getBytes(StandardCharsets.UTF_8);

        assertThatThrownBy(() -> engine.compare(garbage, garbage, options))
                .isInstanceOf(MalformedDocumentException.class);
    }

    @Test
    @DisplayName("Should reject a main document without a body")
    void shouldThrow_whenBodyIsMissing() throws IOException {
        byte[] valid = docxOf(paragraph("Text"));
        byte[] bodiless = DocxPackage.replaceMainDocument(valid,
                WmlXml.parse("<w:document xmlns:w=\"" + WmlNodes.W_NS + "\"/>"));

        assertThatThrownBy(() -> engine.compare(bodiless, valid, options))
                .isInstanceOf(MalformedDocumentException.class)
                .hasMessageContaining("original");
    }

    @Test
    @DisplayName("Should report no changes for identical documents")
    void shouldReportNoChanges_whenDocumentsAreIdentical() throws IOException {
        byte[] docx = docxOf(paragraph("Same"), paragraph(""), paragraph("Text"));

        CompareResult result = engine.compare(docx, docx, options);

        assertThat(result.getStats().getInsertions()).isZero();
        assertThat(result.getStats().getDeletions()).isZero();
        assertThat(result.getStats().getModifications()).isZero();
        Document output = DocxPackage.readMainDocument(result.getDocument());
        assertThat(WmlNodes.findAll(output.getDocumentElement(), WmlNodes.INS)).isEmpty();
        assertThat(WmlNodes.findAll(output.getDocumentElement(), WmlNodes.DEL)).isEmpty();
    }
}
