package guraa.docxcompare.reconstruction;

import guraa.docxcompare.util.WmlNodes;
import guraa.docxcompare.util.WmlXml;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Track Changes Simulator Tests")
class TrackChangesSimulatorTest {

    private static final String REVISION = "w:id=\"%d\" w:author=\"Comparison\" w:date=\"2024-01-01T00:00:00Z\"";

    private TrackChangesSimulator simulator;

    @BeforeEach
    void setUp() {
        simulator = new TrackChangesSimulator();
    }

    private static String attrs(int id) {
        return String.format(REVISION, id);
    }

    private static String text(Document document) {
        return TrackChangesSimulator.extractTextWithParagraphs(document);
    }

    @Test
    @DisplayName("Should keep insertions and drop deletions when accepting")
    void shouldProduceRevisedText_whenAcceptingAll() {
        Document document = WmlXml.fromBodyXml("<w:p><w:r><w:t xml:space=\"preserve\">Hello </w:t></w:r>"
                + "<w:del " + attrs(1) + "><w:r><w:delText>World</w:delText></w:r></w:del>"
                + "<w:ins " + attrs(2) + "><w:r><w:t>Word</w:t></w:r></w:ins></w:p>");

        Document accepted = simulator.acceptAll(document);

        assertThat(text(accepted)).isEqualTo("Hello Word");
        assertThat(WmlNodes.findAll(accepted.getDocumentElement(), WmlNodes.INS)).isEmpty();
        assertThat(WmlNodes.findAll(accepted.getDocumentElement(), WmlNodes.DEL)).isEmpty();
    }

    @Test
    @DisplayName("Should restore deleted text and drop insertions when rejecting")
    void shouldProduceOriginalText_whenRejectingAll() {
        Document document = WmlXml.fromBodyXml("<w:p><w:r><w:t xml:space=\"preserve\">Hello </w:t></w:r>"
                + "<w:del " + attrs(1) + "><w:r><w:delText>World</w:delText></w:r></w:del>"
                + "<w:ins " + attrs(2) + "><w:r><w:t>Word</w:t></w:r></w:ins></w:p>");

        Document rejected = simulator.rejectAll(document);

        assertThat(text(rejected)).isEqualTo("Hello World");
        assertThat(WmlNodes.findAll(rejected.getDocumentElement(), WmlNodes.DEL_TEXT)).isEmpty();
    }

    @Test
    @DisplayName("Should remove a whole inserted paragraph when rejecting")
    void shouldRemoveParagraph_whenParagraphMarkIsInserted() {
        Document document = WmlXml.fromBodyXml("<w:p><w:r><w:t>Kept</w:t></w:r></w:p>"
                + "<w:p><w:pPr><w:rPr><w:ins " + attrs(1) + "/></w:rPr></w:pPr>"
                + "<w:ins " + attrs(2) + "><w:r><w:t>Added</w:t></w:r></w:ins></w:p>");

        assertThat(text(simulator.rejectAll(document))).isEqualTo("Kept");
        assertThat(text(simulator.acceptAll(document))).isEqualTo("Kept\nAdded");
    }

    @Test
    @DisplayName("Should remove a whole deleted paragraph when accepting")
    void shouldRemoveParagraph_whenParagraphIsDeleted() {
        Document document = WmlXml.fromBodyXml("<w:p><w:pPr><w:rPr><w:del " + attrs(1) + "/></w:rPr></w:pPr>"
                + "<w:del " + attrs(2) + "><w:r><w:delText>Gone</w:delText></w:r></w:del></w:p>"
                + "<w:p><w:r><w:t>Kept</w:t></w:r></w:p>");

        assertThat(text(simulator.acceptAll(document))).isEqualTo("Kept");
        assertThat(text(simulator.rejectAll(document))).isEqualTo("Gone\nKept");
    }

    @Test
    @DisplayName("Should treat moves like deletions and insertions")
    void shouldResolveMoves_whenAcceptingAndRejecting() {
        Document document = WmlXml.fromBodyXml(
                "<w:p><w:moveFromRangeStart w:id=\"1\" w:name=\"move1\"/>"
                        + "<w:moveFrom " + attrs(2) + "><w:r><w:t>Moved</w:t></w:r></w:moveFrom>"
                        + "<w:moveFromRangeEnd w:id=\"1\"/></w:p>"
                        + "<w:p><w:r><w:t>Anchor</w:t></w:r></w:p>"
                        + "<w:p><w:moveToRangeStart w:id=\"3\" w:name=\"move1\"/>"
                        + "<w:moveTo " + attrs(4) + "><w:r><w:t>Moved</w:t></w:r></w:moveTo>"
                        + "<w:moveToRangeEnd w:id=\"3\"/></w:p>");

        assertThat(text(simulator.acceptAll(document))).isEqualTo("Anchor\nMoved");
        assertThat(text(simulator.rejectAll(document))).isEqualTo("Moved\nAnchor");
    }

    @Test
    @DisplayName("Should restore old run properties when rejecting a format change")
    void shouldRestoreRunProperties_whenRejectingFormatChange() {
        Document document = WmlXml.fromBodyXml("<w:p><w:r><w:rPr><w:i/>"
                + "<w:rPrChange " + attrs(1) + "><w:rPr><w:b/></w:rPr></w:rPrChange></w:rPr>"
                + "<w:t>Total</w:t></w:r></w:p>");

        Element rejectedRPr = WmlNodes.findAll(simulator.rejectAll(document).getDocumentElement(), WmlNodes.RPR).get(0);
        Element acceptedRPr = WmlNodes.findAll(simulator.acceptAll(document).getDocumentElement(), WmlNodes.RPR).get(0);

        assertThat(WmlNodes.findChild(rejectedRPr, "w:b")).isNotNull();
        assertThat(WmlNodes.findChild(rejectedRPr, "w:i")).isNull();
        assertThat(WmlNodes.findChild(acceptedRPr, "w:i")).isNotNull();
        assertThat(WmlNodes.findChild(acceptedRPr, WmlNodes.RPR_CHANGE)).isNull();
    }

    @Test
    @DisplayName("Should leave the input document untouched")
    void shouldNotModifyInput_whenSimulating() {
        Document document = WmlXml.fromBodyXml("<w:p><w:ins " + attrs(1) + "><w:r><w:t>New</w:t></w:r></w:ins></w:p>");

        simulator.acceptAll(document);
        simulator.rejectAll(document);

        assertThat(WmlNodes.findAll(document.getDocumentElement(), WmlNodes.INS)).hasSize(1);
    }

    @Test
    @DisplayName("Should keep a bookmark whose end survives a rejected paragraph")
    void shouldPreserveBookmark_whenCounterpartSurvives() {
        Document document = WmlXml.fromBodyXml(
                "<w:p><w:pPr><w:rPr><w:ins " + attrs(1) + "/></w:rPr></w:pPr>"
                        + "<w:bookmarkStart w:id=\"0\" w:name=\"span\"/>"
                        + "<w:ins " + attrs(2) + "><w:r><w:t>Added</w:t></w:r></w:ins></w:p>"
                        + "<w:p><w:r><w:t>Kept</w:t></w:r><w:bookmarkEnd w:id=\"0\"/></w:p>");

        Document rejected = simulator.rejectAll(document);

        assertThat(WmlNodes.findAll(rejected.getDocumentElement(), WmlNodes.BOOKMARK_START)).hasSize(1);
        assertThat(BookmarkDiagnostics.collect(rejected).getUnmatchedEndIds()).isEmpty();
    }

    @Test
    @DisplayName("Should normalize whitespace and blank lines")
    void shouldNormalizeText_whenComparing() {
        assertThat(TrackChangesSimulator.normalizeText("  a\t b \r\n\n\nc  ")).isEqualTo("a b\nc");
        assertThat(TrackChangesSimulator.compareTexts("a  b", "a b").isNormalizedIdentical()).isTrue();
        assertThat(TrackChangesSimulator.compareTexts("a  b", "a b").isIdentical()).isFalse();
        assertThat(TrackChangesSimulator.compareTexts("abc", "abd").getDifferences().get(0)).contains("position 2");
    }
}
