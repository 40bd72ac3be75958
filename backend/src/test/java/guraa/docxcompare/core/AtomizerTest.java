package guraa.docxcompare.core;

import guraa.docxcompare.util.WmlNodes;
import guraa.docxcompare.util.WmlXml;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.w3c.dom.Document;

import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Atomizer Tests")
class AtomizerTest {

    private Atomizer atomizer;

    @BeforeEach
    void setUp() {
        atomizer = new Atomizer();
    }

    private List<ComparisonUnitAtom> atomize(String bodyXml, AtomizerOptions options) {
        Document document = WmlXml.fromBodyXml(bodyXml);
        return atomizer.atomize(WmlNodes.findBody(document), "word/document.xml", options).getAtoms();
    }

    private static List<String> texts(List<ComparisonUnitAtom> atoms) {
        return atoms.stream().map(ComparisonUnitAtom::getText).collect(Collectors.toList());
    }

    @Test
    @DisplayName("Should split text into words keeping whitespace atoms")
    void shouldSplitIntoWords_whenSplittingIsEnabled() {
        List<ComparisonUnitAtom> atoms = atomize(
                "<w:p><w:r><w:t xml:space=\"preserve\">Hello World</w:t></w:r></w:p>", AtomizerOptions.defaults());

        assertThat(texts(atoms)).containsExactly("Hello", " ", "World");
        assertThat(atoms).allMatch(atom -> atom.getParagraphIndex() == 0);
    }

    @Test
    @DisplayName("Should split text whose only whitespace is a tab")
    void shouldSplitIntoWords_whenSeparatedByTabCharacter() {
        List<ComparisonUnitAtom> atoms = atomize(
                "<w:p><w:r><w:t xml:space=\"preserve\">Hello\tWorld</w:t></w:r></w:p>", AtomizerOptions.defaults());

        assertThat(texts(atoms)).containsExactly("Hello", "\t", "World");
    }

    @Test
    @DisplayName("Should join trailing punctuation to the preceding word across runs")
    void shouldMergePunctuation_whenItFollowsWordInAnotherRun() {
        String body = "<w:p><w:r><w:rPr><w:b/></w:rPr><w:t>Total</w:t></w:r>"
                + "<w:r><w:t xml:space=\"preserve\">, next</w:t></w:r></w:p>";

        List<ComparisonUnitAtom> atoms = atomize(body, AtomizerOptions.defaults());

        assertThat(texts(atoms)).containsExactly("Total,", " ", "next");
        assertThat(WmlNodes.findChild(atoms.get(0).getRunProperties(), "w:b")).isNotNull();
    }

    @Test
    @DisplayName("Should keep punctuation separate when merging it across runs is disabled")
    void shouldKeepPunctuationApart_whenMergingAcrossRunsIsDisabled() {
        String body = "<w:p><w:r><w:rPr><w:b/></w:rPr><w:t>Total</w:t></w:r>"
                + "<w:r><w:t xml:space=\"preserve\">, next</w:t></w:r></w:p>";
        AtomizerOptions options = AtomizerOptions.builder().mergePunctuationAcrossRuns(false).build();

        List<ComparisonUnitAtom> atoms = atomize(body, options);

        assertThat(texts(atoms)).containsExactly("Total", ",", " ", "next");
    }

    @Test
    @DisplayName("Should merge adjacent runs with equal properties before splitting")
    void shouldMergeAcrossRuns_whenPropertiesAreEqual() {
        List<ComparisonUnitAtom> atoms = atomize(
                "<w:p><w:r><w:rPr><w:b/></w:rPr><w:t>Hel</w:t></w:r>"
                        + "<w:r><w:rPr><w:b/></w:rPr><w:t>lo</w:t></w:r></w:p>",
                AtomizerOptions.defaults());

        assertThat(texts(atoms)).containsExactly("Hello");
    }

    @Test
    @DisplayName("Should keep runs apart when merging across runs is disabled")
    void shouldKeepRunsApart_whenMergeAcrossRunsIsDisabled() {
        List<ComparisonUnitAtom> atoms = atomize(
                "<w:p><w:r><w:t>Hel</w:t></w:r><w:r><w:t>lo</w:t></w:r></w:p>",
                AtomizerOptions.inPlaceRunLevel());

        assertThat(texts(atoms)).containsExactly("Hel", "lo");
    }

    @Test
    @DisplayName("Should represent an empty paragraph with one synthetic atom")
    void shouldCreateEmptyParagraphAtom_whenParagraphHasNoContent() {
        List<ComparisonUnitAtom> atoms = atomize(
                "<w:p><w:r><w:t>One</w:t></w:r></w:p><w:p/><w:p><w:r><w:t>Two</w:t></w:r></w:p>",
                AtomizerOptions.defaults());

        assertThat(atoms).hasSize(3);
        assertThat(atoms.get(1).isEmptyParagraph()).isTrue();
        assertThat(atoms.get(1).getTag()).isEqualTo(ComparisonUnitAtom.EMPTY_PARAGRAPH_TAG);
        assertThat(atoms).extracting(ComparisonUnitAtom::getParagraphIndex).containsExactly(0, 1, 2);
    }

    @Test
    @DisplayName("Should give empty paragraphs in different contexts different hashes")
    void shouldHashEmptyParagraphsByContext_whenPrecededByDifferentContent() {
        List<ComparisonUnitAtom> atoms = atomize(
                "<w:p><w:r><w:t>One</w:t></w:r></w:p><w:p/><w:p><w:r><w:t>Two</w:t></w:r></w:p><w:p/>",
                AtomizerOptions.defaults());

        assertThat(atoms.get(1).getHash()).isNotEqualTo(atoms.get(3).getHash());
    }

    @Test
    @DisplayName("Should collapse a single-paragraph field to its visible result")
    void shouldCollapseField_whenFieldStaysInOneParagraph() {
        List<ComparisonUnitAtom> atoms = atomize(
                "<w:p><w:r><w:t xml:space=\"preserve\">Page </w:t></w:r>"
                        + "<w:r><w:fldChar w:fldCharType=\"begin\"/></w:r>"
                        + "<w:r><w:instrText xml:space=\"preserve\"> PAGE </w:instrText></w:r>"
                        + "<w:r><w:fldChar w:fldCharType=\"separate\"/></w:r>"
                        + "<w:r><w:t>3</w:t></w:r>"
                        + "<w:r><w:fldChar w:fldCharType=\"end\"/></w:r></w:p>",
                AtomizerOptions.defaults());

        ComparisonUnitAtom field = atoms.get(atoms.size() - 1);
        assertThat(field.isCollapsedField()).isTrue();
        assertThat(field.getText()).isEqualTo("3");
        assertThat(field.getCollapsedFieldAtoms()).hasSize(5);
    }

    @Test
    @DisplayName("Should attach bookmark markers to neighbouring atoms")
    void shouldAttachBookmarks_whenMarkersSurroundText() {
        List<ComparisonUnitAtom> atoms = atomize(
                "<w:p><w:bookmarkStart w:id=\"0\" w:name=\"intro\"/><w:r><w:t>Intro</w:t></w:r>"
                        + "<w:bookmarkEnd w:id=\"0\"/></w:p>",
                AtomizerOptions.defaults());

        assertThat(atoms).hasSize(1);
        assertThat(atoms.get(0).getLeadingBookmarks()).hasSize(1);
        assertThat(atoms.get(0).getTrailingBookmarks()).hasSize(1);
    }

    @Test
    @DisplayName("Should seed statuses from revision wrappers already in the input")
    void shouldSeedStatus_whenAtomIsInsideRevisionWrapper() {
        List<ComparisonUnitAtom> atoms = atomize(
                "<w:p><w:ins w:id=\"1\" w:author=\"a\"><w:r><w:t>New</w:t></w:r></w:ins></w:p>",
                AtomizerOptions.defaults());

        assertThat(atoms.get(0).getCorrelationStatus()).isEqualTo(CorrelationStatus.INSERTED);
    }

    @Test
    @DisplayName("Should leave the source tree untouched when cloning leaf nodes")
    void shouldNotReferenceLiveNodes_whenCloningLeafNodes() {
        Document document = WmlXml.fromBodyXml("<w:p><w:r><w:t>Text</w:t></w:r></w:p>");
        List<ComparisonUnitAtom> atoms = atomizer.atomize(
                WmlNodes.findBody(document), "word/document.xml", AtomizerOptions.inPlaceRunLevel()).getAtoms();

        assertThat(atoms.get(0).getContentElement().getParentNode()).isNull();
        assertThat(atoms.get(0).getRun()).isNotNull();
    }
}
