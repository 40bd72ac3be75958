package guraa.docxcompare.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static guraa.docxcompare.core.CorrelationFixture.correlated;
import static guraa.docxcompare.core.CorrelationFixture.paragraph;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Hierarchical Correlator Tests")
class HierarchicalCorrelatorTest {

    private static List<String> withStatus(List<ComparisonUnitAtom> atoms, CorrelationStatus status) {
        return atoms.stream()
                .filter(atom -> atom.getCorrelationStatus() == status)
                .map(ComparisonUnitAtom::getText)
                .collect(Collectors.toList());
    }

    @Test
    @DisplayName("Should mark a changed word as deleted and inserted")
    void shouldMarkWordChange_whenOneWordDiffers() {
        CorrelationFixture fixture = correlated(paragraph("Hello World"), paragraph("Hello Word"));

        assertThat(withStatus(fixture.getOriginal(), CorrelationStatus.DELETED)).containsExactly("World");
        assertThat(withStatus(fixture.getRevised(), CorrelationStatus.INSERTED)).containsExactly("Word");
        assertThat(withStatus(fixture.getRevised(), CorrelationStatus.EQUAL)).containsExactly("Hello", " ");
        assertThat(fixture.getResult().getSimilarityPairedGroups()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should link equal atoms in both directions")
    void shouldLinkCounterparts_whenAtomsAreEqual() {
        CorrelationFixture fixture = correlated(paragraph("Same text"), paragraph("Same text"));

        ComparisonUnitAtom revised = fixture.getRevised().get(0);
        assertThat(revised.getCorrelationStatus()).isEqualTo(CorrelationStatus.EQUAL);
        assertThat(revised.getAtomBefore()).isSameAs(fixture.getOriginal().get(0));
        assertThat(fixture.getOriginal().get(0).getAtomAfter()).isSameAs(revised);
        assertThat(fixture.getOriginal()).allMatch(ComparisonUnitAtom::isFromOriginal);
    }

    @Test
    @DisplayName("Should not pair dissimilar paragraphs")
    void shouldKeepParagraphsApart_whenSimilarityIsBelowThreshold() {
        CorrelationFixture fixture = correlated(paragraph("Completely unrelated sentence"), paragraph("Other words here"));

        assertThat(fixture.getResult().getMatches()).isEmpty();
        assertThat(fixture.getOriginal()).allMatch(atom -> atom.getCorrelationStatus() == CorrelationStatus.DELETED);
        assertThat(fixture.getRevised()).allMatch(atom -> atom.getCorrelationStatus() == CorrelationStatus.INSERTED);
    }

    @Test
    @DisplayName("Should place deleted atoms before the revised atom that follows them")
    void shouldInterleaveDeletions_whenMergingAtomLists() {
        CorrelationFixture fixture = correlated(paragraph("Hello World"), paragraph("Hello Word"));

        List<ComparisonUnitAtom> merged = fixture.getCorrelator()
                .createMergedAtomList(fixture.getOriginal(), fixture.getRevised(), fixture.getResult());

        assertThat(merged).extracting(ComparisonUnitAtom::getText).containsExactly("Hello", " ", "World", "Word");
        assertThat(merged.get(2).isFromOriginal()).isTrue();
    }

    @Test
    @DisplayName("Should give inserted paragraphs their own output paragraph")
    void shouldAssignOutputParagraphs_whenParagraphIsInserted() {
        CorrelationFixture fixture = correlated(
                paragraph("First paragraph") + paragraph("Last paragraph"),
                paragraph("First paragraph") + paragraph("Brand new content") + paragraph("Last paragraph"));
        List<ComparisonUnitAtom> merged = fixture.getCorrelator()
                .createMergedAtomList(fixture.getOriginal(), fixture.getRevised(), fixture.getResult());

        fixture.getCorrelator().assignOutputParagraphIndices(
                fixture.getOriginal(), fixture.getRevised(), merged, fixture.getResult());

        assertThat(merged).extracting(ComparisonUnitAtom::getOutputParagraphIndex)
                .containsExactly(0, 0, 0, 1, 1, 1, 1, 1, 2, 2, 2);
    }
}
