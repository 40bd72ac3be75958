package guraa.docxcompare.core;

import guraa.docxcompare.util.WmlNodes;
import guraa.docxcompare.util.WmlXml;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Correlation Status Tests")
class CorrelationStatusTest {

    private static ComparisonUnitAtom atom(String paragraphXml) {
        return new Atomizer().atomize(WmlNodes.findBody(WmlXml.fromBodyXml(paragraphXml)),
                "word/document.xml", AtomizerOptions.defaults()).getAtoms().get(0);
    }

    @Test
    @DisplayName("Should allow only forward transitions")
    void shouldAllowForwardTransitions_whenCheckingTable() {
        assertThat(CorrelationStatus.UNKNOWN.allowedTransitions())
                .containsExactlyInAnyOrder(CorrelationStatus.EQUAL, CorrelationStatus.DELETED, CorrelationStatus.INSERTED);
        assertThat(CorrelationStatus.EQUAL.canTransitionTo(CorrelationStatus.FORMAT_CHANGED)).isTrue();
        assertThat(CorrelationStatus.DELETED.canTransitionTo(CorrelationStatus.MOVED_SOURCE)).isTrue();
        assertThat(CorrelationStatus.INSERTED.canTransitionTo(CorrelationStatus.MOVED_DESTINATION)).isTrue();
        assertThat(CorrelationStatus.DELETED.canTransitionTo(CorrelationStatus.MOVED_DESTINATION)).isFalse();
        assertThat(CorrelationStatus.FORMAT_CHANGED.allowedTransitions()).isEmpty();
        assertThat(CorrelationStatus.MOVED_SOURCE.allowedTransitions()).isEmpty();
    }

    @Test
    @DisplayName("Should reject an illegal transition on an atom")
    void shouldThrow_whenTransitionIsIllegal() {
        ComparisonUnitAtom atom = atom("<w:p><w:r><w:t>Text</w:t></w:r></w:p>");
        atom.transitionTo(CorrelationStatus.EQUAL);

        assertThatThrownBy(() -> atom.transitionTo(CorrelationStatus.MOVED_SOURCE))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("EQUAL -> MOVED_SOURCE");
    }

    @Test
    @DisplayName("Should let correlation overwrite a status seeded from an input revision")
    void shouldOverwriteSeededStatus_whenCorrelating() {
        ComparisonUnitAtom atom = atom("<w:p><w:ins w:id=\"1\" w:author=\"a\"><w:r><w:t>Text</w:t></w:r></w:ins></w:p>");
        assertThat(atom.getCorrelationStatus()).isEqualTo(CorrelationStatus.INSERTED);
        assertThat(atom.isRevisionSeeded()).isTrue();

        atom.transitionTo(CorrelationStatus.EQUAL);

        assertThat(atom.getCorrelationStatus()).isEqualTo(CorrelationStatus.EQUAL);
        assertThat(atom.isRevisionSeeded()).isFalse();
    }

    @Test
    @DisplayName("Should not mark plain content as seeded")
    void shouldStayUnseeded_whenAtomHasNoRevisionWrapper() {
        ComparisonUnitAtom atom = atom("<w:p><w:r><w:t>Text</w:t></w:r></w:p>");

        assertThat(atom.getCorrelationStatus()).isEqualTo(CorrelationStatus.UNKNOWN);
        assertThat(atom.isRevisionSeeded()).isFalse();
    }

    @Test
    @DisplayName("Should classify deletion and insertion statuses")
    void shouldClassifyStatuses_whenAskedForDirection() {
        assertThat(CorrelationStatus.MOVED_SOURCE.isDeletion()).isTrue();
        assertThat(CorrelationStatus.MOVED_DESTINATION.isInsertion()).isTrue();
        assertThat(CorrelationStatus.FORMAT_CHANGED.isDeletion()).isFalse();
        assertThat(CorrelationStatus.EQUAL.isRevisionSeed()).isFalse();
    }
}
