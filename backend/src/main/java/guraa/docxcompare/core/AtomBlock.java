package guraa.docxcompare.core;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Consecutive DELETED or INSERTED atoms of one paragraph, considered as a unit by move detection.
 */
@Getter
public class AtomBlock {

    private final CorrelationStatus status;
    private final List<ComparisonUnitAtom> atoms;
    private final String text;
    private final int wordCount;

    public AtomBlock(CorrelationStatus status, List<ComparisonUnitAtom> atoms) {
        this.status = status;
        this.atoms = Collections.unmodifiableList(new ArrayList<>(atoms));
        StringBuilder joined = new StringBuilder();
        for (ComparisonUnitAtom atom : atoms) {
            joined.append(MoveDetector.atomText(atom));
        }
        this.text = joined.toString();
        this.wordCount = TextSimilarityCalculator.countWords(text);
    }

    public int getParagraphIndex() {
        return atoms.get(0).getParagraphIndex();
    }

    public boolean isClaimed() {
        CorrelationStatus current = atoms.get(0).getCorrelationStatus();
        return current == CorrelationStatus.MOVED_SOURCE || current == CorrelationStatus.MOVED_DESTINATION;
    }
}
