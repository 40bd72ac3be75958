package guraa.docxcompare.model;

import guraa.docxcompare.core.ComparisonUnitAtom;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Change counts reported with a comparison result.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CompareStats {

    private int insertions;
    private int deletions;

    /**
     * Paragraphs holding both deleted and inserted content, plus format changes.
     */
    private int modifications;

    private int moves;
    private int formatChanges;

    /**
     * Count atoms by status. Moves count pairs, so each moved atom counts half.
     */
    public static CompareStats fromAtoms(List<ComparisonUnitAtom> mergedAtoms) {
        int insertions = 0;
        int deletions = 0;
        int moved = 0;
        int formatChanges = 0;
        Set<Integer> withDeletions = new HashSet<>();
        Set<Integer> withInsertions = new HashSet<>();
        for (ComparisonUnitAtom atom : mergedAtoms) {
            switch (atom.getCorrelationStatus()) {
                case INSERTED:
                    insertions++;
                    withInsertions.add(atom.getOutputParagraphIndex());
                    break;
                case DELETED:
                    deletions++;
                    withDeletions.add(atom.getOutputParagraphIndex());
                    break;
                case MOVED_SOURCE:
                case MOVED_DESTINATION:
                    moved++;
                    break;
                case FORMAT_CHANGED:
                    formatChanges++;
                    break;
                default:
                    break;
            }
        }
        withDeletions.retainAll(withInsertions);
        return CompareStats.builder()
                .insertions(insertions)
                .deletions(deletions)
                .moves(moved / 2)
                .formatChanges(formatChanges)
                .modifications(withDeletions.size() + formatChanges)
                .build();
    }
}
