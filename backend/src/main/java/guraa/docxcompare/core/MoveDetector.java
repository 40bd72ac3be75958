package guraa.docxcompare.core;

import guraa.docxcompare.util.WmlNodes;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Reclassifies deleted content that reappears elsewhere as inserted content into
 * a pair of moves sharing one move group.
 */
@Slf4j
public class MoveDetector {

    private final MoveDetectionSettings settings;

    public MoveDetector(MoveDetectionSettings settings) {
        this.settings = settings;
    }

    /**
     * Detect moves among the given atoms, usually the original atoms followed by the revised ones.
     *
     * @return number of move groups created
     */
    public int detectMoves(List<ComparisonUnitAtom> atoms) {
        if (!settings.isDetectMoves()) {
            return 0;
        }
        List<AtomBlock> blocks = groupIntoBlocks(atoms);
        List<AtomBlock> deletedBlocks = new ArrayList<>();
        List<AtomBlock> insertedBlocks = new ArrayList<>();
        for (AtomBlock block : blocks) {
            if (block.getWordCount() < settings.getMoveMinimumWordCount()) {
                continue;
            }
            if (block.getStatus() == CorrelationStatus.DELETED) {
                deletedBlocks.add(block);
            } else {
                insertedBlocks.add(block);
            }
        }

        int moves;
        switch (settings.getTieBreak()) {
            case HIGHEST_SCORE:
                moves = matchByHighestScore(deletedBlocks, insertedBlocks);
                break;
            case FIRST_ENCOUNTERED:
            default:
                moves = matchInEncounterOrder(deletedBlocks, insertedBlocks);
                break;
        }
        log.debug("Move detection: {} deleted and {} inserted candidate blocks, {} moves",
                deletedBlocks.size(), insertedBlocks.size(), moves);
        return moves;
    }

    private int matchInEncounterOrder(List<AtomBlock> deletedBlocks, List<AtomBlock> insertedBlocks) {
        int moveId = 0;
        for (AtomBlock deleted : deletedBlocks) {
            AtomBlock best = null;
            double bestSimilarity = 0;
            for (AtomBlock inserted : insertedBlocks) {
                if (inserted.isClaimed()) {
                    continue;
                }
                double similarity = similarity(deleted, inserted);
                if (similarity >= settings.getMoveSimilarityThreshold() && (best == null || similarity > bestSimilarity)) {
                    best = inserted;
                    bestSimilarity = similarity;
                }
            }
            if (best != null) {
                markMove(deleted, best, ++moveId);
            }
        }
        return moveId;
    }

    private int matchByHighestScore(List<AtomBlock> deletedBlocks, List<AtomBlock> insertedBlocks) {
        List<Candidate> candidates = new ArrayList<>();
        for (int d = 0; d < deletedBlocks.size(); d++) {
            for (int i = 0; i < insertedBlocks.size(); i++) {
                double similarity = similarity(deletedBlocks.get(d), insertedBlocks.get(i));
                if (similarity >= settings.getMoveSimilarityThreshold()) {
                    int lengthDifference = Math.abs(
                            deletedBlocks.get(d).getText().length() - insertedBlocks.get(i).getText().length());
                    candidates.add(new Candidate(d, i, similarity, lengthDifference));
                }
            }
        }
        candidates.sort(Comparator.comparingDouble((Candidate c) -> -c.similarity)
                .thenComparingInt(c -> c.lengthDifference)
                .thenComparingInt(c -> c.deletedIndex)
                .thenComparingInt(c -> c.insertedIndex));

        int moveId = 0;
        for (Candidate candidate : candidates) {
            AtomBlock deleted = deletedBlocks.get(candidate.deletedIndex);
            AtomBlock inserted = insertedBlocks.get(candidate.insertedIndex);
            if (deleted.isClaimed() || inserted.isClaimed()) {
                continue;
            }
            markMove(deleted, inserted, ++moveId);
        }
        return moveId;
    }

    private double similarity(AtomBlock deleted, AtomBlock inserted) {
        return TextSimilarityCalculator.calculateJaccardSimilarity(
                deleted.getText(), inserted.getText(), settings.isCaseInsensitive());
    }

    private static void markMove(AtomBlock source, AtomBlock destination, int moveId) {
        String moveName = "move" + moveId;
        for (ComparisonUnitAtom atom : source.getAtoms()) {
            atom.transitionTo(CorrelationStatus.MOVED_SOURCE);
            atom.setMoveGroupId(moveId);
            atom.setMoveName(moveName);
        }
        for (ComparisonUnitAtom atom : destination.getAtoms()) {
            atom.transitionTo(CorrelationStatus.MOVED_DESTINATION);
            atom.setMoveGroupId(moveId);
            atom.setMoveName(moveName);
        }
    }

    /**
     * Split DELETED and INSERTED atoms into blocks at every status change and paragraph boundary.
     */
    List<AtomBlock> groupIntoBlocks(List<ComparisonUnitAtom> atoms) {
        List<AtomBlock> blocks = new ArrayList<>();
        List<ComparisonUnitAtom> current = new ArrayList<>();
        ComparisonUnitAtom previous = null;
        for (ComparisonUnitAtom atom : atoms) {
            CorrelationStatus status = atom.getCorrelationStatus();
            boolean candidate = status == CorrelationStatus.DELETED || status == CorrelationStatus.INSERTED;
            boolean continues = candidate && previous != null
                    && previous.getCorrelationStatus() == status
                    && previous.getParagraphIndex() == atom.getParagraphIndex()
                    && previous.isFromOriginal() == atom.isFromOriginal();
            if (!continues && !current.isEmpty()) {
                blocks.add(new AtomBlock(current.get(0).getCorrelationStatus(), current));
                current.clear();
            }
            if (candidate) {
                current.add(atom);
            }
            previous = atom;
        }
        if (!current.isEmpty()) {
            blocks.add(new AtomBlock(current.get(0).getCorrelationStatus(), current));
        }
        return blocks;
    }

    /**
     * Text an atom contributes to its block: leaf text, a newline for breaks and a tab for tabs.
     */
    static String atomText(ComparisonUnitAtom atom) {
        String tag = atom.getTag();
        if (WmlNodes.T.equals(tag) || WmlNodes.DEL_TEXT.equals(tag)) {
            return atom.getText();
        }
        if (WmlNodes.BR.equals(tag) || WmlNodes.CR.equals(tag)) {
            return "\n";
        }
        if (WmlNodes.TAB.equals(tag)) {
            return "\t";
        }
        return "";
    }

    private static class Candidate {
        private final int deletedIndex;
        private final int insertedIndex;
        private final double similarity;
        private final int lengthDifference;

        Candidate(int deletedIndex, int insertedIndex, double similarity, int lengthDifference) {
            this.deletedIndex = deletedIndex;
            this.insertedIndex = insertedIndex;
            this.similarity = similarity;
            this.lengthDifference = lengthDifference;
        }
    }
}
