package guraa.docxcompare.core;

import guraa.docxcompare.core.lcs.LcsAlgorithm;
import guraa.docxcompare.core.lcs.LcsMatch;
import guraa.docxcompare.util.WmlNodes;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Aligns two atom lists in two levels: paragraphs first, then atoms inside each
 * aligned pair of paragraphs.
 * <p>
 * Paragraph groups are aligned by LCS over their normalized text. Groups left over
 * between two aligned anchors are paired by word similarity, keeping the order of
 * both sides, and each pair is then aligned atom by atom. The resulting atom
 * alignment is always a common subsequence of both lists.
 */
@Slf4j
public class HierarchicalCorrelator {

    public static final double DEFAULT_PARAGRAPH_SIMILARITY_THRESHOLD = 0.25;

    /**
     * Paragraphs with more atoms than this are split into groups after each break.
     */
    static final int MAX_GROUP_ATOMS = 50;

    private final LcsAlgorithm lcsAlgorithm;
    private final double similarityThreshold;

    public HierarchicalCorrelator(LcsAlgorithm lcsAlgorithm, double similarityThreshold) {
        this.lcsAlgorithm = lcsAlgorithm;
        this.similarityThreshold = similarityThreshold;
    }

    public HierarchicalCorrelator(LcsAlgorithm lcsAlgorithm) {
        this(lcsAlgorithm, DEFAULT_PARAGRAPH_SIMILARITY_THRESHOLD);
    }

    /**
     * Align the two lists without changing any atom.
     */
    public CorrelationResult correlate(List<ComparisonUnitAtom> original, List<ComparisonUnitAtom> revised) {
        List<AtomGroup> originalGroups = buildGroups(original);
        List<AtomGroup> revisedGroups = buildGroups(revised);

        List<String> originalKeys = new ArrayList<>(originalGroups.size());
        for (AtomGroup group : originalGroups) {
            originalKeys.add(group.normalizedHash);
        }
        List<String> revisedKeys = new ArrayList<>(revisedGroups.size());
        for (AtomGroup group : revisedGroups) {
            revisedKeys.add(group.normalizedHash);
        }
        List<LcsMatch> anchors = lcsAlgorithm.compute(originalKeys, revisedKeys);

        List<LcsMatch> groupPairs = new ArrayList<>(anchors);
        int similarityPairs = pairGapsBySimilarity(originalGroups, revisedGroups, anchors, groupPairs);
        groupPairs.sort(Comparator.comparingInt(LcsMatch::getOriginalIndex));

        List<LcsMatch> atomMatches = new ArrayList<>();
        for (LcsMatch pair : groupPairs) {
            AtomGroup originalGroup = originalGroups.get(pair.getOriginalIndex());
            AtomGroup revisedGroup = revisedGroups.get(pair.getRevisedIndex());
            List<LcsMatch> local = lcsAlgorithm.compute(
                    atomKeys(original, originalGroup), atomKeys(revised, revisedGroup));
            for (LcsMatch match : local) {
                atomMatches.add(new LcsMatch(
                        originalGroup.atomIndices.get(match.getOriginalIndex()),
                        revisedGroup.atomIndices.get(match.getRevisedIndex())));
            }
        }

        Set<Integer> matchedOriginal = new HashSet<>();
        Set<Integer> matchedRevised = new HashSet<>();
        for (LcsMatch match : atomMatches) {
            matchedOriginal.add(match.getOriginalIndex());
            matchedRevised.add(match.getRevisedIndex());
        }
        List<Integer> deleted = new ArrayList<>();
        for (int i = 0; i < original.size(); i++) {
            if (!matchedOriginal.contains(i)) {
                deleted.add(i);
            }
        }
        List<Integer> inserted = new ArrayList<>();
        for (int j = 0; j < revised.size(); j++) {
            if (!matchedRevised.contains(j)) {
                inserted.add(j);
            }
        }

        log.debug("Correlated {}x{} groups: {} exact, {} by similarity; {} equal atoms, {} deleted, {} inserted",
                originalGroups.size(), revisedGroups.size(), anchors.size(), similarityPairs,
                atomMatches.size(), deleted.size(), inserted.size());
        return new CorrelationResult(atomMatches, deleted, inserted, groupPairs.size(), similarityPairs);
    }

    /**
     * Write EQUAL, DELETED and INSERTED statuses and link each equal pair of atoms to each other.
     */
    public void markCorrelationStatus(List<ComparisonUnitAtom> original, List<ComparisonUnitAtom> revised,
                                      CorrelationResult result) {
        for (ComparisonUnitAtom atom : original) {
            atom.setFromOriginal(true);
        }
        for (LcsMatch match : result.getMatches()) {
            ComparisonUnitAtom originalAtom = original.get(match.getOriginalIndex());
            ComparisonUnitAtom revisedAtom = revised.get(match.getRevisedIndex());
            originalAtom.transitionTo(CorrelationStatus.EQUAL);
            revisedAtom.transitionTo(CorrelationStatus.EQUAL);
            revisedAtom.setAtomBefore(originalAtom);
            originalAtom.setAtomAfter(revisedAtom);
        }
        for (int index : result.getDeletedIndices()) {
            original.get(index).transitionTo(CorrelationStatus.DELETED);
        }
        for (int index : result.getInsertedIndices()) {
            revised.get(index).transitionTo(CorrelationStatus.INSERTED);
        }
    }

    /**
     * Interleave both lists in output order. Deleted originals come before the revised
     * atom that follows them; equal empty paragraphs are taken from the original.
     */
    public List<ComparisonUnitAtom> createMergedAtomList(List<ComparisonUnitAtom> original,
                                                        List<ComparisonUnitAtom> revised,
                                                        CorrelationResult result) {
        Map<Integer, Integer> revisedToOriginal = new HashMap<>();
        for (LcsMatch match : result.getMatches()) {
            revisedToOriginal.put(match.getRevisedIndex(), match.getOriginalIndex());
        }
        Set<Integer> deleted = new HashSet<>(result.getDeletedIndices());

        List<ComparisonUnitAtom> merged = new ArrayList<>(original.size() + revised.size());
        int originalPtr = 0;
        for (int revisedPtr = 0; revisedPtr < revised.size(); revisedPtr++) {
            while (originalPtr < original.size() && deleted.contains(originalPtr)) {
                merged.add(original.get(originalPtr++));
            }
            Integer matchedOriginal = revisedToOriginal.get(revisedPtr);
            if (matchedOriginal == null) {
                merged.add(revised.get(revisedPtr));
                continue;
            }
            while (originalPtr < matchedOriginal) {
                if (deleted.contains(originalPtr)) {
                    merged.add(original.get(originalPtr));
                }
                originalPtr++;
            }
            ComparisonUnitAtom originalAtom = original.get(matchedOriginal);
            merged.add(originalAtom.isEmptyParagraph() ? originalAtom : revised.get(revisedPtr));
            originalPtr = Math.max(originalPtr, matchedOriginal + 1);
        }
        while (originalPtr < original.size()) {
            if (deleted.contains(originalPtr)) {
                merged.add(original.get(originalPtr));
            }
            originalPtr++;
        }
        return merged;
    }

    /**
     * Map paragraphs of both documents onto output paragraphs. Paragraphs sharing an
     * equal atom share an output paragraph; the others get their own, in document order.
     */
    public void assignOutputParagraphIndices(List<ComparisonUnitAtom> original, List<ComparisonUnitAtom> revised,
                                             List<ComparisonUnitAtom> merged, CorrelationResult result) {
        Map<Integer, Integer> originalToRevisedParagraph = new HashMap<>();
        for (LcsMatch match : result.getMatches()) {
            originalToRevisedParagraph.putIfAbsent(
                    original.get(match.getOriginalIndex()).getParagraphIndex(),
                    revised.get(match.getRevisedIndex()).getParagraphIndex());
        }

        TreeSet<Integer> originalParagraphs = new TreeSet<>();
        for (ComparisonUnitAtom atom : original) {
            originalParagraphs.add(atom.getParagraphIndex());
        }
        List<Integer> revisedParagraphs = new ArrayList<>(new TreeSet<>(paragraphIndices(revised)));

        Map<Integer, Integer> originalToOutput = new HashMap<>();
        Map<Integer, Integer> revisedToOutput = new HashMap<>();
        int nextOutput = 0;
        int revisedPtr = 0;
        for (int originalParagraph : originalParagraphs) {
            Integer counterpart = originalToRevisedParagraph.get(originalParagraph);
            if (counterpart == null) {
                originalToOutput.put(originalParagraph, nextOutput++);
                continue;
            }
            while (revisedPtr < revisedParagraphs.size() && revisedParagraphs.get(revisedPtr) < counterpart) {
                revisedToOutput.putIfAbsent(revisedParagraphs.get(revisedPtr), nextOutput++);
                revisedPtr++;
            }
            Integer shared = revisedToOutput.get(counterpart);
            if (shared == null) {
                revisedToOutput.put(counterpart, nextOutput);
                originalToOutput.put(originalParagraph, nextOutput);
                nextOutput++;
            } else {
                originalToOutput.put(originalParagraph, shared);
            }
            if (revisedPtr < revisedParagraphs.size() && revisedParagraphs.get(revisedPtr).equals(counterpart)) {
                revisedPtr++;
            }
        }
        while (revisedPtr < revisedParagraphs.size()) {
            revisedToOutput.putIfAbsent(revisedParagraphs.get(revisedPtr), nextOutput++);
            revisedPtr++;
        }

        for (ComparisonUnitAtom atom : merged) {
            Map<Integer, Integer> mapping = atom.isFromOriginal() ? originalToOutput : revisedToOutput;
            Integer output = mapping.get(atom.getParagraphIndex());
            atom.setOutputParagraphIndex(output != null ? output : -1);
        }
    }

    private static Set<Integer> paragraphIndices(List<ComparisonUnitAtom> atoms) {
        Set<Integer> indices = new HashSet<>();
        for (ComparisonUnitAtom atom : atoms) {
            indices.add(atom.getParagraphIndex());
        }
        return indices;
    }

    /**
     * Pair unmatched groups lying in the same gap between two anchors. Each original
     * group takes the most similar revised group after the last pairing in that gap.
     *
     * @return number of pairs added
     */
    private int pairGapsBySimilarity(List<AtomGroup> originalGroups, List<AtomGroup> revisedGroups,
                                     List<LcsMatch> anchors, List<LcsMatch> pairs) {
        int added = 0;
        int originalStart = 0;
        int revisedStart = 0;
        for (int a = 0; a <= anchors.size(); a++) {
            int originalEnd = a < anchors.size() ? anchors.get(a).getOriginalIndex() : originalGroups.size();
            int revisedEnd = a < anchors.size() ? anchors.get(a).getRevisedIndex() : revisedGroups.size();

            int revisedFloor = revisedStart;
            for (int o = originalStart; o < originalEnd; o++) {
                int best = -1;
                double bestSimilarity = 0;
                for (int r = revisedFloor; r < revisedEnd; r++) {
                    double similarity = similarity(originalGroups.get(o), revisedGroups.get(r));
                    if (similarity >= similarityThreshold && (best < 0 || similarity > bestSimilarity)) {
                        best = r;
                        bestSimilarity = similarity;
                    }
                }
                if (best >= 0) {
                    pairs.add(new LcsMatch(o, best));
                    revisedFloor = best + 1;
                    added++;
                }
            }

            originalStart = originalEnd + 1;
            revisedStart = revisedEnd + 1;
        }
        return added;
    }

    private static double similarity(AtomGroup a, AtomGroup b) {
        if (a.isBlank() || b.isBlank()) {
            return 0;
        }
        return TextSimilarityCalculator.calculateJaccardSimilarity(a.text, b.text, true);
    }

    private static List<String> atomKeys(List<ComparisonUnitAtom> atoms, AtomGroup group) {
        List<String> keys = new ArrayList<>(group.atomIndices.size());
        for (int index : group.atomIndices) {
            ComparisonUnitAtom atom = atoms.get(index);
            keys.add(atom.getHash() + '\u0000' + atom.getTag() + '\u0000' + atom.getText());
        }
        return keys;
    }

    List<AtomGroup> buildGroups(List<ComparisonUnitAtom> atoms) {
        List<AtomGroup> groups = new ArrayList<>();
        int start = 0;
        while (start < atoms.size()) {
            int paragraph = atoms.get(start).getParagraphIndex();
            int end = start;
            while (end < atoms.size() && atoms.get(end).getParagraphIndex() == paragraph) {
                end++;
            }
            if (end - start > MAX_GROUP_ATOMS) {
                int groupStart = start;
                for (int i = start; i < end; i++) {
                    if (WmlNodes.BR.equals(atoms.get(i).getTag())) {
                        groups.add(new AtomGroup(atoms, groupStart, i + 1));
                        groupStart = i + 1;
                    }
                }
                if (groupStart < end) {
                    groups.add(new AtomGroup(atoms, groupStart, end));
                }
            } else {
                groups.add(new AtomGroup(atoms, start, end));
            }
            start = end;
        }
        return groups;
    }

    /**
     * Atoms of one paragraph, or of one break-delimited slice of a long paragraph.
     */
    static class AtomGroup {
        private final List<Integer> atomIndices = new ArrayList<>();
        private final String text;
        private final String normalizedHash;

        AtomGroup(List<ComparisonUnitAtom> atoms, int start, int end) {
            StringBuilder builder = new StringBuilder();
            StringBuilder hashes = new StringBuilder();
            for (int i = start; i < end; i++) {
                atomIndices.add(i);
                ComparisonUnitAtom atom = atoms.get(i);
                hashes.append(atom.getHash());
                String tag = atom.getTag();
                if (WmlNodes.T.equals(tag) || WmlNodes.DEL_TEXT.equals(tag)) {
                    builder.append(atom.getText());
                } else if (WmlNodes.BR.equals(tag) || WmlNodes.CR.equals(tag) || WmlNodes.TAB.equals(tag)) {
                    builder.append(' ');
                }
            }
            this.text = builder.toString();
            this.normalizedHash = isBlank()
                    ? (atomIndices.size() == 1 ? atoms.get(start).getHash() : AtomFingerprint.sha1(hashes.toString()))
                    : AtomFingerprint.sha1(TextSimilarityCalculator.normalize(text));
        }

        boolean isBlank() {
            return text.trim().isEmpty();
        }

        String getText() {
            return text;
        }

        List<Integer> getAtomIndices() {
            return atomIndices;
        }
    }
}
