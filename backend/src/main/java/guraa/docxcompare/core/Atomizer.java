package guraa.docxcompare.core;

import guraa.docxcompare.util.WmlNodes;
import lombok.extern.slf4j.Slf4j;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Flattens a WordprocessingML tree into an ordered list of fingerprinted atoms.
 * <p>
 * After the tree walk the atoms go through four normalization passes, always in this order:
 * field collapsing, contiguous text merging, word splitting and punctuation re-merging.
 * Each pass relies on the shape produced by the one before it.
 */
@Slf4j
public class Atomizer {

    public static final Set<String> LEAF_TAGS = Set.of(
            "w:t", "w:br", "w:cr", "w:tab", "w:sym", "w:softHyphen", "w:noBreakHyphen",
            "w:fldChar", "w:instrText", "w:delText",
            "w:dayShort", "w:dayLong", "w:monthShort", "w:monthLong", "w:yearShort", "w:yearLong",
            "w:annotationRef", "w:footnoteRef", "w:endnoteRef", "w:footnoteReference", "w:endnoteReference",
            "w:separator", "w:continuationSeparator", "w:pgNum",
            "w:drawing", "w:pict", "w:object", "mc:AlternateContent");

    private static final Pattern WHITESPACE_SPLIT = Pattern.compile("\\s+");
    private static final Pattern PUNCTUATION_ONLY = Pattern.compile("^[,.:;!?'\")\\]}>]+$");
    private static final Pattern ENDS_WITH_WORD_CHAR = Pattern.compile("\\w$");

    /**
     * Walk {@code root}, then run the normalization passes and assign paragraph indices.
     *
     * @param root     element to atomize, usually w:body
     * @param partName name of the package part the tree belongs to
     * @param options  normalization switches
     * @return atoms in document order with the number of empty paragraphs seen
     */
    public AtomizationResult atomize(Element root, String partName, AtomizerOptions options) {
        WalkState state = new WalkState(partName, options);
        List<Element> ancestors = new ArrayList<>();
        Element parent = WmlNodes.parentElement(root);
        while (parent != null) {
            ancestors.add(0, parent);
            parent = WmlNodes.parentElement(parent);
        }
        walk(root, ancestors, state);
        if (!state.pendingBookmarks.isEmpty() && !state.atoms.isEmpty()) {
            state.atoms.get(state.atoms.size() - 1).getTrailingBookmarks().addAll(state.pendingBookmarks);
            state.pendingBookmarks.clear();
        }
        log.debug("Atomized {} leaf atoms ({} empty paragraphs) from {}",
                state.atoms.size(), state.emptyParagraphCount, partName);

        List<ComparisonUnitAtom> atoms = collapseFieldSequences(state.atoms);
        atoms = mergeContiguousTextAtoms(atoms, options.isMergeAcrossRuns());
        if (options.isSplitTextIntoWords()) {
            atoms = splitAtomsIntoWords(atoms);
        }
        atoms = mergePunctuationAtoms(atoms, options.isMergePunctuationAcrossRuns());
        assignParagraphIndices(atoms);
        log.debug("Normalized to {} atoms", atoms.size());
        return new AtomizationResult(atoms, state.emptyParagraphCount);
    }

    private void walk(Element node, List<Element> ancestors, WalkState state) {
        String tagName = node.getTagName();
        if (LEAF_TAGS.contains(tagName)) {
            Element content = state.options.isCloneLeafNodes() ? (Element) node.cloneNode(true) : node;
            ComparisonUnitAtom atom = new ComparisonUnitAtom(content, ancestors, state.partName);
            addAtom(atom, state);
            state.lastContentHash = atom.getHash();
            return;
        }
        if (WmlNodes.BOOKMARK_START.equals(tagName) || WmlNodes.BOOKMARK_END.equals(tagName)) {
            state.pendingBookmarks.add(node);
            return;
        }

        List<Element> childAncestors = new ArrayList<>(ancestors);
        childAncestors.add(node);
        int atomsBefore = state.atoms.size();
        for (Element child : WmlNodes.childElements(node)) {
            walk(child, childAncestors, state);
        }

        if (WmlNodes.P.equals(tagName)) {
            if (state.atoms.size() == atomsBefore) {
                addAtom(createEmptyParagraphAtom(node, childAncestors, state), state);
                state.emptyParagraphCount++;
            }
            if (!state.pendingBookmarks.isEmpty()) {
                state.atoms.get(state.atoms.size() - 1).getTrailingBookmarks().addAll(state.pendingBookmarks);
                state.pendingBookmarks.clear();
            }
        }
    }

    private void addAtom(ComparisonUnitAtom atom, WalkState state) {
        if (!state.pendingBookmarks.isEmpty()) {
            atom.getLeadingBookmarks().addAll(state.pendingBookmarks);
            state.pendingBookmarks.clear();
        }
        state.atoms.add(atom);
    }

    private ComparisonUnitAtom createEmptyParagraphAtom(Element paragraph, List<Element> ancestors, WalkState state) {
        Element marker = paragraph.getOwnerDocument().createElement(ComparisonUnitAtom.EMPTY_PARAGRAPH_TAG);
        ComparisonUnitAtom atom = new ComparisonUnitAtom(marker, ancestors, state.partName);
        atom.setEmptyParagraph(true);
        atom.setHash(AtomFingerprint.emptyParagraph(
                state.lastContentHash, state.emptyParagraphCount, WmlNodes.findChild(paragraph, WmlNodes.PPR)));
        return atom;
    }

    // Field collapsing

    List<ComparisonUnitAtom> collapseFieldSequences(List<ComparisonUnitAtom> atoms) {
        List<ComparisonUnitAtom> result = new ArrayList<>(atoms.size());
        int i = 0;
        while (i < atoms.size()) {
            ComparisonUnitAtom atom = atoms.get(i);
            if (!isFieldChar(atom, "begin")) {
                result.add(atom);
                i++;
                continue;
            }

            List<ComparisonUnitAtom> fieldAtoms = new ArrayList<>();
            fieldAtoms.add(atom);
            int depth = 1;
            int separatorIndex = -1;
            i++;
            while (i < atoms.size() && depth > 0) {
                ComparisonUnitAtom current = atoms.get(i);
                fieldAtoms.add(current);
                if (isFieldChar(current, "begin")) {
                    depth++;
                } else if (isFieldChar(current, "end")) {
                    depth--;
                } else if (isFieldChar(current, "separate") && depth == 1) {
                    separatorIndex = fieldAtoms.size() - 1;
                }
                i++;
            }

            if (spansMultipleParagraphs(fieldAtoms)) {
                result.addAll(fieldAtoms);
                continue;
            }

            List<ComparisonUnitAtom> visibleAtoms = separatorIndex >= 0
                    ? fieldAtoms.subList(separatorIndex + 1, Math.max(separatorIndex + 1, fieldAtoms.size() - 1))
                    : fieldAtoms;
            result.add(collapse(fieldAtoms, visibleText(visibleAtoms)));
        }
        return result;
    }

    private ComparisonUnitAtom collapse(List<ComparisonUnitAtom> fieldAtoms, String visibleText) {
        ComparisonUnitAtom first = fieldAtoms.get(0);
        Element text = WmlNodes.createElement(first.getContentElement().getOwnerDocument(), WmlNodes.T);
        text.setTextContent(visibleText);
        ComparisonUnitAtom collapsed = new ComparisonUnitAtom(text, first.getAncestors(), first.getPartName());
        collapsed.setCollapsedField(true);
        collapsed.setCollapsedFieldAtoms(Collections.unmodifiableList(new ArrayList<>(fieldAtoms)));
        for (ComparisonUnitAtom fieldAtom : fieldAtoms) {
            collapsed.getLeadingBookmarks().addAll(fieldAtom.getLeadingBookmarks());
            collapsed.getTrailingBookmarks().addAll(fieldAtom.getTrailingBookmarks());
        }
        return collapsed;
    }

    private static boolean isFieldChar(ComparisonUnitAtom atom, String type) {
        return WmlNodes.FLD_CHAR.equals(atom.getTag())
                && type.equals(atom.getContentElement().getAttribute("w:fldCharType"));
    }

    private static String visibleText(List<ComparisonUnitAtom> atoms) {
        StringBuilder text = new StringBuilder();
        for (ComparisonUnitAtom atom : atoms) {
            if (atom.isText()) {
                text.append(atom.getText());
            }
        }
        return text.toString();
    }

    private static boolean spansMultipleParagraphs(List<ComparisonUnitAtom> atoms) {
        Element paragraph = null;
        for (ComparisonUnitAtom atom : atoms) {
            Element current = atom.getParagraph();
            if (current == null) {
                continue;
            }
            if (paragraph == null) {
                paragraph = current;
            } else if (paragraph != current) {
                return true;
            }
        }
        return false;
    }

    // Contiguous text merging

    List<ComparisonUnitAtom> mergeContiguousTextAtoms(List<ComparisonUnitAtom> atoms, boolean mergeAcrossRuns) {
        MergeTarget merger = new MergeTarget();
        List<ComparisonUnitAtom> result = new ArrayList<>(atoms.size());
        for (ComparisonUnitAtom atom : atoms) {
            ComparisonUnitAtom previous = result.isEmpty() ? null : result.get(result.size() - 1);
            if (previous != null && canMerge(previous, atom, mergeAcrossRuns)) {
                merger.append(previous, atom);
            } else {
                result.add(atom);
            }
        }
        return result;
    }

    private static boolean canMerge(ComparisonUnitAtom a, ComparisonUnitAtom b, boolean mergeAcrossRuns) {
        if (!sharesTextContext(a, b)) {
            return false;
        }
        if (a.getRun() == b.getRun()) {
            return true;
        }
        if (!mergeAcrossRuns) {
            return false;
        }
        return AtomFingerprint.deepEquals(a.getRunProperties(), b.getRunProperties());
    }

    /**
     * Both plain text in the same paragraph under the same kind of revision wrapper,
     * with no bookmark boundary between them.
     */
    private static boolean sharesTextContext(ComparisonUnitAtom a, ComparisonUnitAtom b) {
        if (!a.isText() || !b.isText()) {
            return false;
        }
        if (a.isCollapsedField() || b.isCollapsedField()) {
            return false;
        }
        if (a.getParagraph() != b.getParagraph()) {
            return false;
        }
        if (!b.getLeadingBookmarks().isEmpty() || !a.getTrailingBookmarks().isEmpty()) {
            return false;
        }
        String aRevision = a.getRevisionTag();
        String bRevision = b.getRevisionTag();
        return aRevision == null ? bRevision == null : aRevision.equals(bRevision);
    }

    // Word splitting

    List<ComparisonUnitAtom> splitAtomsIntoWords(List<ComparisonUnitAtom> atoms) {
        List<ComparisonUnitAtom> result = new ArrayList<>(atoms.size());
        for (ComparisonUnitAtom atom : atoms) {
            result.addAll(splitIntoWords(atom));
        }
        return result;
    }

    private List<ComparisonUnitAtom> splitIntoWords(ComparisonUnitAtom atom) {
        if (!atom.isText() || atom.isCollapsedField()) {
            return List.of(atom);
        }
        String text = atom.getText();
        if (text.length() <= 1 || !WHITESPACE_SPLIT.matcher(text).find()) {
            return List.of(atom);
        }

        List<String> pieces = splitKeepingWhitespace(text);
        if (pieces.size() <= 1) {
            return List.of(atom);
        }

        List<ComparisonUnitAtom> fragments = new ArrayList<>(pieces.size());
        for (String piece : pieces) {
            Element word = WmlNodes.createElement(atom.getContentElement().getOwnerDocument(), WmlNodes.T);
            WmlNodes.copyAttributes(atom.getContentElement(), word);
            word.setTextContent(piece);
            ComparisonUnitAtom fragment = new ComparisonUnitAtom(word, atom.getAncestors(), atom.getPartName());
            fragment.setSplitFromAtom(atom);
            fragment.setSourceRun(atom.getSourceRun());
            fragment.setSourceParagraph(atom.getSourceParagraph());
            fragments.add(fragment);
        }
        fragments.get(0).getLeadingBookmarks().addAll(atom.getLeadingBookmarks());
        fragments.get(fragments.size() - 1).getTrailingBookmarks().addAll(atom.getTrailingBookmarks());
        return fragments;
    }

    static List<String> splitKeepingWhitespace(String text) {
        List<String> pieces = new ArrayList<>();
        Matcher matcher = WHITESPACE_SPLIT.matcher(text);
        int last = 0;
        while (matcher.find()) {
            if (matcher.start() > last) {
                pieces.add(text.substring(last, matcher.start()));
            }
            pieces.add(matcher.group());
            last = matcher.end();
        }
        if (last < text.length()) {
            pieces.add(text.substring(last));
        }
        return pieces;
    }

    // Punctuation re-merging

    List<ComparisonUnitAtom> mergePunctuationAtoms(List<ComparisonUnitAtom> atoms, boolean acrossRuns) {
        MergeTarget merger = new MergeTarget();
        List<ComparisonUnitAtom> result = new ArrayList<>(atoms.size());
        for (ComparisonUnitAtom atom : atoms) {
            ComparisonUnitAtom previous = result.isEmpty() ? null : result.get(result.size() - 1);
            if (previous != null && canMergePunctuation(previous, atom, acrossRuns)) {
                merger.append(previous, atom);
            } else {
                result.add(atom);
            }
        }
        return result;
    }

    private static boolean canMergePunctuation(ComparisonUnitAtom a, ComparisonUnitAtom b, boolean acrossRuns) {
        if (!sharesTextContext(a, b)) {
            return false;
        }
        if (!PUNCTUATION_ONLY.matcher(b.getText()).matches()) {
            return false;
        }
        if (!ENDS_WITH_WORD_CHAR.matcher(a.getText()).find()) {
            return false;
        }
        return acrossRuns || a.getRun() == b.getRun();
    }

    /**
     * Assign a zero-based paragraph index to every atom, in the order paragraphs are first seen.
     */
    public static void assignParagraphIndices(List<ComparisonUnitAtom> atoms) {
        Map<Element, Integer> indices = new IdentityHashMap<>();
        int lastIndex = 0;
        for (ComparisonUnitAtom atom : atoms) {
            Element paragraph = atom.getParagraph();
            if (paragraph == null) {
                atom.setParagraphIndex(lastIndex);
                continue;
            }
            Integer index = indices.get(paragraph);
            if (index == null) {
                index = indices.size();
                indices.put(paragraph, index);
            }
            atom.setParagraphIndex(index);
            lastIndex = index;
        }
    }

    /**
     * Appends text of one atom onto another. The receiving atom gets a private copy
     * of its content element on first use so the source tree is left untouched.
     */
    private static class MergeTarget {

        private final Map<ComparisonUnitAtom, Boolean> owned = new IdentityHashMap<>();

        void append(ComparisonUnitAtom target, ComparisonUnitAtom source) {
            if (!owned.containsKey(target)) {
                target.setContentElement((Element) target.getContentElement().cloneNode(true));
                owned.put(target, Boolean.TRUE);
            }
            Element content = target.getContentElement();
            content.setTextContent(target.getText() + source.getText());
            target.getTrailingBookmarks().addAll(source.getTrailingBookmarks());
            target.setHash(AtomFingerprint.compute(content));
        }
    }

    private static class WalkState {
        private final String partName;
        private final AtomizerOptions options;
        private final List<ComparisonUnitAtom> atoms = new ArrayList<>();
        private final List<Element> pendingBookmarks = new ArrayList<>();
        private String lastContentHash;
        private int emptyParagraphCount;

        WalkState(String partName, AtomizerOptions options) {
            this.partName = partName;
            this.options = options;
        }
    }
}
