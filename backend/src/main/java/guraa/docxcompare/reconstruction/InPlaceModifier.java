package guraa.docxcompare.reconstruction;

import guraa.docxcompare.core.Atomizer;
import guraa.docxcompare.core.ComparisonUnitAtom;
import guraa.docxcompare.core.CorrelationStatus;
import guraa.docxcompare.exception.MalformedDocumentException;
import guraa.docxcompare.util.WmlNodes;
import lombok.extern.slf4j.Slf4j;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Adds track-changes markup directly to the revised document tree.
 * <p>
 * Inserted, moved-to and reformatted runs are marked where they are. Deleted and
 * moved-from content is cloned from the original tree into the paragraph it maps
 * to, right after the last run handled there; when that paragraph does not exist
 * in the revised document, or disappears on reject, a new paragraph is created.
 * The atoms must come from an atomizer run with cloned leaf nodes, so that the
 * live tree can be edited without touching atom content.
 */
@Slf4j
public class InPlaceModifier {

    private static final Set<String> REVISION_WRAPPERS = Set.of(
            WmlNodes.INS, WmlNodes.DEL, WmlNodes.MOVE_FROM, WmlNodes.MOVE_TO);

    public void modify(Document revisedDocument, List<ComparisonUnitAtom> originalAtoms,
                       List<ComparisonUnitAtom> revisedAtoms, List<ComparisonUnitAtom> mergedAtoms,
                       String author, Instant date) {
        Element body = WmlNodes.findBody(revisedDocument);
        if (body == null) {
            throw new MalformedDocumentException("Document has no w:body");
        }
        attachSourcePointers(originalAtoms);
        attachSourcePointers(revisedAtoms);
        int splitRuns = splitMixedRuns(revisedAtoms);

        Context ctx = new Context(new RevisionMarkup(revisedDocument, author, date), body,
                BookmarkIndex.of(mergedAtoms), revisedDocument);
        for (ComparisonUnitAtom atom : revisedAtoms) {
            if (atom.getSourceParagraph() != null && atom.getOutputParagraphIndex() >= 0) {
                ctx.paragraphByOutput.putIfAbsent(atom.getOutputParagraphIndex(), atom.getSourceParagraph());
            }
        }
        Map<Integer, List<ComparisonUnitAtom>> atomsByParagraph = byOutputParagraph(mergedAtoms);
        for (Map.Entry<Integer, List<ComparisonUnitAtom>> entry : atomsByParagraph.entrySet()) {
            if (isEntirely(entry.getValue(), CorrelationStatus.INSERTED)) {
                ctx.fullyInserted.add(entry.getKey());
            }
        }

        for (ComparisonUnitAtom atom : mergedAtoms) {
            switch (atom.getCorrelationStatus()) {
                case INSERTED:
                    handleInserted(atom, ctx);
                    break;
                case DELETED:
                    handleDeleted(atom, ctx, false);
                    break;
                case MOVED_SOURCE:
                    handleDeleted(atom, ctx, true);
                    break;
                case MOVED_DESTINATION:
                    handleMovedDestination(atom, ctx);
                    break;
                case FORMAT_CHANGED:
                    handleFormatChanged(atom, ctx);
                    break;
                case EQUAL:
                case UNKNOWN:
                default:
                    handleEqual(atom, ctx);
                    break;
            }
        }

        applyWholeParagraphMarkers(atomsByParagraph, ctx);
        markRevisedOnlyBookmarks(revisedAtoms, ctx);
        int merged = mergeAdjacentWrappers(body);
        log.debug("In-place modification: {} runs split, {} paragraphs created, {} wrappers merged",
                splitRuns, ctx.created.size(), merged);
    }

    private static void attachSourcePointers(List<ComparisonUnitAtom> atoms) {
        for (ComparisonUnitAtom atom : atoms) {
            atom.setSourceRun(atom.getRun());
            atom.setSourceParagraph(atom.getParagraph());
            for (ComparisonUnitAtom fieldAtom : atom.getCollapsedFieldAtoms()) {
                fieldAtom.setSourceRun(fieldAtom.getRun());
                fieldAtom.setSourceParagraph(fieldAtom.getParagraph());
            }
        }
    }

    /**
     * Give each atom of a run its own run when the atoms of that run need different
     * markup. Runs holding anything besides properties and leaf content are left alone.
     *
     * @return number of runs split
     */
    int splitMixedRuns(List<ComparisonUnitAtom> revisedAtoms) {
        Map<Element, List<ComparisonUnitAtom>> atomsByRun = new IdentityHashMap<>();
        List<Element> runs = new ArrayList<>();
        for (ComparisonUnitAtom atom : revisedAtoms) {
            Element run = atom.getSourceRun();
            if (run == null) {
                continue;
            }
            if (!atomsByRun.containsKey(run)) {
                runs.add(run);
            }
            atomsByRun.computeIfAbsent(run, r -> new ArrayList<>()).add(atom);
        }

        int split = 0;
        for (Element run : runs) {
            List<ComparisonUnitAtom> atoms = atomsByRun.get(run);
            if (atoms.size() < 2 || !needsSplit(atoms) || !isSplittable(run) || run.getParentNode() == null) {
                continue;
            }
            Document document = run.getOwnerDocument();
            Element rPr = WmlNodes.findChild(run, WmlNodes.RPR);
            for (ComparisonUnitAtom atom : atoms) {
                Element piece = (Element) run.cloneNode(false);
                if (rPr != null) {
                    piece.appendChild(rPr.cloneNode(true));
                }
                Element content = (Element) document.importNode(atom.getContentElement(), true);
                if (WmlNodes.T.equals(content.getTagName()) && WmlNodes.needsSpacePreserve(content.getTextContent())) {
                    WmlNodes.setAttribute(content, WmlNodes.XML_SPACE, "preserve");
                }
                piece.appendChild(content);
                run.getParentNode().insertBefore(piece, run);
                atom.setSourceRun(piece);
            }
            WmlNodes.remove(run);
            split++;
        }
        return split;
    }

    private static boolean needsSplit(List<ComparisonUnitAtom> atoms) {
        CorrelationStatus first = atoms.get(0).getCorrelationStatus();
        for (ComparisonUnitAtom atom : atoms) {
            if (atom.isCollapsedField()) {
                return false;
            }
        }
        for (ComparisonUnitAtom atom : atoms) {
            if (atom.getCorrelationStatus() != first) {
                return true;
            }
        }
        return false;
    }

    private static boolean isSplittable(Element run) {
        for (Element child : WmlNodes.childElements(run)) {
            String tag = child.getTagName();
            if (!WmlNodes.RPR.equals(tag) && !Atomizer.LEAF_TAGS.contains(tag)) {
                return false;
            }
            if (WmlNodes.FLD_CHAR.equals(tag) || WmlNodes.INSTR_TEXT.equals(tag)) {
                return false;
            }
        }
        return true;
    }

    // Handlers

    private void handleInserted(ComparisonUnitAtom atom, Context ctx) {
        List<Element> runs = atomRuns(atom);
        if (!runs.isEmpty()) {
            for (Element run : runs) {
                wrapRun(run, ctx.markup.ins(), ctx);
            }
            insertOriginalAround(runs, atom.getAtomBefore(), ctx);
            ctx.moveTo(anchor(runs.get(runs.size() - 1)), atom.getSourceParagraph(), atom.getOutputParagraphIndex());
        } else if (atom.isEmptyParagraph() && atom.getSourceParagraph() != null) {
            if (!RevisionMarkup.hasParagraphMarker(atom.getSourceParagraph(), WmlNodes.INS)) {
                ctx.markup.markParagraph(atom.getSourceParagraph(), WmlNodes.INS);
            }
            ctx.moveTo(null, atom.getSourceParagraph(), atom.getOutputParagraphIndex());
        }
    }

    private void handleDeleted(ComparisonUnitAtom atom, Context ctx, boolean moved) {
        int outputIndex = atom.getOutputParagraphIndex();
        if (atom.isEmptyParagraph()) {
            if (atom.getSourceParagraph() == null) {
                return;
            }
            Element paragraph = WmlNodes.createElement(ctx.document, WmlNodes.P);
            Element pPr = WmlNodes.findChild(atom.getSourceParagraph(), WmlNodes.PPR);
            if (pPr != null) {
                paragraph.appendChild(ctx.document.importNode(pPr, true));
            }
            for (Node marker : ctx.originalMarkers(atom, true)) {
                paragraph.appendChild(marker);
            }
            for (Node marker : ctx.originalMarkers(atom, false)) {
                paragraph.appendChild(marker);
            }
            insertParagraph(paragraph, ctx);
            ctx.markup.markParagraph(paragraph, WmlNodes.DEL);
            ctx.created.put(outputIndex, paragraph);
            ctx.moveTo(null, paragraph, outputIndex);
            return;
        }
        if (atom.getSourceRun() == null) {
            return;
        }

        Element target = null;
        Node after = null;
        Element revisedParagraph = ctx.paragraphByOutput.get(outputIndex);
        if (revisedParagraph != null && !ctx.isRemovedOnReject(revisedParagraph, outputIndex)) {
            target = revisedParagraph;
            if (ctx.lastOutputIndex != null && ctx.lastOutputIndex == outputIndex) {
                after = ctx.lastNode;
            }
        } else if (ctx.created.containsKey(outputIndex)) {
            target = ctx.created.get(outputIndex);
            after = ctx.createdLastNode.get(outputIndex);
        } else if (outputIndex >= 0) {
            target = WmlNodes.createElement(ctx.document, WmlNodes.P);
            Element sourceParagraph = atom.getSourceParagraph();
            Element pPr = sourceParagraph != null ? WmlNodes.findChild(sourceParagraph, WmlNodes.PPR) : null;
            if (pPr != null) {
                target.appendChild(ctx.document.importNode(pPr, true));
            }
            insertParagraph(target, ctx);
            ctx.created.put(outputIndex, target);
        }
        if (target == null) {
            target = ctx.lastParagraph;
        }
        if (target == null) {
            log.warn("Cannot place deleted content '{}': no target paragraph", atom.getText());
            return;
        }

        Element wrapper = moved ? ctx.markup.wrapper(WmlNodes.MOVE_FROM) : ctx.markup.del();
        for (Node marker : ctx.originalMarkers(atom, true)) {
            wrapper.appendChild(unwrapMarker(marker));
        }
        Element run = cloneRunWithContent(atom, ctx.document);
        WmlNodes.convertToDelText(run);
        wrapper.appendChild(run);
        for (Node marker : ctx.originalMarkers(atom, false)) {
            wrapper.appendChild(unwrapMarker(marker));
        }

        Node last;
        if (moved) {
            last = insertMoveFrom(target, after, wrapper, moveName(atom), ctx);
        } else {
            insertAfter(target, after, wrapper);
            last = wrapper;
        }
        if (ctx.created.get(outputIndex) == target) {
            ctx.createdLastNode.put(outputIndex, last);
        }
        ctx.moveTo(last, target, outputIndex);
    }

    /**
     * Place a moveFrom wrapper between its range markers, extending the range
     * that ends right at {@code after} when it belongs to the same move.
     */
    private static Node insertMoveFrom(Element paragraph, Node after, Element moveFrom, String moveName, Context ctx) {
        Element rangeEnd = ctx.markup.moveFromRangeEnd(moveName);
        if (after instanceof Element && WmlNodes.MOVE_FROM_RANGE_END.equals(((Element) after).getTagName())
                && rangeEnd.getAttribute(WmlNodes.ATTR_ID).equals(((Element) after).getAttribute(WmlNodes.ATTR_ID))) {
            after.getParentNode().insertBefore(moveFrom, after);
            return after;
        }
        Element rangeStart = ctx.markup.moveFromRangeStart(moveName);
        insertAfter(paragraph, after, rangeStart);
        WmlNodes.insertAfter(rangeStart, moveFrom);
        WmlNodes.insertAfter(moveFrom, rangeEnd);
        return rangeEnd;
    }

    private void handleMovedDestination(ComparisonUnitAtom atom, Context ctx) {
        List<Element> runs = atomRuns(atom);
        if (runs.isEmpty()) {
            return;
        }
        String moveName = moveName(atom);
        for (Element run : runs) {
            if (ctx.wrappedRuns.contains(run) || run.getParentNode() == null) {
                continue;
            }
            Element rangeEnd = ctx.markup.moveToRangeEnd(moveName);
            Node previous = previousElementSibling(run);
            boolean extend = previous instanceof Element
                    && WmlNodes.MOVE_TO_RANGE_END.equals(((Element) previous).getTagName())
                    && rangeEnd.getAttribute(WmlNodes.ATTR_ID).equals(((Element) previous).getAttribute(WmlNodes.ATTR_ID));
            wrapRun(run, ctx.markup.wrapper(WmlNodes.MOVE_TO), ctx);
            Element wrapper = WmlNodes.parentElement(run);
            if (extend) {
                WmlNodes.insertAfter(wrapper, previous);
            } else {
                wrapper.getParentNode().insertBefore(ctx.markup.moveToRangeStart(moveName), wrapper);
                WmlNodes.insertAfter(wrapper, rangeEnd);
            }
        }
        insertOriginalAround(runs, atom.getAtomBefore(), ctx);
        ctx.moveTo(anchor(runs.get(runs.size() - 1)), atom.getSourceParagraph(), atom.getOutputParagraphIndex());
    }

    private void handleFormatChanged(ComparisonUnitAtom atom, Context ctx) {
        List<Element> runs = atomRuns(atom);
        if (runs.isEmpty()) {
            return;
        }
        Element run = runs.get(0);
        if (atom.getFormatChange() != null && ctx.formatChangedRuns.add(run)) {
            Element rPr = WmlNodes.findChild(run, WmlNodes.RPR);
            if (rPr == null) {
                rPr = WmlNodes.createElement(ctx.document, WmlNodes.RPR);
                run.insertBefore(rPr, run.getFirstChild());
            }
            rPr.appendChild(ctx.markup.runPropertiesChange(atom.getFormatChange().getOldRunProperties()));
        }
        insertOriginalAround(runs, atom.getAtomBefore(), ctx);
        ctx.moveTo(anchor(runs.get(runs.size() - 1)), atom.getSourceParagraph(), atom.getOutputParagraphIndex());
    }

    private void handleEqual(ComparisonUnitAtom atom, Context ctx) {
        List<Element> runs = atomRuns(atom);
        if (!runs.isEmpty()) {
            insertOriginalAround(runs, atom.getAtomBefore(), ctx);
            ctx.moveTo(anchor(runs.get(runs.size() - 1)), atom.getSourceParagraph(), atom.getOutputParagraphIndex());
            return;
        }
        // Equal empty paragraphs are original atoms; position on the revised counterpart.
        Element revisedParagraph = ctx.paragraphByOutput.get(atom.getOutputParagraphIndex());
        if (revisedParagraph != null && atom.isFromOriginal()) {
            Node after = null;
            List<Node> markers = new ArrayList<>(ctx.originalMarkers(atom, true));
            markers.addAll(ctx.originalMarkers(atom, false));
            for (Node marker : markers) {
                insertAfter(revisedParagraph, after, marker);
                after = marker;
            }
        }
        ctx.moveTo(null, revisedParagraph != null ? revisedParagraph : ctx.lastParagraph, atom.getOutputParagraphIndex());
    }

    /**
     * Clone the unstable markers of {@code original} next to the revised runs
     * standing in for it.
     */
    private static void insertOriginalAround(List<Element> runs, ComparisonUnitAtom original, Context ctx) {
        if (original == null || !original.hasBookmarks()) {
            return;
        }
        Node first = anchor(runs.get(0));
        for (Node marker : ctx.originalMarkers(original, true)) {
            first.getParentNode().insertBefore(marker, first);
        }
        Node last = anchor(runs.get(runs.size() - 1));
        for (Node marker : ctx.originalMarkers(original, false)) {
            WmlNodes.insertAfter(last, marker);
            last = marker;
        }
    }

    private static void applyWholeParagraphMarkers(Map<Integer, List<ComparisonUnitAtom>> atomsByParagraph, Context ctx) {
        for (Map.Entry<Integer, List<ComparisonUnitAtom>> entry : atomsByParagraph.entrySet()) {
            Integer index = entry.getKey();
            if (isEntirely(entry.getValue(), CorrelationStatus.INSERTED)) {
                Element paragraph = ctx.paragraphByOutput.get(index);
                if (paragraph != null && !RevisionMarkup.hasParagraphMarker(paragraph, WmlNodes.INS)) {
                    ctx.markup.markParagraph(paragraph, WmlNodes.INS);
                }
            } else if (isEntirely(entry.getValue(), CorrelationStatus.DELETED)) {
                Element paragraph = ctx.created.containsKey(index) ? ctx.created.get(index) : ctx.paragraphByOutput.get(index);
                if (paragraph != null && !RevisionMarkup.hasParagraphMarker(paragraph, WmlNodes.DEL)) {
                    ctx.markup.markParagraph(paragraph, WmlNodes.DEL);
                }
            }
        }
    }

    /**
     * Wrap revised markers in w:ins unless their name is stable in both documents.
     * Stable markers inside paragraphs that disappear on reject move in front of
     * their paragraph.
     */
    private static void markRevisedOnlyBookmarks(List<ComparisonUnitAtom> revisedAtoms, Context ctx) {
        Set<Element> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        for (ComparisonUnitAtom atom : revisedAtoms) {
            List<Element> markers = new ArrayList<>(atom.getLeadingBookmarks());
            markers.addAll(atom.getTrailingBookmarks());
            for (Element marker : markers) {
                if (!seen.add(marker) || marker.getParentNode() == null) {
                    continue;
                }
                String key = ctx.bookmarks.key(marker, false);
                if (!ctx.bookmarks.isStable(key)) {
                    if (!WmlNodes.hasAncestor(marker, WmlNodes.INS, WmlNodes.MOVE_TO)) {
                        WmlNodes.wrap(marker, ctx.markup.ins());
                    }
                    continue;
                }
                Element paragraph = WmlNodes.findAncestor(marker, WmlNodes.P);
                if (paragraph != null && RevisionMarkup.hasParagraphMarker(paragraph, WmlNodes.INS)
                        && !WmlNodes.hasAncestor(marker, WmlNodes.INS, WmlNodes.MOVE_TO)) {
                    WmlNodes.remove(marker);
                    paragraph.getParentNode().insertBefore(marker, paragraph);
                }
            }
        }
    }

    /**
     * Join adjacent revision wrappers of the same kind with equal author and date.
     *
     * @return number of wrappers absorbed
     */
    static int mergeAdjacentWrappers(Element root) {
        int merged = 0;
        List<Element> children = WmlNodes.childElements(root);
        int i = 0;
        while (i < children.size() - 1) {
            Element a = children.get(i);
            Element b = children.get(i + 1);
            if (a.getTagName().equals(b.getTagName()) && REVISION_WRAPPERS.contains(a.getTagName())
                    && a.getNextSibling() == b
                    && a.getAttribute(WmlNodes.ATTR_AUTHOR).equals(b.getAttribute(WmlNodes.ATTR_AUTHOR))
                    && a.getAttribute(WmlNodes.ATTR_DATE).equals(b.getAttribute(WmlNodes.ATTR_DATE))) {
                while (b.getFirstChild() != null) {
                    a.appendChild(b.getFirstChild());
                }
                root.removeChild(b);
                children.remove(i + 1);
                merged++;
                continue;
            }
            i++;
        }
        for (Element child : WmlNodes.childElements(root)) {
            merged += mergeAdjacentWrappers(child);
        }
        return merged;
    }

    // Helpers

    private static List<Element> atomRuns(ComparisonUnitAtom atom) {
        List<Element> runs = new ArrayList<>();
        if (atom.getCollapsedFieldAtoms().isEmpty()) {
            if (atom.getSourceRun() != null) {
                runs.add(atom.getSourceRun());
            }
            return runs;
        }
        Set<Element> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        for (ComparisonUnitAtom fieldAtom : atom.getCollapsedFieldAtoms()) {
            Element run = fieldAtom.getSourceRun();
            if (run != null && seen.add(run)) {
                runs.add(run);
            }
        }
        return runs;
    }

    private static void wrapRun(Element run, Element wrapper, Context ctx) {
        if (run.getParentNode() == null || !ctx.wrappedRuns.add(run)) {
            return;
        }
        WmlNodes.wrap(run, wrapper);
    }

    /**
     * Node after which following content goes: the run itself, its revision wrapper,
     * or the move range end closing that wrapper.
     */
    private static Node anchor(Element run) {
        Element parent = WmlNodes.parentElement(run);
        if (parent == null || !REVISION_WRAPPERS.contains(parent.getTagName())) {
            return run;
        }
        Node next = nextElementSibling(parent);
        if (next instanceof Element && (WmlNodes.MOVE_TO_RANGE_END.equals(((Element) next).getTagName())
                || WmlNodes.MOVE_FROM_RANGE_END.equals(((Element) next).getTagName()))) {
            return next;
        }
        return parent;
    }

    private static Element cloneRunWithContent(ComparisonUnitAtom atom, Document document) {
        Element source = atom.getSourceRun();
        Element run = (Element) document.importNode(source, false);
        Element rPr = WmlNodes.findChild(source, WmlNodes.RPR);
        if (rPr != null) {
            run.appendChild(document.importNode(rPr, true));
        }
        if (atom.getCollapsedFieldAtoms().isEmpty()) {
            run.appendChild(document.importNode(atom.getContentElement(), true));
        } else {
            for (ComparisonUnitAtom fieldAtom : atom.getCollapsedFieldAtoms()) {
                run.appendChild(document.importNode(fieldAtom.getContentElement(), true));
            }
        }
        return run;
    }

    private static void insertParagraph(Element paragraph, Context ctx) {
        if (ctx.lastParagraph != null && ctx.lastParagraph.getParentNode() != null) {
            WmlNodes.insertAfter(ctx.lastParagraph, paragraph);
        } else {
            ctx.body.insertBefore(paragraph, ctx.body.getFirstChild());
        }
    }

    private static void insertAfter(Element paragraph, Node after, Node node) {
        if (after != null && after.getParentNode() != null) {
            WmlNodes.insertAfter(after, node);
        } else {
            WmlNodes.insertAtContentStart(paragraph, node);
        }
    }

    /**
     * Markers produced for a wrapper's content do not need their own w:del.
     */
    private static Node unwrapMarker(Node marker) {
        if (marker instanceof Element && WmlNodes.DEL.equals(((Element) marker).getTagName())
                && marker.getFirstChild() != null) {
            return marker.getFirstChild();
        }
        return marker;
    }

    private static Node previousElementSibling(Node node) {
        Node sibling = node.getPreviousSibling();
        while (sibling != null && sibling.getNodeType() != Node.ELEMENT_NODE) {
            sibling = sibling.getPreviousSibling();
        }
        return sibling;
    }

    private static Node nextElementSibling(Node node) {
        Node sibling = node.getNextSibling();
        while (sibling != null && sibling.getNodeType() != Node.ELEMENT_NODE) {
            sibling = sibling.getNextSibling();
        }
        return sibling;
    }

    private static String moveName(ComparisonUnitAtom atom) {
        return atom.getMoveName() != null ? atom.getMoveName() : "move1";
    }

    private static Map<Integer, List<ComparisonUnitAtom>> byOutputParagraph(List<ComparisonUnitAtom> atoms) {
        Map<Integer, List<ComparisonUnitAtom>> result = new LinkedHashMap<>();
        for (ComparisonUnitAtom atom : atoms) {
            if (atom.getOutputParagraphIndex() >= 0) {
                result.computeIfAbsent(atom.getOutputParagraphIndex(), k -> new ArrayList<>()).add(atom);
            }
        }
        return result;
    }

    static boolean isEntirely(List<ComparisonUnitAtom> atoms, CorrelationStatus status) {
        boolean sawContent = false;
        boolean sawStatus = false;
        for (ComparisonUnitAtom atom : atoms) {
            if (atom.isEmptyParagraph()) {
                continue;
            }
            sawContent = true;
            if (atom.getCorrelationStatus() == status) {
                sawStatus = true;
                continue;
            }
            String tag = atom.getTag();
            boolean whitespace = (atom.isText() && atom.getText().trim().isEmpty())
                    || WmlNodes.TAB.equals(tag) || WmlNodes.BR.equals(tag) || WmlNodes.CR.equals(tag);
            if (!whitespace) {
                return false;
            }
        }
        return sawContent && sawStatus;
    }

    /**
     * Position tracking and bookkeeping for one modification.
     */
    private static class Context {
        final RevisionMarkup markup;
        final Element body;
        final BookmarkIndex bookmarks;
        final Document document;
        final Map<Integer, Element> paragraphByOutput = new HashMap<>();
        final Set<Integer> fullyInserted = new HashSet<>();
        final Map<Integer, Element> created = new HashMap<>();
        final Map<Integer, Node> createdLastNode = new HashMap<>();
        final Set<Element> wrappedRuns = Collections.newSetFromMap(new IdentityHashMap<>());
        final Set<Element> formatChangedRuns = Collections.newSetFromMap(new IdentityHashMap<>());
        final Set<ComparisonUnitAtom> markersWritten = Collections.newSetFromMap(new IdentityHashMap<>());
        final Map<String, String> clonedIds = new HashMap<>();
        int nextBookmarkId;

        Node lastNode;
        Element lastParagraph;
        Integer lastOutputIndex;

        Context(RevisionMarkup markup, Element body, BookmarkIndex bookmarks, Document document) {
            this.markup = markup;
            this.body = body;
            this.bookmarks = bookmarks;
            this.document = document;
            this.nextBookmarkId = maxBookmarkId(body) + 1;
        }

        void moveTo(Node node, Element paragraph, int outputIndex) {
            lastNode = node;
            if (paragraph != null) {
                lastParagraph = paragraph;
            }
            lastOutputIndex = outputIndex;
        }

        boolean isRemovedOnReject(Element paragraph, int outputIndex) {
            return fullyInserted.contains(outputIndex) || RevisionMarkup.hasParagraphMarker(paragraph, WmlNodes.INS);
        }

        /**
         * Copies of the original markers whose name is not stable, before
         * ({@code leading}) or after an original atom, each wrapped in w:del, with
         * ids that do not collide with the revised document. Each atom's markers are
         * produced once.
         */
        List<Node> originalMarkers(ComparisonUnitAtom atom, boolean leading) {
            if (!atom.hasBookmarks()) {
                return Collections.emptyList();
            }
            if (leading && !markersWritten.add(atom)) {
                return Collections.emptyList();
            }
            List<Node> result = new ArrayList<>();
            for (Element marker : leading ? atom.getLeadingBookmarks() : atom.getTrailingBookmarks()) {
                String key = bookmarks.key(marker, true);
                if (bookmarks.isStable(key)) {
                    continue;
                }
                Element copy = (Element) document.importNode(marker, true);
                String id = clonedIds.computeIfAbsent(key, k -> String.valueOf(nextBookmarkId++));
                WmlNodes.setAttribute(copy, WmlNodes.ATTR_ID, id);
                Element wrapper = markup.del();
                wrapper.appendChild(copy);
                result.add(wrapper);
            }
            return result;
        }

        private static int maxBookmarkId(Element root) {
            int max = 0;
            for (String tag : new String[]{WmlNodes.BOOKMARK_START, WmlNodes.BOOKMARK_END}) {
                for (Element marker : WmlNodes.findAll(root, tag)) {
                    try {
                        max = Math.max(max, Integer.parseInt(marker.getAttribute(WmlNodes.ATTR_ID)));
                    } catch (NumberFormatException e) {
                        log.debug("Ignoring non-numeric bookmark id '{}'", marker.getAttribute(WmlNodes.ATTR_ID));
                    }
                }
            }
            return max;
        }
    }
}
