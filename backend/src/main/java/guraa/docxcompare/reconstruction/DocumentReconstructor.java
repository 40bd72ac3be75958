package guraa.docxcompare.reconstruction;

import guraa.docxcompare.core.AtomFingerprint;
import guraa.docxcompare.core.ComparisonUnitAtom;
import guraa.docxcompare.core.CorrelationStatus;
import guraa.docxcompare.core.FormatChangeDetector;
import guraa.docxcompare.exception.MalformedDocumentException;
import guraa.docxcompare.util.WmlNodes;
import guraa.docxcompare.util.WmlXml;
import lombok.extern.slf4j.Slf4j;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Builds a new document body from the merged atom list.
 * <p>
 * The original document is copied and its body replaced by one paragraph per output
 * paragraph index. Everything outside the body, and the trailing section properties,
 * come from the original unchanged. Tables and other block containers are not
 * rebuilt: their paragraphs are written as plain body paragraphs.
 */
@Slf4j
public class DocumentReconstructor {

    private final boolean trackParagraphPropertyChanges;

    public DocumentReconstructor(boolean trackParagraphPropertyChanges) {
        this.trackParagraphPropertyChanges = trackParagraphPropertyChanges;
    }

    public DocumentReconstructor() {
        this(true);
    }

    public Document reconstruct(List<ComparisonUnitAtom> mergedAtoms, Document originalDocument,
                                String author, Instant date) {
        Document output = WmlXml.copy(originalDocument);
        Element body = WmlNodes.findBody(output);
        if (body == null) {
            throw new MalformedDocumentException("Document has no w:body");
        }
        Element sectPr = null;
        List<Element> bodyChildren = WmlNodes.childElements(body);
        if (!bodyChildren.isEmpty() && WmlNodes.SECT_PR.equals(bodyChildren.get(bodyChildren.size() - 1).getTagName())) {
            sectPr = bodyChildren.get(bodyChildren.size() - 1);
        }
        while (body.getFirstChild() != null) {
            body.removeChild(body.getFirstChild());
        }

        RevisionMarkup markup = new RevisionMarkup(output, author, date);
        BookmarkWriter bookmarks = new BookmarkWriter(markup, BookmarkIndex.of(mergedAtoms));

        List<ParagraphGroup> paragraphs = groupByParagraph(mergedAtoms);
        for (ParagraphGroup paragraph : paragraphs) {
            writeParagraph(body, paragraph, markup, bookmarks);
        }
        if (sectPr != null) {
            body.appendChild(sectPr);
        }
        log.debug("Rebuilt {} paragraphs from {} atoms", paragraphs.size(), mergedAtoms.size());
        return output;
    }

    List<ParagraphGroup> groupByParagraph(List<ComparisonUnitAtom> atoms) {
        List<ComparisonUnitAtom> sorted = new ArrayList<>(atoms);
        sorted.sort(Comparator.comparingInt(DocumentReconstructor::sortKey));

        List<ParagraphGroup> groups = new ArrayList<>();
        ParagraphGroup current = null;
        RunGroup run = null;
        for (ComparisonUnitAtom atom : sorted) {
            if (current == null || current.outputIndex != atom.getOutputParagraphIndex()) {
                current = new ParagraphGroup(atom.getOutputParagraphIndex());
                groups.add(current);
                run = null;
            }
            current.atoms.add(atom);
            if (run == null || startsNewRunGroup(run, atom)) {
                run = new RunGroup(atom.getCorrelationStatus(), atom.getMoveName(), atom.getRunProperties(),
                        atom.getFormatChange() != null ? atom.getFormatChange().getOldRunProperties() : null);
                current.runGroups.add(run);
            }
            run.atoms.add(atom);
        }
        return groups;
    }

    private static int sortKey(ComparisonUnitAtom atom) {
        return atom.getOutputParagraphIndex() < 0 ? Integer.MAX_VALUE : atom.getOutputParagraphIndex();
    }

    private static boolean startsNewRunGroup(RunGroup group, ComparisonUnitAtom atom) {
        if (group.status != atom.getCorrelationStatus() || !Objects.equals(group.moveName, atom.getMoveName())) {
            return true;
        }
        if (!AtomFingerprint.deepEquals(group.runProperties, atom.getRunProperties())) {
            return true;
        }
        if (group.status == CorrelationStatus.FORMAT_CHANGED) {
            Element oldRPr = atom.getFormatChange() != null ? atom.getFormatChange().getOldRunProperties() : null;
            return !AtomFingerprint.deepEquals(group.oldRunProperties, oldRPr);
        }
        return false;
    }

    /**
     * Inside each block of deletions and insertions, emit all deletions first and then
     * all insertions. Whitespace-only equal groups inside the block go to both sides.
     */
    static List<RunGroup> reorderChangeBlocks(List<RunGroup> runGroups) {
        List<RunGroup> result = new ArrayList<>();
        int i = 0;
        while (i < runGroups.size()) {
            if (!isChange(runGroups.get(i))) {
                result.add(runGroups.get(i++));
                continue;
            }
            List<RunGroup> deletions = new ArrayList<>();
            List<RunGroup> insertions = new ArrayList<>();
            while (i < runGroups.size()) {
                RunGroup group = runGroups.get(i);
                if (group.status == CorrelationStatus.DELETED) {
                    deletions.add(group);
                } else if (group.status == CorrelationStatus.INSERTED) {
                    insertions.add(group);
                } else if (group.status == CorrelationStatus.EQUAL && group.isWhitespaceOnly()) {
                    deletions.add(group.withStatus(CorrelationStatus.DELETED));
                    insertions.add(group.withStatus(CorrelationStatus.INSERTED));
                } else {
                    break;
                }
                i++;
            }
            result.addAll(deletions);
            result.addAll(insertions);
        }
        return result;
    }

    private static boolean isChange(RunGroup group) {
        return group.status == CorrelationStatus.DELETED || group.status == CorrelationStatus.INSERTED;
    }

    private void writeParagraph(Element body, ParagraphGroup group, RevisionMarkup markup, BookmarkWriter bookmarks) {
        Document document = markup.getDocument();
        Element paragraph = WmlNodes.createElement(document, WmlNodes.P);
        Element pPr = paragraphProperties(group, markup);
        if (pPr != null) {
            paragraph.appendChild(pPr);
        }

        CorrelationStatus wholeStatus = null;
        if (group.isEmpty()) {
            CorrelationStatus status = group.atoms.get(0).getCorrelationStatus();
            if (status == CorrelationStatus.INSERTED || status == CorrelationStatus.DELETED) {
                wholeStatus = status;
            }
        } else if (group.isEntirely(CorrelationStatus.INSERTED)) {
            wholeStatus = CorrelationStatus.INSERTED;
        } else if (group.isEntirely(CorrelationStatus.DELETED)) {
            wholeStatus = CorrelationStatus.DELETED;
        }

        if (wholeStatus != null) {
            String tag = wholeStatus == CorrelationStatus.INSERTED ? WmlNodes.INS : WmlNodes.DEL;
            markup.markParagraph(paragraph, tag);
            List<Node> hoisted = new ArrayList<>();
            if (!group.isEmpty()) {
                writeWholeParagraph(paragraph, group, tag, markup, bookmarks, hoisted);
            } else {
                for (ComparisonUnitAtom atom : group.atoms) {
                    hoisted.addAll(bookmarks.leading(atom));
                    hoisted.addAll(bookmarks.trailing(atom));
                }
            }
            for (Node marker : hoisted) {
                body.appendChild(marker);
            }
            body.appendChild(paragraph);
            return;
        }

        List<RunGroup> ordered = reorderChangeBlocks(group.runGroups);
        int start = 0;
        while (start < ordered.size()) {
            int end = start + 1;
            while (end < ordered.size() && sameUnit(ordered.get(start), ordered.get(end))) {
                end++;
            }
            writeUnit(paragraph, ordered.subList(start, end), markup, bookmarks);
            start = end;
        }
        body.appendChild(paragraph);
    }

    private static boolean sameUnit(RunGroup a, RunGroup b) {
        return a.status == b.status && Objects.equals(a.moveName, b.moveName)
                && a.status != CorrelationStatus.FORMAT_CHANGED;
    }

    /**
     * Paragraph properties of the revised paragraph when there is one, with a
     * w:pPrChange when the original paragraph's properties differ.
     */
    private Element paragraphProperties(ParagraphGroup group, RevisionMarkup markup) {
        Element originalPPr = null;
        Element revisedPPr = null;
        boolean sawOriginal = false;
        boolean sawRevised = false;
        for (ComparisonUnitAtom atom : group.atoms) {
            if (atom.isFromOriginal() && !sawOriginal) {
                originalPPr = paragraphPropertiesOf(atom);
                sawOriginal = true;
            } else if (!atom.isFromOriginal()) {
                if (!sawRevised) {
                    revisedPPr = paragraphPropertiesOf(atom);
                    sawRevised = true;
                }
                if (!sawOriginal && atom.getAtomBefore() != null) {
                    originalPPr = paragraphPropertiesOf(atom.getAtomBefore());
                    sawOriginal = true;
                }
            }
        }
        Element source = sawRevised ? revisedPPr : originalPPr;
        Element pPr = source != null ? importProperties(markup.getDocument(), source) : null;

        if (trackParagraphPropertyChanges && sawOriginal && sawRevised) {
            List<String> changed = FormatChangeDetector.changedParagraphProperties(originalPPr, revisedPPr);
            if (!changed.isEmpty()) {
                if (pPr == null) {
                    pPr = WmlNodes.createElement(markup.getDocument(), WmlNodes.PPR);
                }
                pPr.appendChild(markup.paragraphPropertiesChange(withoutParagraphMark(originalPPr)));
                log.debug("Paragraph {} properties changed: {}", group.outputIndex, changed);
            }
        }
        return pPr;
    }

    private static Element paragraphPropertiesOf(ComparisonUnitAtom atom) {
        Element sourceParagraph = atom.getParagraph();
        return sourceParagraph != null ? WmlNodes.findChild(sourceParagraph, WmlNodes.PPR) : null;
    }

    /**
     * Copy of a w:pPr without revision records carried over from the input.
     */
    private static Element importProperties(Document document, Element pPr) {
        Element copy = (Element) document.importNode(pPr, true);
        for (Element child : WmlNodes.childElements(copy)) {
            if (WmlNodes.PPR_CHANGE.equals(child.getTagName())) {
                copy.removeChild(child);
            }
        }
        Element markRPr = WmlNodes.findChild(copy, WmlNodes.RPR);
        if (markRPr != null) {
            for (Element child : WmlNodes.childElements(markRPr)) {
                String tag = child.getTagName();
                if (WmlNodes.INS.equals(tag) || WmlNodes.DEL.equals(tag)
                        || WmlNodes.MOVE_FROM.equals(tag) || WmlNodes.MOVE_TO.equals(tag)
                        || WmlNodes.RPR_CHANGE.equals(tag)) {
                    markRPr.removeChild(child);
                }
            }
        }
        return copy;
    }

    private static Element withoutParagraphMark(Element pPr) {
        if (pPr == null) {
            return null;
        }
        Element copy = (Element) pPr.cloneNode(true);
        for (Element child : WmlNodes.childElements(copy)) {
            String tag = child.getTagName();
            if (WmlNodes.RPR.equals(tag) || WmlNodes.SECT_PR.equals(tag)) {
                copy.removeChild(child);
            }
        }
        return copy;
    }

    private void writeWholeParagraph(Element paragraph, ParagraphGroup group, String tag,
                                     RevisionMarkup markup, BookmarkWriter bookmarks, List<Node> hoisted) {
        Element wrapper = markup.wrapper(tag);
        boolean deletion = WmlNodes.DEL.equals(tag);
        for (RunGroup runGroup : group.runGroups) {
            RunWriter run = null;
            for (ComparisonUnitAtom atom : runGroup.atoms) {
                hoisted.addAll(bookmarks.leading(atom));
                if (!atom.isEmptyParagraph()) {
                    if (run == null) {
                        run = new RunWriter(markup.getDocument(), runGroup.runProperties, deletion);
                        wrapper.appendChild(run.run);
                    }
                    run.append(atom);
                }
                hoisted.addAll(bookmarks.trailing(atom));
            }
        }
        if (wrapper.hasChildNodes()) {
            paragraph.appendChild(wrapper);
        }
    }

    /**
     * Write consecutive run groups sharing one status and move name. Bookmark markers
     * close the current wrapper and are written between wrappers.
     */
    private void writeUnit(Element paragraph, List<RunGroup> unit, RevisionMarkup markup, BookmarkWriter bookmarks) {
        RunGroup first = unit.get(0);
        CorrelationStatus status = first.status;
        String wrapperTag = wrapperTag(status);
        boolean deletion = status.isDeletion();
        String moveName = first.moveName != null ? first.moveName : "move1";

        if (status == CorrelationStatus.MOVED_SOURCE) {
            paragraph.appendChild(markup.moveFromRangeStart(moveName));
        } else if (status == CorrelationStatus.MOVED_DESTINATION) {
            paragraph.appendChild(markup.moveToRangeStart(moveName));
        }

        Element wrapper = null;
        for (RunGroup group : unit) {
            RunWriter run = null;
            for (ComparisonUnitAtom atom : group.atoms) {
                List<Node> leading = bookmarks.leading(atom);
                if (!leading.isEmpty()) {
                    wrapper = null;
                    run = null;
                    appendAll(paragraph, leading);
                }
                if (!atom.isEmptyParagraph()) {
                    if (run == null) {
                        if (wrapperTag != null && wrapper == null) {
                            wrapper = markup.wrapper(wrapperTag);
                            paragraph.appendChild(wrapper);
                        }
                        run = new RunWriter(markup.getDocument(), group.runProperties, deletion);
                        if (status == CorrelationStatus.FORMAT_CHANGED) {
                            run.recordFormatChange(markup, group.oldRunProperties);
                        }
                        (wrapper != null ? wrapper : paragraph).appendChild(run.run);
                    }
                    run.append(atom);
                }
                List<Node> trailing = bookmarks.trailing(atom);
                if (!trailing.isEmpty()) {
                    wrapper = null;
                    run = null;
                    appendAll(paragraph, trailing);
                }
            }
        }

        if (status == CorrelationStatus.MOVED_SOURCE) {
            paragraph.appendChild(markup.moveFromRangeEnd(moveName));
        } else if (status == CorrelationStatus.MOVED_DESTINATION) {
            paragraph.appendChild(markup.moveToRangeEnd(moveName));
        }
    }

    private static String wrapperTag(CorrelationStatus status) {
        switch (status) {
            case INSERTED:
                return WmlNodes.INS;
            case DELETED:
                return WmlNodes.DEL;
            case MOVED_SOURCE:
                return WmlNodes.MOVE_FROM;
            case MOVED_DESTINATION:
                return WmlNodes.MOVE_TO;
            default:
                return null;
        }
    }

    private static void appendAll(Element parent, List<Node> nodes) {
        for (Node node : nodes) {
            parent.appendChild(node);
        }
    }

    /**
     * Atoms that share one output paragraph.
     */
    static class ParagraphGroup {
        final int outputIndex;
        final List<ComparisonUnitAtom> atoms = new ArrayList<>();
        final List<RunGroup> runGroups = new ArrayList<>();

        ParagraphGroup(int outputIndex) {
            this.outputIndex = outputIndex;
        }

        boolean isEmpty() {
            for (ComparisonUnitAtom atom : atoms) {
                if (!atom.isEmptyParagraph()) {
                    return false;
                }
            }
            return true;
        }

        /**
         * True when every content atom has {@code status}, ignoring whitespace, tabs and breaks.
         */
        boolean isEntirely(CorrelationStatus status) {
            boolean sawContent = false;
            boolean sawStatus = false;
            for (ComparisonUnitAtom atom : atoms) {
                if (atom.isEmptyParagraph()) {
                    continue;
                }
                sawContent = true;
                if (atom.getCorrelationStatus() == status) {
                    sawStatus = true;
                } else if (!isWhitespace(atom)) {
                    return false;
                }
            }
            return sawContent && sawStatus;
        }

        private static boolean isWhitespace(ComparisonUnitAtom atom) {
            String tag = atom.getTag();
            return (atom.isText() && atom.getText().trim().isEmpty())
                    || WmlNodes.TAB.equals(tag) || WmlNodes.BR.equals(tag) || WmlNodes.CR.equals(tag);
        }
    }

    /**
     * Consecutive atoms of one paragraph written with the same wrapper and run properties.
     */
    static class RunGroup {
        final CorrelationStatus status;
        final String moveName;
        final Element runProperties;
        final Element oldRunProperties;
        final List<ComparisonUnitAtom> atoms;

        RunGroup(CorrelationStatus status, String moveName, Element runProperties, Element oldRunProperties) {
            this(status, moveName, runProperties, oldRunProperties, new ArrayList<>());
        }

        private RunGroup(CorrelationStatus status, String moveName, Element runProperties,
                         Element oldRunProperties, List<ComparisonUnitAtom> atoms) {
            this.status = status;
            this.moveName = moveName;
            this.runProperties = runProperties;
            this.oldRunProperties = oldRunProperties;
            this.atoms = atoms;
        }

        RunGroup withStatus(CorrelationStatus newStatus) {
            return new RunGroup(newStatus, moveName, runProperties, oldRunProperties, atoms);
        }

        boolean isWhitespaceOnly() {
            for (ComparisonUnitAtom atom : atoms) {
                if (!atom.getText().trim().isEmpty()) {
                    return false;
                }
            }
            return true;
        }
    }

    /**
     * Appends atom content to one output run, joining adjacent text.
     */
    private static class RunWriter {
        private final Document document;
        private final Element run;
        private final boolean deletion;
        private Element openText;

        RunWriter(Document document, Element runProperties, boolean deletion) {
            this.document = document;
            this.deletion = deletion;
            this.run = WmlNodes.createElement(document, WmlNodes.R);
            if (runProperties != null) {
                Element rPr = (Element) document.importNode(runProperties, true);
                for (Element child : WmlNodes.childElements(rPr)) {
                    if (WmlNodes.RPR_CHANGE.equals(child.getTagName())) {
                        rPr.removeChild(child);
                    }
                }
                run.appendChild(rPr);
            }
        }

        void recordFormatChange(RevisionMarkup markup, Element oldRunProperties) {
            Element rPr = WmlNodes.findChild(run, WmlNodes.RPR);
            if (rPr == null) {
                rPr = WmlNodes.createElement(document, WmlNodes.RPR);
                run.insertBefore(rPr, run.getFirstChild());
            }
            rPr.appendChild(markup.runPropertiesChange(oldRunProperties));
        }

        void append(ComparisonUnitAtom atom) {
            if (atom.isCollapsedField() && !atom.getCollapsedFieldAtoms().isEmpty()) {
                openText = null;
                for (ComparisonUnitAtom fieldAtom : atom.getCollapsedFieldAtoms()) {
                    appendElement(fieldAtom.getContentElement(), false);
                }
                openText = null;
                return;
            }
            appendElement(atom.getContentElement(), true);
        }

        private void appendElement(Element element, boolean joinText) {
            if (WmlNodes.T.equals(element.getTagName())) {
                String text = element.getTextContent();
                if (joinText && openText != null) {
                    String joined = openText.getTextContent() + text;
                    openText.setTextContent(joined);
                    if (WmlNodes.needsSpacePreserve(joined)) {
                        WmlNodes.setAttribute(openText, WmlNodes.XML_SPACE, "preserve");
                    }
                    return;
                }
                Element textElement = WmlNodes.createTextElement(document, deletion ? WmlNodes.DEL_TEXT : WmlNodes.T, text);
                run.appendChild(textElement);
                openText = joinText ? textElement : null;
                return;
            }
            Element copy = (Element) document.importNode(element, true);
            if (deletion) {
                copy = WmlNodes.convertToDelText(copy);
            }
            run.appendChild(copy);
            openText = null;
        }
    }

    /**
     * Produces the bookmark markers to write around each atom.
     * <p>
     * Names present in both documents on content that accept and reject both keep
     * are written once, from the revised side. Every other revised marker is wrapped
     * in w:ins and every other original marker in w:del, so a bookmark on moved or
     * inserted content still exists after reject. Marker ids are renumbered per name.
     */
    static class BookmarkWriter {
        private final RevisionMarkup markup;
        private final BookmarkIndex index;
        private final Map<String, String> ids = new HashMap<>();
        private final Set<ComparisonUnitAtom> written = Collections.newSetFromMap(new IdentityHashMap<>());
        private final Set<ComparisonUnitAtom> writtenTrailing = Collections.newSetFromMap(new IdentityHashMap<>());

        BookmarkWriter(RevisionMarkup markup, BookmarkIndex index) {
            this.markup = markup;
            this.index = index;
        }

        List<Node> leading(ComparisonUnitAtom atom) {
            if (!written.add(atom)) {
                return Collections.emptyList();
            }
            return markers(atom, true);
        }

        List<Node> trailing(ComparisonUnitAtom atom) {
            if (!writtenTrailing.add(atom)) {
                return Collections.emptyList();
            }
            return markers(atom, false);
        }

        private List<Node> markers(ComparisonUnitAtom atom, boolean leading) {
            List<Node> result = new ArrayList<>();
            if (atom.isFromOriginal()) {
                addOriginal(atom, leading, result);
                ComparisonUnitAtom counterpart = atom.getAtomAfter();
                if (atom.isEmptyParagraph() && atom.getCorrelationStatus() == CorrelationStatus.EQUAL
                        && counterpart != null) {
                    addRevised(counterpart, leading, result);
                }
            } else {
                if (atom.getAtomBefore() != null) {
                    addOriginal(atom.getAtomBefore(), leading, result);
                }
                addRevised(atom, leading, result);
            }
            return result;
        }

        private void addOriginal(ComparisonUnitAtom atom, boolean leading, List<Node> result) {
            for (Element marker : leading ? atom.getLeadingBookmarks() : atom.getTrailingBookmarks()) {
                String key = index.key(marker, true);
                if (!index.isStable(key)) {
                    result.add(wrapped(markup.del(), copy(marker, key)));
                }
            }
        }

        private void addRevised(ComparisonUnitAtom atom, boolean leading, List<Node> result) {
            for (Element marker : leading ? atom.getLeadingBookmarks() : atom.getTrailingBookmarks()) {
                String key = index.key(marker, false);
                Element copy = copy(marker, key);
                result.add(index.isStable(key) ? copy : wrapped(markup.ins(), copy));
            }
        }

        private Element copy(Element marker, String key) {
            Element copy = (Element) markup.getDocument().importNode(marker, true);
            String id = ids.computeIfAbsent(key, k -> String.valueOf(ids.size()));
            WmlNodes.setAttribute(copy, WmlNodes.ATTR_ID, id);
            return copy;
        }

        private static Element wrapped(Element wrapper, Element marker) {
            wrapper.appendChild(marker);
            return wrapper;
        }
    }
}
