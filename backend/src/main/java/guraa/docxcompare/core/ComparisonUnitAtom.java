package guraa.docxcompare.core;

import guraa.docxcompare.util.WmlNodes;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Smallest comparable unit of a document: a text fragment, break, tab, field result
 * or a synthetic marker standing in for an empty paragraph.
 * <p>
 * The ancestor chain is captured when the atom is created and never changes afterwards,
 * even when the source tree is edited. Atoms compare by identity.
 */
@Getter
@Setter
public class ComparisonUnitAtom {

    /**
     * Tag of the synthetic content element representing an empty paragraph.
     */
    public static final String EMPTY_PARAGRAPH_TAG = "emptyParagraph";

    private Element contentElement;

    private final List<Element> ancestors;

    private final String partName;

    /**
     * Outermost pre-existing revision wrapper (w:ins, w:del, w:moveFrom, w:moveTo) in the ancestors.
     */
    private Element revTrackElement;

    @Setter(AccessLevel.NONE)
    private CorrelationStatus correlationStatus = CorrelationStatus.UNKNOWN;

    /**
     * True while the status comes from a revision wrapper in the input rather than from correlation.
     */
    @Setter(AccessLevel.NONE)
    private boolean revisionSeeded;

    private String hash;

    /**
     * Zero-based index of the paragraph this atom belongs to in its own document.
     */
    private int paragraphIndex = -1;

    /**
     * Index of the output paragraph this atom is written into.
     */
    private int outputParagraphIndex = -1;

    private Integer moveGroupId;
    private String moveName;
    private FormatChangeInfo formatChange;

    /**
     * Counterpart in the original document, set once the atom is EQUAL.
     */
    private ComparisonUnitAtom atomBefore;

    /**
     * Counterpart in the revised document, set on an original atom once it is EQUAL.
     */
    private ComparisonUnitAtom atomAfter;

    /**
     * True for atoms taken from the original document.
     */
    private boolean fromOriginal;

    private boolean emptyParagraph;
    private boolean collapsedField;
    private List<ComparisonUnitAtom> collapsedFieldAtoms = Collections.emptyList();
    private ComparisonUnitAtom splitFromAtom;

    /**
     * Bookmark markers found in the source tree right before this atom.
     */
    private List<Element> leadingBookmarks = new ArrayList<>();

    /**
     * Bookmark markers found after the last atom of a paragraph.
     */
    private List<Element> trailingBookmarks = new ArrayList<>();

    /**
     * Live run and paragraph in the revised tree, used by in-place reconstruction.
     */
    private Element sourceRun;
    private Element sourceParagraph;

    public ComparisonUnitAtom(Element contentElement, List<Element> ancestors, String partName) {
        this.contentElement = contentElement;
        this.ancestors = Collections.unmodifiableList(new ArrayList<>(ancestors));
        this.partName = partName;
        this.revTrackElement = findRevisionWrapper(this.ancestors);
        if (revTrackElement != null) {
            this.correlationStatus = seedStatus(revTrackElement.getTagName());
            this.revisionSeeded = correlationStatus.isRevisionSeed();
        }
        this.hash = AtomFingerprint.compute(contentElement);
    }

    /**
     * Move to the next status. Correlation may overwrite a status seeded from an
     * input revision; every other change must follow the transition table.
     *
     * @throws IllegalStateException for a transition the table does not allow
     */
    public void transitionTo(CorrelationStatus next) {
        boolean correlating = next == CorrelationStatus.EQUAL
                || next == CorrelationStatus.DELETED
                || next == CorrelationStatus.INSERTED;
        if (revisionSeeded && correlating) {
            revisionSeeded = false;
            correlationStatus = next;
            return;
        }
        if (!correlationStatus.canTransitionTo(next)) {
            throw new IllegalStateException("Illegal status transition " + correlationStatus + " -> " + next);
        }
        correlationStatus = next;
        revisionSeeded = false;
    }

    public String getTag() {
        return contentElement.getTagName();
    }

    /**
     * Leaf text of the content element, empty for non-text atoms.
     */
    public String getText() {
        String text = WmlNodes.getLeafText(contentElement);
        return text != null ? text : "";
    }

    public boolean isText() {
        return WmlNodes.T.equals(getTag());
    }

    public Element getParagraph() {
        return nearestAncestor(WmlNodes.P);
    }

    public Element getRun() {
        return nearestAncestor(WmlNodes.R);
    }

    public Element getRunProperties() {
        Element run = getRun();
        return run != null ? WmlNodes.findChild(run, WmlNodes.RPR) : null;
    }

    public String getRevisionTag() {
        return revTrackElement != null ? revTrackElement.getTagName() : null;
    }

    public Element nearestAncestor(String tagName) {
        for (int i = ancestors.size() - 1; i >= 0; i--) {
            if (tagName.equals(ancestors.get(i).getTagName())) {
                return ancestors.get(i);
            }
        }
        return null;
    }

    public boolean hasBookmarks() {
        return !leadingBookmarks.isEmpty() || !trailingBookmarks.isEmpty();
    }

    @Override
    public String toString() {
        return "Atom{" + getTag()
                + (getText().isEmpty() ? "" : " '" + getText() + "'")
                + ", " + correlationStatus
                + ", p=" + paragraphIndex
                + (moveName != null ? ", " + moveName : "")
                + "}";
    }

    private static Element findRevisionWrapper(List<Element> ancestors) {
        for (Element ancestor : ancestors) {
            String tagName = ancestor.getTagName();
            if (WmlNodes.INS.equals(tagName) || WmlNodes.DEL.equals(tagName)
                    || WmlNodes.MOVE_FROM.equals(tagName) || WmlNodes.MOVE_TO.equals(tagName)) {
                return ancestor;
            }
        }
        return null;
    }

    private static CorrelationStatus seedStatus(String revisionTag) {
        switch (revisionTag) {
            case WmlNodes.INS:
                return CorrelationStatus.INSERTED;
            case WmlNodes.DEL:
                return CorrelationStatus.DELETED;
            case WmlNodes.MOVE_FROM:
                return CorrelationStatus.MOVED_SOURCE;
            case WmlNodes.MOVE_TO:
                return CorrelationStatus.MOVED_DESTINATION;
            default:
                return CorrelationStatus.UNKNOWN;
        }
    }
}
