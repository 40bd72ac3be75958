package guraa.docxcompare.reconstruction;

import guraa.docxcompare.util.WmlNodes;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.HashMap;
import java.util.Map;

/**
 * Creates revision elements for one output document. Revision ids start at 1 and
 * each move name gets one source and one destination range id.
 */
public class RevisionMarkup {

    private final Document document;
    private final String author;
    private final String date;
    private final Map<String, int[]> moveRangeIds = new HashMap<>();
    private int nextId = 1;

    public RevisionMarkup(Document document, String author, Instant date) {
        this.document = document;
        this.author = author;
        this.date = formatDate(date);
    }

    /**
     * ISO-8601 in UTC without fractional seconds, as Word writes it.
     */
    public static String formatDate(Instant date) {
        return date.truncatedTo(ChronoUnit.SECONDS).toString();
    }

    public int nextId() {
        return nextId++;
    }

    public Element wrapper(String tagName) {
        return WmlNodes.createRevisionElement(document, tagName, nextId(), author, date);
    }

    public Element ins() {
        return wrapper(WmlNodes.INS);
    }

    public Element del() {
        return wrapper(WmlNodes.DEL);
    }

    public Element moveFromRangeStart(String moveName) {
        return rangeStart(WmlNodes.MOVE_FROM_RANGE_START, rangeIds(moveName)[0], moveName);
    }

    public Element moveFromRangeEnd(String moveName) {
        return rangeEnd(WmlNodes.MOVE_FROM_RANGE_END, rangeIds(moveName)[0]);
    }

    public Element moveToRangeStart(String moveName) {
        return rangeStart(WmlNodes.MOVE_TO_RANGE_START, rangeIds(moveName)[1], moveName);
    }

    public Element moveToRangeEnd(String moveName) {
        return rangeEnd(WmlNodes.MOVE_TO_RANGE_END, rangeIds(moveName)[1]);
    }

    /**
     * w:rPrChange recording {@code oldRunProperties} as the properties before the change.
     */
    public Element runPropertiesChange(Element oldRunProperties) {
        Element change = wrapper(WmlNodes.RPR_CHANGE);
        change.appendChild(propertiesCopy(oldRunProperties, WmlNodes.RPR, WmlNodes.RPR_CHANGE));
        return change;
    }

    public Element paragraphPropertiesChange(Element oldParagraphProperties) {
        Element change = wrapper(WmlNodes.PPR_CHANGE);
        change.appendChild(propertiesCopy(oldParagraphProperties, WmlNodes.PPR, WmlNodes.PPR_CHANGE));
        return change;
    }

    /**
     * Put a paragraph-mark revision marker (w:ins or w:del) into w:pPr/w:rPr, creating both as needed.
     */
    public void markParagraph(Element paragraph, String markerTag) {
        Element pPr = WmlNodes.findChild(paragraph, WmlNodes.PPR);
        if (pPr == null) {
            pPr = WmlNodes.createElement(document, WmlNodes.PPR);
            paragraph.insertBefore(pPr, paragraph.getFirstChild());
        }
        Element rPr = WmlNodes.findChild(pPr, WmlNodes.RPR);
        if (rPr == null) {
            rPr = WmlNodes.createElement(document, WmlNodes.RPR);
            Element change = WmlNodes.findChild(pPr, WmlNodes.PPR_CHANGE);
            if (change != null) {
                pPr.insertBefore(rPr, change);
            } else {
                pPr.appendChild(rPr);
            }
        }
        rPr.insertBefore(wrapper(markerTag), rPr.getFirstChild());
    }

    public static boolean hasParagraphMarker(Element paragraph, String markerTag) {
        Element pPr = WmlNodes.findChild(paragraph, WmlNodes.PPR);
        Element rPr = pPr != null ? WmlNodes.findChild(pPr, WmlNodes.RPR) : null;
        return rPr != null && WmlNodes.findChild(rPr, markerTag) != null;
    }

    public Document getDocument() {
        return document;
    }

    public String getAuthor() {
        return author;
    }

    public String getDate() {
        return date;
    }

    private Element propertiesCopy(Element source, String tagName, String skipTag) {
        Element copy = WmlNodes.createElement(document, tagName);
        if (source == null) {
            return copy;
        }
        for (Element child : WmlNodes.childElements(source)) {
            if (!skipTag.equals(child.getTagName())) {
                copy.appendChild(document.importNode(child, true));
            }
        }
        return copy;
    }

    private int[] rangeIds(String moveName) {
        return moveRangeIds.computeIfAbsent(moveName, name -> new int[]{nextId(), nextId()});
    }

    private Element rangeStart(String tagName, int id, String moveName) {
        Element start = WmlNodes.createRevisionElement(document, tagName, id, author, date);
        WmlNodes.setAttribute(start, WmlNodes.ATTR_NAME, moveName);
        return start;
    }

    private Element rangeEnd(String tagName, int id) {
        Element end = WmlNodes.createElement(document, tagName);
        WmlNodes.setAttribute(end, WmlNodes.ATTR_ID, String.valueOf(id));
        return end;
    }
}
