package guraa.docxcompare.reconstruction;

import guraa.docxcompare.util.WmlNodes;
import guraa.docxcompare.util.WmlXml;
import lombok.AllArgsConstructor;
import lombok.Getter;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Simulates Word's "Accept All" and "Reject All" on a document with tracked changes.
 * Both operations work on a copy; the input document is not modified.
 */
public class TrackChangesSimulator {

    private static final String[] MOVE_RANGE_TAGS = {
            WmlNodes.MOVE_FROM_RANGE_START, WmlNodes.MOVE_FROM_RANGE_END,
            WmlNodes.MOVE_TO_RANGE_START, WmlNodes.MOVE_TO_RANGE_END
    };

    public Document acceptAll(Document document) {
        Document result = WmlXml.copy(document);
        Element root = result.getDocumentElement();

        for (Element paragraph : WmlNodes.findAll(root, WmlNodes.P)) {
            if (RevisionMarkup.hasParagraphMarker(paragraph, WmlNodes.DEL)
                    || holdsOnly(paragraph, WmlNodes.DEL, WmlNodes.MOVE_FROM)) {
                WmlNodes.remove(paragraph);
            }
        }
        WmlNodes.removeAll(root, WmlNodes.DEL);
        WmlNodes.removeAll(root, WmlNodes.MOVE_FROM);
        for (String rangeTag : MOVE_RANGE_TAGS) {
            WmlNodes.removeAll(root, rangeTag);
        }
        WmlNodes.unwrapAll(root, WmlNodes.INS);
        WmlNodes.unwrapAll(root, WmlNodes.MOVE_TO);
        WmlNodes.removeAll(root, WmlNodes.RPR_CHANGE);
        WmlNodes.removeAll(root, WmlNodes.PPR_CHANGE);
        return result;
    }

    public Document rejectAll(Document document) {
        Document result = WmlXml.copy(document);
        Element root = result.getDocumentElement();

        List<Element> paragraphs = WmlNodes.findAll(root, WmlNodes.P);
        Set<Element> removed = Collections.newSetFromMap(new IdentityHashMap<>());
        for (Element paragraph : paragraphs) {
            if (RevisionMarkup.hasParagraphMarker(paragraph, WmlNodes.INS)
                    || holdsOnly(paragraph, WmlNodes.INS, WmlNodes.MOVE_TO)) {
                removed.add(paragraph);
            }
        }
        preserveCrossParagraphBookmarks(root, paragraphs, removed);
        for (Element paragraph : removed) {
            WmlNodes.remove(paragraph);
        }

        WmlNodes.removeAll(root, WmlNodes.INS);
        WmlNodes.removeAll(root, WmlNodes.MOVE_TO);
        for (String rangeTag : MOVE_RANGE_TAGS) {
            WmlNodes.removeAll(root, rangeTag);
        }
        WmlNodes.unwrapAll(root, WmlNodes.DEL);
        WmlNodes.unwrapAll(root, WmlNodes.MOVE_FROM);
        for (Element delText : WmlNodes.findAll(root, WmlNodes.DEL_TEXT)) {
            WmlNodes.rename(delText, WmlNodes.T);
        }
        for (Element instruction : WmlNodes.findAll(root, WmlNodes.DEL_INSTR_TEXT)) {
            WmlNodes.rename(instruction, WmlNodes.INSTR_TEXT);
        }
        for (Element change : WmlNodes.findAll(root, WmlNodes.RPR_CHANGE)) {
            restoreProperties(change, WmlNodes.RPR, Set.of());
        }
        for (Element change : WmlNodes.findAll(root, WmlNodes.PPR_CHANGE)) {
            restoreProperties(change, WmlNodes.PPR, Set.of(WmlNodes.RPR, WmlNodes.SECT_PR));
        }
        return result;
    }

    /**
     * Text of every paragraph, visible text followed by deleted text, one paragraph per line.
     */
    public static String extractTextWithParagraphs(Document document) {
        List<String> lines = new ArrayList<>();
        for (Element paragraph : WmlNodes.findAll(document.getDocumentElement(), WmlNodes.P)) {
            StringBuilder line = new StringBuilder();
            for (Element text : WmlNodes.findAll(paragraph, WmlNodes.T)) {
                line.append(text.getTextContent());
            }
            for (Element text : WmlNodes.findAll(paragraph, WmlNodes.DEL_TEXT)) {
                line.append(text.getTextContent());
            }
            lines.add(line.toString());
        }
        return String.join("\n", lines);
    }

    /**
     * Normalize line endings, tabs and space runs, drop blank lines and trim.
     */
    public static String normalizeText(String text) {
        return text
                .replace("\r\n", "\n")
                .replace('\r', '\n')
                .replace('\t', ' ')
                .replaceAll(" +", " ")
                .replace(" \n", "\n")
                .replace("\n ", "\n")
                .replaceAll("\n+", "\n")
                .trim();
    }

    public static TextComparison compareTexts(String expected, String actual) {
        List<String> differences = new ArrayList<>();
        if (!expected.equals(actual)) {
            int firstDiff = 0;
            while (firstDiff < expected.length() && firstDiff < actual.length()
                    && expected.charAt(firstDiff) == actual.charAt(firstDiff)) {
                firstDiff++;
            }
            int context = 50;
            int start = Math.max(0, firstDiff - context);
            differences.add("First difference at position " + firstDiff + ":");
            differences.add("  Expected: \"..." + snippet(expected, start, firstDiff + context) + "...\"");
            differences.add("  Actual:   \"..." + snippet(actual, start, firstDiff + context) + "...\"");
        }
        return new TextComparison(
                expected.equals(actual),
                normalizeText(expected).equals(normalizeText(actual)),
                expected.length(),
                actual.length(),
                differences);
    }

    private static String snippet(String text, int start, int end) {
        if (start >= text.length()) {
            return "";
        }
        return text.substring(start, Math.min(end, text.length()));
    }

    /**
     * True when the paragraph has content wrapped in one of {@code wrapperTags} and no run outside them.
     */
    private static boolean holdsOnly(Element paragraph, String... wrapperTags) {
        boolean sawWrapper = false;
        for (String wrapperTag : wrapperTags) {
            for (Element wrapper : WmlNodes.findAll(paragraph, wrapperTag)) {
                if (!WmlNodes.hasAncestor(wrapper, WmlNodes.PPR)) {
                    sawWrapper = true;
                }
            }
        }
        if (!sawWrapper) {
            return false;
        }
        for (Element run : WmlNodes.findAll(paragraph, WmlNodes.R)) {
            if (!WmlNodes.hasAncestor(run, wrapperTags)) {
                return false;
            }
        }
        return true;
    }

    private static void restoreProperties(Element change, String propertiesTag, Set<String> keep) {
        Element current = WmlNodes.parentElement(change);
        Element old = WmlNodes.findChild(change, propertiesTag);
        WmlNodes.remove(change);
        if (current == null || old == null) {
            return;
        }
        for (Element child : WmlNodes.childElements(current)) {
            if (!keep.contains(child.getTagName())) {
                current.removeChild(child);
            }
        }
        Element anchor = current.getFirstChild() instanceof Element ? (Element) current.getFirstChild() : null;
        for (Element child : WmlNodes.childElements(old)) {
            if (anchor != null && keep.contains(anchor.getTagName())) {
                current.insertBefore(child, anchor);
            } else {
                current.appendChild(child);
            }
        }
    }

    /**
     * Keep bookmarks of removed paragraphs that still matter: a start or end whose
     * counterpart survives, or a name a surviving field refers to. Starts move to
     * the next kept paragraph, ends to the previous one.
     */
    private static void preserveCrossParagraphBookmarks(Element root, List<Element> paragraphs, Set<Element> removed) {
        if (removed.isEmpty()) {
            return;
        }
        Map<String, List<Element>> markersById = new HashMap<>();
        for (String tag : new String[]{WmlNodes.BOOKMARK_START, WmlNodes.BOOKMARK_END}) {
            for (Element marker : WmlNodes.findAll(root, tag)) {
                markersById.computeIfAbsent(marker.getAttribute(WmlNodes.ATTR_ID), k -> new ArrayList<>()).add(marker);
            }
        }
        Set<String> referenced = BookmarkDiagnostics.referencedNames(root, removed);
        Map<String, String> namesById = new HashMap<>();
        for (Element start : WmlNodes.findAll(root, WmlNodes.BOOKMARK_START)) {
            namesById.putIfAbsent(start.getAttribute(WmlNodes.ATTR_ID), start.getAttribute(WmlNodes.ATTR_NAME));
        }

        for (int i = 0; i < paragraphs.size(); i++) {
            Element paragraph = paragraphs.get(i);
            if (!removed.contains(paragraph)) {
                continue;
            }
            List<Element> markers = new ArrayList<>(WmlNodes.findAll(paragraph, WmlNodes.BOOKMARK_START));
            markers.addAll(WmlNodes.findAll(paragraph, WmlNodes.BOOKMARK_END));
            for (Element marker : markers) {
                if (WmlNodes.hasAncestor(marker, WmlNodes.INS, WmlNodes.MOVE_TO)) {
                    continue;
                }
                String id = marker.getAttribute(WmlNodes.ATTR_ID);
                boolean counterpartKept = false;
                for (Element other : markersById.getOrDefault(id, List.of())) {
                    if (other != marker && !removed.contains(WmlNodes.findAncestor(other, WmlNodes.P))) {
                        counterpartKept = true;
                    }
                }
                if (!counterpartKept && !referenced.contains(namesById.get(id))) {
                    continue;
                }
                boolean start = WmlNodes.BOOKMARK_START.equals(marker.getTagName());
                Element target = start ? neighbour(paragraphs, removed, i, 1) : neighbour(paragraphs, removed, i, -1);
                boolean atStart = start;
                if (target == null) {
                    target = start ? neighbour(paragraphs, removed, i, -1) : neighbour(paragraphs, removed, i, 1);
                    atStart = !start;
                }
                if (target == null) {
                    continue;
                }
                WmlNodes.remove(marker);
                if (atStart) {
                    WmlNodes.insertAtContentStart(target, marker);
                } else {
                    target.appendChild(marker);
                }
            }
        }
    }

    private static Element neighbour(List<Element> paragraphs, Set<Element> removed, int from, int step) {
        for (int i = from + step; i >= 0 && i < paragraphs.size(); i += step) {
            if (!removed.contains(paragraphs.get(i))) {
                return paragraphs.get(i);
            }
        }
        return null;
    }

    @Getter
    @AllArgsConstructor
    public static class TextComparison {
        private final boolean identical;
        private final boolean normalizedIdentical;
        private final int expectedLength;
        private final int actualLength;
        private final List<String> differences;
    }
}
