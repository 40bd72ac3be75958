package guraa.docxcompare.reconstruction;

import guraa.docxcompare.core.ComparisonUnitAtom;
import guraa.docxcompare.core.CorrelationStatus;
import guraa.docxcompare.util.WmlNodes;
import org.w3c.dom.Element;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Which bookmark markers exist in which input document.
 * <p>
 * A marker is identified by the bookmark name; an end marker takes the name of the
 * start with the same id in its own document. Ends without a start get a key that
 * is private to their document, so they are never shared.
 * <p>
 * A shared name is stable when every revised marker carrying it sits on content
 * that both accept and reject keep. Only stable names can be written once.
 */
class BookmarkIndex {

    private final Map<String, String> originalNamesById = new HashMap<>();
    private final Map<String, String> revisedNamesById = new HashMap<>();
    private final Set<String> originalKeys = new HashSet<>();
    private final Set<String> revisedKeys = new HashSet<>();
    private final Set<String> revisedKeysOnChangedContent = new HashSet<>();

    private BookmarkIndex() {
    }

    /**
     * Index the markers carried by {@code atoms} and by every atom linked to them.
     */
    static BookmarkIndex of(Collection<ComparisonUnitAtom> atoms) {
        Set<ComparisonUnitAtom> all = reachable(atoms);
        BookmarkIndex index = new BookmarkIndex();
        for (ComparisonUnitAtom atom : all) {
            Map<String, String> names = atom.isFromOriginal() ? index.originalNamesById : index.revisedNamesById;
            for (Element marker : markersOf(atom)) {
                if (WmlNodes.BOOKMARK_START.equals(marker.getTagName())) {
                    names.putIfAbsent(marker.getAttribute(WmlNodes.ATTR_ID), marker.getAttribute(WmlNodes.ATTR_NAME));
                }
            }
        }
        for (ComparisonUnitAtom atom : all) {
            Set<String> keys = atom.isFromOriginal() ? index.originalKeys : index.revisedKeys;
            boolean changed = !atom.isFromOriginal() && !isKeptByBoth(atom.getCorrelationStatus());
            for (Element marker : markersOf(atom)) {
                String key = index.key(marker, atom.isFromOriginal());
                keys.add(key);
                if (changed) {
                    index.revisedKeysOnChangedContent.add(key);
                }
            }
        }
        return index;
    }

    String key(Element marker, boolean fromOriginal) {
        String id = marker.getAttribute(WmlNodes.ATTR_ID);
        String side = fromOriginal ? "original" : "revised";
        if (WmlNodes.BOOKMARK_START.equals(marker.getTagName())) {
            String name = marker.getAttribute(WmlNodes.ATTR_NAME);
            return name.isEmpty() ? "unnamed:" + side + ":" + id : name;
        }
        String name = (fromOriginal ? originalNamesById : revisedNamesById).get(id);
        return name != null && !name.isEmpty() ? name : "orphan:" + side + ":" + id;
    }

    boolean isShared(String key) {
        return originalKeys.contains(key) && revisedKeys.contains(key);
    }

    boolean isStable(String key) {
        return isShared(key) && !revisedKeysOnChangedContent.contains(key);
    }

    private static boolean isKeptByBoth(CorrelationStatus status) {
        return status == CorrelationStatus.EQUAL || status == CorrelationStatus.FORMAT_CHANGED;
    }

    private static List<Element> markersOf(ComparisonUnitAtom atom) {
        if (!atom.hasBookmarks()) {
            return Collections.emptyList();
        }
        List<Element> markers = new ArrayList<>(atom.getLeadingBookmarks());
        markers.addAll(atom.getTrailingBookmarks());
        return markers;
    }

    private static Set<ComparisonUnitAtom> reachable(Collection<ComparisonUnitAtom> atoms) {
        Set<ComparisonUnitAtom> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        Deque<ComparisonUnitAtom> pending = new ArrayDeque<>(atoms);
        while (!pending.isEmpty()) {
            ComparisonUnitAtom atom = pending.pop();
            if (!seen.add(atom)) {
                continue;
            }
            if (atom.getAtomBefore() != null) {
                pending.push(atom.getAtomBefore());
            }
            if (atom.getAtomAfter() != null) {
                pending.push(atom.getAtomAfter());
            }
        }
        return seen;
    }
}
