package guraa.docxcompare.reconstruction;

import guraa.docxcompare.util.WmlNodes;
import lombok.Getter;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Structural facts about the bookmarks of one document. All lists are sorted.
 * <p>
 * Two documents are considered equivalent when names, field references and
 * structural defects agree; bookmark ids may be renumbered freely.
 */
@Getter
public class BookmarkDiagnostics {

    private static final Pattern FIELD_REFERENCE = Pattern.compile("\\b(?:PAGEREF|REF)\\s+([^\\s\\\\]+)");

    private final List<String> startIds;
    private final List<String> endIds;
    private final List<String> startNames;
    private final List<String> duplicateStartNames;
    private final List<String> referencedBookmarkNames;
    private final List<String> unresolvedReferenceNames;
    private final List<String> duplicateStartIds;
    private final List<String> duplicateEndIds;
    private final List<String> unmatchedStartIds;
    private final List<String> unmatchedEndIds;

    private BookmarkDiagnostics(Element root) {
        Set<String> starts = new TreeSet<>();
        Set<String> ends = new TreeSet<>();
        Set<String> names = new TreeSet<>();
        Set<String> duplicateStarts = new TreeSet<>();
        Set<String> duplicateEnds = new TreeSet<>();
        Set<String> duplicateNames = new TreeSet<>();

        for (Element start : WmlNodes.findAll(root, WmlNodes.BOOKMARK_START)) {
            String id = start.getAttribute(WmlNodes.ATTR_ID);
            if (id.isEmpty()) {
                continue;
            }
            if (!starts.add(id)) {
                duplicateStarts.add(id);
            }
            String name = start.getAttribute(WmlNodes.ATTR_NAME);
            if (!name.isEmpty() && !names.add(name)) {
                duplicateNames.add(name);
            }
        }
        for (Element end : WmlNodes.findAll(root, WmlNodes.BOOKMARK_END)) {
            String id = end.getAttribute(WmlNodes.ATTR_ID);
            if (!id.isEmpty() && !ends.add(id)) {
                duplicateEnds.add(id);
            }
        }

        Set<String> references = referencedNames(root, Collections.emptySet());
        List<String> unresolved = new ArrayList<>();
        for (String reference : references) {
            if (!names.contains(reference)) {
                unresolved.add(reference);
            }
        }
        List<String> unmatchedStarts = new ArrayList<>();
        for (String id : starts) {
            if (!ends.contains(id)) {
                unmatchedStarts.add(id);
            }
        }
        List<String> unmatchedEnds = new ArrayList<>();
        for (String id : ends) {
            if (!starts.contains(id)) {
                unmatchedEnds.add(id);
            }
        }

        this.startIds = List.copyOf(starts);
        this.endIds = List.copyOf(ends);
        this.startNames = List.copyOf(names);
        this.duplicateStartNames = List.copyOf(duplicateNames);
        this.referencedBookmarkNames = List.copyOf(references);
        this.unresolvedReferenceNames = List.copyOf(unresolved);
        this.duplicateStartIds = List.copyOf(duplicateStarts);
        this.duplicateEndIds = List.copyOf(duplicateEnds);
        this.unmatchedStartIds = List.copyOf(unmatchedStarts);
        this.unmatchedEndIds = List.copyOf(unmatchedEnds);
    }

    public static BookmarkDiagnostics collect(Document document) {
        return new BookmarkDiagnostics(document.getDocumentElement());
    }

    /**
     * Bookmark names targeted by REF and PAGEREF field instructions, sorted.
     * Instructions inside {@code excludedParagraphs} are ignored.
     */
    static Set<String> referencedNames(Element root, Set<Element> excludedParagraphs) {
        Set<String> names = new TreeSet<>();
        for (Element instruction : WmlNodes.findAll(root, WmlNodes.INSTR_TEXT)) {
            if (!excludedParagraphs.isEmpty()
                    && excludedParagraphs.contains(WmlNodes.findAncestor(instruction, WmlNodes.P))) {
                continue;
            }
            Matcher matcher = FIELD_REFERENCE.matcher(instruction.getTextContent());
            while (matcher.find()) {
                String name = matcher.group(1).trim();
                if (!name.isEmpty()) {
                    names.add(name);
                }
            }
        }
        return names;
    }

    /**
     * Equal in everything except the raw start and end ids.
     */
    public boolean semanticallyEquals(BookmarkDiagnostics other) {
        return startNames.equals(other.startNames)
                && duplicateStartNames.equals(other.duplicateStartNames)
                && referencedBookmarkNames.equals(other.referencedBookmarkNames)
                && unresolvedReferenceNames.equals(other.unresolvedReferenceNames)
                && duplicateStartIds.equals(other.duplicateStartIds)
                && duplicateEndIds.equals(other.duplicateEndIds)
                && unmatchedStartIds.equals(other.unmatchedStartIds)
                && unmatchedEndIds.equals(other.unmatchedEndIds);
    }

    /**
     * Entries of {@code expected} missing from {@code actual} and the other way round.
     */
    public static IdDelta diff(List<String> expected, List<String> actual) {
        Set<String> expectedSet = new LinkedHashSet<>(expected);
        Set<String> actualSet = new LinkedHashSet<>(actual);
        List<String> missing = new ArrayList<>();
        for (String value : expected) {
            if (!actualSet.contains(value)) {
                missing.add(value);
            }
        }
        List<String> unexpected = new ArrayList<>();
        for (String value : actual) {
            if (!expectedSet.contains(value)) {
                unexpected.add(value);
            }
        }
        return new IdDelta(missing, unexpected);
    }

    @Getter
    public static class IdDelta {
        private final List<String> missing;
        private final List<String> unexpected;

        public IdDelta(List<String> missing, List<String> unexpected) {
            this.missing = missing;
            this.unexpected = unexpected;
        }

        public boolean isEmpty() {
            return missing.isEmpty() && unexpected.isEmpty();
        }
    }
}
