package guraa.docxcompare.reconstruction;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.w3c.dom.Document;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Verifies a track-changes document by simulating Accept All and Reject All.
 * Accepting must give the revised document back, rejecting the original; both
 * for paragraph text (after normalization) and for bookmark structure.
 */
@Slf4j
public class RoundTripSafetyChecker {

    private static final int SUMMARY_MAX_LENGTH = 160;

    private final TrackChangesSimulator simulator;

    public RoundTripSafetyChecker(TrackChangesSimulator simulator) {
        this.simulator = simulator;
    }

    public RoundTripSafetyChecker() {
        this(new TrackChangesSimulator());
    }

    /**
     * Capture what the round trip must reproduce, before any tree is mutated.
     */
    public Baseline baseline(Document original, Document revised) {
        return new Baseline(
                TrackChangesSimulator.extractTextWithParagraphs(original),
                TrackChangesSimulator.extractTextWithParagraphs(revised),
                BookmarkDiagnostics.collect(original),
                BookmarkDiagnostics.collect(revised));
    }

    public SafetyCheckResult check(Baseline baseline, Document candidate) {
        Document accepted = simulator.acceptAll(candidate);
        Document rejected = simulator.rejectAll(candidate);
        String acceptedText = TrackChangesSimulator.extractTextWithParagraphs(accepted);
        String rejectedText = TrackChangesSimulator.extractTextWithParagraphs(rejected);
        BookmarkDiagnostics acceptedBookmarks = BookmarkDiagnostics.collect(accepted);
        BookmarkDiagnostics rejectedBookmarks = BookmarkDiagnostics.collect(rejected);

        Map<String, Boolean> checks = new LinkedHashMap<>();
        checks.put(SafetyCheckResult.ACCEPT_TEXT,
                TrackChangesSimulator.compareTexts(baseline.getRevisedText(), acceptedText).isNormalizedIdentical());
        checks.put(SafetyCheckResult.REJECT_TEXT,
                TrackChangesSimulator.compareTexts(baseline.getOriginalText(), rejectedText).isNormalizedIdentical());
        checks.put(SafetyCheckResult.ACCEPT_BOOKMARKS,
                baseline.getRevisedBookmarks().semanticallyEquals(acceptedBookmarks));
        checks.put(SafetyCheckResult.REJECT_BOOKMARKS,
                baseline.getOriginalBookmarks().semanticallyEquals(rejectedBookmarks));

        List<String> failed = new ArrayList<>();
        for (Map.Entry<String, Boolean> entry : checks.entrySet()) {
            if (!entry.getValue()) {
                failed.add(entry.getKey());
            }
        }

        SafetyCheckResult.SafetyCheckResultBuilder result = SafetyCheckResult.builder()
                .safe(failed.isEmpty())
                .checks(checks)
                .failedChecks(failed);
        if (failed.isEmpty()) {
            return result.build();
        }

        Map<String, Object> details = new LinkedHashMap<>();
        Map<String, Object> summary = new LinkedHashMap<>();
        if (!checks.get(SafetyCheckResult.ACCEPT_TEXT)) {
            TextMismatchDetails text = textMismatch(baseline.getRevisedText(), acceptedText);
            details.put(SafetyCheckResult.ACCEPT_TEXT, text);
            summary.put(SafetyCheckResult.ACCEPT_TEXT, summarize(text));
        }
        if (!checks.get(SafetyCheckResult.REJECT_TEXT)) {
            TextMismatchDetails text = textMismatch(baseline.getOriginalText(), rejectedText);
            details.put(SafetyCheckResult.REJECT_TEXT, text);
            summary.put(SafetyCheckResult.REJECT_TEXT, summarize(text));
        }
        if (!checks.get(SafetyCheckResult.ACCEPT_BOOKMARKS)) {
            BookmarkMismatchDetails bookmarks = bookmarkMismatch(baseline.getRevisedBookmarks(), acceptedBookmarks);
            details.put(SafetyCheckResult.ACCEPT_BOOKMARKS, bookmarks);
            summary.put(SafetyCheckResult.ACCEPT_BOOKMARKS, summarize(bookmarks));
        }
        if (!checks.get(SafetyCheckResult.REJECT_BOOKMARKS)) {
            BookmarkMismatchDetails bookmarks = bookmarkMismatch(baseline.getOriginalBookmarks(), rejectedBookmarks);
            details.put(SafetyCheckResult.REJECT_BOOKMARKS, bookmarks);
            summary.put(SafetyCheckResult.REJECT_BOOKMARKS, summarize(bookmarks));
        }
        log.debug("Round-trip safety check failed: {}", failed);
        return result.failureDetails(details).failureSummary(summary).build();
    }

    static TextMismatchDetails textMismatch(String expected, String actual) {
        TrackChangesSimulator.TextComparison comparison = TrackChangesSimulator.compareTexts(expected, actual);
        String[] expectedParagraphs = expected.split("\n", -1);
        String[] actualParagraphs = actual.split("\n", -1);
        int firstDiffering = -1;
        int count = Math.max(expectedParagraphs.length, actualParagraphs.length);
        for (int i = 0; i < count; i++) {
            if (!paragraphAt(expectedParagraphs, i).equals(paragraphAt(actualParagraphs, i))) {
                firstDiffering = i;
                break;
            }
        }
        List<String> differences = comparison.getDifferences();
        return TextMismatchDetails.builder()
                .expectedLength(comparison.getExpectedLength())
                .actualLength(comparison.getActualLength())
                .firstDifferingParagraphIndex(firstDiffering)
                .expectedParagraph(firstDiffering >= 0 ? paragraphAt(expectedParagraphs, firstDiffering) : "")
                .actualParagraph(firstDiffering >= 0 ? paragraphAt(actualParagraphs, firstDiffering) : "")
                .differenceSample(new ArrayList<>(differences.subList(0, Math.min(3, differences.size()))))
                .build();
    }

    static BookmarkMismatchDetails bookmarkMismatch(BookmarkDiagnostics expected, BookmarkDiagnostics actual) {
        return BookmarkMismatchDetails.builder()
                .startNames(BookmarkDiagnostics.diff(expected.getStartNames(), actual.getStartNames()))
                .referencedBookmarkNames(BookmarkDiagnostics.diff(
                        expected.getReferencedBookmarkNames(), actual.getReferencedBookmarkNames()))
                .unresolvedReferenceNames(BookmarkDiagnostics.diff(
                        expected.getUnresolvedReferenceNames(), actual.getUnresolvedReferenceNames()))
                .startIds(BookmarkDiagnostics.diff(expected.getStartIds(), actual.getStartIds()))
                .endIds(BookmarkDiagnostics.diff(expected.getEndIds(), actual.getEndIds()))
                .expectedDuplicateStartNames(expected.getDuplicateStartNames())
                .actualDuplicateStartNames(actual.getDuplicateStartNames())
                .expectedDuplicateStartIds(expected.getDuplicateStartIds())
                .actualDuplicateStartIds(actual.getDuplicateStartIds())
                .expectedDuplicateEndIds(expected.getDuplicateEndIds())
                .actualDuplicateEndIds(actual.getDuplicateEndIds())
                .expectedUnmatchedStartIds(expected.getUnmatchedStartIds())
                .actualUnmatchedStartIds(actual.getUnmatchedStartIds())
                .expectedUnmatchedEndIds(expected.getUnmatchedEndIds())
                .actualUnmatchedEndIds(actual.getUnmatchedEndIds())
                .build();
    }

    private static Map<String, Object> summarize(TextMismatchDetails details) {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("firstDifferingParagraphIndex", details.getFirstDifferingParagraphIndex());
        summary.put("expectedParagraph", truncate(details.getExpectedParagraph()));
        summary.put("actualParagraph", truncate(details.getActualParagraph()));
        summary.put("firstDifference", details.getDifferenceSample().isEmpty()
                ? "No diff sample" : details.getDifferenceSample().get(0));
        return summary;
    }

    private static Map<String, Object> summarize(BookmarkMismatchDetails details) {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("startNames", summarize(details.getStartNames()));
        summary.put("referencedBookmarkNames", summarize(details.getReferencedBookmarkNames()));
        summary.put("unresolvedReferenceNames", summarize(details.getUnresolvedReferenceNames()));
        summary.put("startIds", summarize(details.getStartIds()));
        summary.put("endIds", summarize(details.getEndIds()));
        summary.put("unmatchedStartCount", details.getActualUnmatchedStartIds().size());
        summary.put("unmatchedEndCount", details.getActualUnmatchedEndIds().size());
        summary.put("firstUnmatchedStartId", first(details.getActualUnmatchedStartIds()));
        summary.put("firstUnmatchedEndId", first(details.getActualUnmatchedEndIds()));
        return summary;
    }

    private static Map<String, Object> summarize(BookmarkDiagnostics.IdDelta delta) {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("missingCount", delta.getMissing().size());
        summary.put("unexpectedCount", delta.getUnexpected().size());
        summary.put("firstMissing", first(delta.getMissing()));
        summary.put("firstUnexpected", first(delta.getUnexpected()));
        return summary;
    }

    static String truncate(String value) {
        if (value.length() <= SUMMARY_MAX_LENGTH) {
            return value;
        }
        return value.substring(0, SUMMARY_MAX_LENGTH) + "...";
    }

    private static String first(List<String> values) {
        return values.isEmpty() ? null : values.get(0);
    }

    private static String paragraphAt(String[] paragraphs, int index) {
        return index < paragraphs.length ? paragraphs[index] : "";
    }

    /**
     * Texts and bookmark facts of the two input documents.
     */
    @Getter
    @AllArgsConstructor
    public static class Baseline {
        private final String originalText;
        private final String revisedText;
        private final BookmarkDiagnostics originalBookmarks;
        private final BookmarkDiagnostics revisedBookmarks;
    }
}
