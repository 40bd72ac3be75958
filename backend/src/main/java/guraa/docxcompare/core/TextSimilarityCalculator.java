package guraa.docxcompare.core;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Utility class for word-level text similarity
 */
public class TextSimilarityCalculator {

    private TextSimilarityCalculator() {
    }

    /**
     * Calculate Jaccard similarity between the word sets of two texts.
     * Jaccard similarity = size of intersection / size of union.
     * Two texts without words are identical; one empty side gives zero.
     */
    public static double calculateJaccardSimilarity(String text1, String text2, boolean caseInsensitive) {
        Set<String> set1 = wordSet(text1, caseInsensitive);
        Set<String> set2 = wordSet(text2, caseInsensitive);

        if (set1.isEmpty() && set2.isEmpty()) return 1.0;
        if (set1.isEmpty() || set2.isEmpty()) return 0.0;

        Set<String> intersection = new HashSet<>(set1);
        intersection.retainAll(set2);

        Set<String> union = new HashSet<>(set1);
        union.addAll(set2);

        return (double) intersection.size() / union.size();
    }

    /**
     * Whitespace-separated words, optionally lower-cased.
     */
    public static Set<String> wordSet(String text, boolean caseInsensitive) {
        Set<String> words = new HashSet<>();
        if (text == null) return words;
        String source = caseInsensitive ? text.toLowerCase(Locale.ROOT) : text;
        words.addAll(Arrays.asList(source.trim().split("\\s+")));
        words.remove("");
        return words;
    }

    public static int countWords(String text) {
        if (text == null) return 0;
        String trimmed = text.trim();
        if (trimmed.isEmpty()) return 0;
        return trimmed.split("\\s+").length;
    }

    /**
     * Trim, collapse whitespace runs and lower-case.
     */
    public static String normalize(String text) {
        if (text == null) return "";
        return text.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }
}
