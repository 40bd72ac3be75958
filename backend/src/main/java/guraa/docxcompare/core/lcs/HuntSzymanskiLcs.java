package guraa.docxcompare.core.lcs;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Hunt-Szymanski LCS. Runs in O((r + n) log n) where r is the number of matching
 * position pairs, which stays small for document text where most keys are rare.
 */
public class HuntSzymanskiLcs implements LcsAlgorithm {

    @Override
    public <T> List<LcsMatch> compute(List<T> original, List<T> revised) {
        if (original.isEmpty() || revised.isEmpty()) {
            return new ArrayList<>();
        }

        // Positions of each key in the revised sequence, ascending
        Map<T, List<Integer>> positions = new HashMap<>();
        for (int j = 0; j < revised.size(); j++) {
            positions.computeIfAbsent(revised.get(j), k -> new ArrayList<>()).add(j);
        }

        // thresholds.get(k): smallest revised index ending a common subsequence of length k + 1
        List<Integer> thresholds = new ArrayList<>();
        List<Link> links = new ArrayList<>();

        for (int i = 0; i < original.size(); i++) {
            List<Integer> matches = positions.get(original.get(i));
            if (matches == null) {
                continue;
            }
            for (int m = matches.size() - 1; m >= 0; m--) {
                int j = matches.get(m);
                int k = lowerBound(thresholds, j);
                if (k == thresholds.size()) {
                    thresholds.add(j);
                    links.add(new Link(i, j, k > 0 ? links.get(k - 1) : null));
                } else if (thresholds.get(k) > j) {
                    thresholds.set(k, j);
                    links.set(k, new Link(i, j, k > 0 ? links.get(k - 1) : null));
                }
            }
        }

        List<LcsMatch> result = new ArrayList<>(thresholds.size());
        Link link = links.isEmpty() ? null : links.get(links.size() - 1);
        while (link != null) {
            result.add(new LcsMatch(link.originalIndex, link.revisedIndex));
            link = link.previous;
        }
        Collections.reverse(result);
        return result;
    }

    private static int lowerBound(List<Integer> values, int target) {
        int low = 0;
        int high = values.size();
        while (low < high) {
            int mid = (low + high) >>> 1;
            if (values.get(mid) < target) {
                low = mid + 1;
            } else {
                high = mid;
            }
        }
        return low;
    }

    private static class Link {
        private final int originalIndex;
        private final int revisedIndex;
        private final Link previous;

        Link(int originalIndex, int revisedIndex, Link previous) {
            this.originalIndex = originalIndex;
            this.revisedIndex = revisedIndex;
            this.previous = previous;
        }
    }
}
