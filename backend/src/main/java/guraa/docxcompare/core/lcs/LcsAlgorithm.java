package guraa.docxcompare.core.lcs;

import java.util.List;

/**
 * Longest common subsequence over two key sequences, using {@link Object#equals} on keys.
 */
public interface LcsAlgorithm {

    /**
     * Compute a longest common subsequence.
     *
     * @param original keys of the first sequence
     * @param revised  keys of the second sequence
     * @return matched index pairs, strictly increasing in both indices
     */
    <T> List<LcsMatch> compute(List<T> original, List<T> revised);
}
