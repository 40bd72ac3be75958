package guraa.docxcompare.core.lcs;

import java.util.ArrayList;
import java.util.List;

/**
 * Classic O(n*m) table-based LCS. Correct for any input but memory grows with
 * the product of both lengths, so it is only suited to small sequences.
 */
public class DynamicProgrammingLcs implements LcsAlgorithm {

    @Override
    public <T> List<LcsMatch> compute(List<T> original, List<T> revised) {
        int n = original.size();
        int m = revised.size();
        int[][] lengths = new int[n + 1][m + 1];

        for (int i = n - 1; i >= 0; i--) {
            for (int j = m - 1; j >= 0; j--) {
                if (original.get(i).equals(revised.get(j))) {
                    lengths[i][j] = lengths[i + 1][j + 1] + 1;
                } else {
                    lengths[i][j] = Math.max(lengths[i + 1][j], lengths[i][j + 1]);
                }
            }
        }

        List<LcsMatch> result = new ArrayList<>(lengths[0][0]);
        int i = 0;
        int j = 0;
        while (i < n && j < m) {
            if (original.get(i).equals(revised.get(j))) {
                result.add(new LcsMatch(i, j));
                i++;
                j++;
            } else if (lengths[i + 1][j] >= lengths[i][j + 1]) {
                i++;
            } else {
                j++;
            }
        }
        return result;
    }
}
