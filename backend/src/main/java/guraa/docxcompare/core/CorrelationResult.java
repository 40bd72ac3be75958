package guraa.docxcompare.core;

import guraa.docxcompare.core.lcs.LcsMatch;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

/**
 * Atom-level alignment between the original and revised atom lists.
 */
@Getter
@AllArgsConstructor
public class CorrelationResult {

    /**
     * Matched atom index pairs, increasing in both indices.
     */
    private final List<LcsMatch> matches;
    private final List<Integer> deletedIndices;
    private final List<Integer> insertedIndices;
    private final int pairedGroups;
    private final int similarityPairedGroups;
}
