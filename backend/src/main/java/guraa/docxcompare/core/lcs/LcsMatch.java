package guraa.docxcompare.core.lcs;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * One aligned pair of a longest common subsequence.
 */
@Getter
@ToString
@EqualsAndHashCode
@AllArgsConstructor
public class LcsMatch {

    private final int originalIndex;
    private final int revisedIndex;
}
