package guraa.docxcompare.core;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class MoveDetectionSettings {

    @Builder.Default
    private boolean detectMoves = true;

    /**
     * Minimum Jaccard word similarity for two blocks to count as a move.
     */
    @Builder.Default
    private double moveSimilarityThreshold = 0.8;

    /**
     * Blocks with fewer words are never considered.
     */
    @Builder.Default
    private int moveMinimumWordCount = 5;

    @Builder.Default
    private boolean caseInsensitive = true;

    @Builder.Default
    private MoveTieBreak tieBreak = MoveTieBreak.FIRST_ENCOUNTERED;
}
