package guraa.docxcompare.model;

import guraa.docxcompare.core.HierarchicalCorrelator;
import guraa.docxcompare.core.MoveDetectionSettings;
import guraa.docxcompare.core.lcs.LcsAlgorithmType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Options for a single comparison. Unset values are filled from the application defaults.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class CompareOptions {

    public static final String DEFAULT_AUTHOR = "Comparison";

    @Builder.Default
    private String author = DEFAULT_AUTHOR;

    /**
     * Revision timestamp; {@code null} means the time the comparison runs.
     */
    private Instant date;

    /**
     * Skip format-change detection and paragraph property tracking.
     */
    @Builder.Default
    private boolean ignoreFormatting = false;

    @Builder.Default
    private boolean premergeRuns = false;

    @Builder.Default
    private ReconstructionMode reconstructionMode = ReconstructionMode.REBUILD;

    @Builder.Default
    private ComparisonEngineType engine = ComparisonEngineType.ATOMIZER;

    @Builder.Default
    private MoveDetectionSettings moveDetection = MoveDetectionSettings.builder().build();

    @Builder.Default
    private boolean detectFormatChanges = true;

    @Builder.Default
    private double paragraphSimilarityThreshold = HierarchicalCorrelator.DEFAULT_PARAGRAPH_SIMILARITY_THRESHOLD;

    @Builder.Default
    private double diffmatchSimilarityThreshold = 0.5;

    @Builder.Default
    private LcsAlgorithmType lcsAlgorithm = LcsAlgorithmType.HUNT_SZYMANSKI;

    /**
     * Run the round-trip checks on rebuild output too. Results are only logged.
     */
    @Builder.Default
    private boolean verifyRebuild = false;

    public Instant effectiveDate() {
        return date != null ? date : Instant.now();
    }
}
