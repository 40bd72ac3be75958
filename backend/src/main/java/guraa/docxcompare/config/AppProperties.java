package guraa.docxcompare.config;

import guraa.docxcompare.core.HierarchicalCorrelator;
import guraa.docxcompare.core.MoveTieBreak;
import guraa.docxcompare.core.lcs.LcsAlgorithmType;
import guraa.docxcompare.model.ComparisonEngineType;
import guraa.docxcompare.model.CompareOptions;
import guraa.docxcompare.model.ReconstructionMode;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for the application
 */
@Component
@ConfigurationProperties(prefix = "app")
public class AppProperties {

    private final Comparison comparison = new Comparison();

    public Comparison getComparison() {
        return comparison;
    }

    /**
     * Comparison defaults, overridable per request.
     */
    public static class Comparison {
        private String author = CompareOptions.DEFAULT_AUTHOR;
        private ReconstructionMode reconstructionMode = ReconstructionMode.REBUILD;
        private ComparisonEngineType engine = ComparisonEngineType.ATOMIZER;
        private boolean detectMoves = true;
        private double moveSimilarityThreshold = 0.8;
        private int moveMinimumWordCount = 5;
        private boolean caseInsensitiveMove = true;
        private MoveTieBreak moveTieBreak = MoveTieBreak.FIRST_ENCOUNTERED;
        private boolean detectFormatChanges = true;
        private double paragraphSimilarityThreshold = HierarchicalCorrelator.DEFAULT_PARAGRAPH_SIMILARITY_THRESHOLD;
        private double diffmatchSimilarityThreshold = 0.5;
        private LcsAlgorithmType lcsAlgorithm = LcsAlgorithmType.HUNT_SZYMANSKI;
        private boolean verifyRebuild = false;
        private boolean premergeRuns = false;

        public String getAuthor() {
            return author;
        }

        public void setAuthor(String author) {
            this.author = author;
        }

        public ReconstructionMode getReconstructionMode() {
            return reconstructionMode;
        }

        public void setReconstructionMode(ReconstructionMode reconstructionMode) {
            this.reconstructionMode = reconstructionMode;
        }

        public ComparisonEngineType getEngine() {
            return engine;
        }

        public void setEngine(ComparisonEngineType engine) {
            this.engine = engine;
        }

        public boolean isDetectMoves() {
            return detectMoves;
        }

        public void setDetectMoves(boolean detectMoves) {
            this.detectMoves = detectMoves;
        }

        public double getMoveSimilarityThreshold() {
            return moveSimilarityThreshold;
        }

        public void setMoveSimilarityThreshold(double moveSimilarityThreshold) {
            this.moveSimilarityThreshold = moveSimilarityThreshold;
        }

        public int getMoveMinimumWordCount() {
            return moveMinimumWordCount;
        }

        public void setMoveMinimumWordCount(int moveMinimumWordCount) {
            this.moveMinimumWordCount = moveMinimumWordCount;
        }

        public boolean isCaseInsensitiveMove() {
            return caseInsensitiveMove;
        }

        public void setCaseInsensitiveMove(boolean caseInsensitiveMove) {
            this.caseInsensitiveMove = caseInsensitiveMove;
        }

        public MoveTieBreak getMoveTieBreak() {
            return moveTieBreak;
        }

        public void setMoveTieBreak(MoveTieBreak moveTieBreak) {
            this.moveTieBreak = moveTieBreak;
        }

        public boolean isDetectFormatChanges() {
            return detectFormatChanges;
        }

        public void setDetectFormatChanges(boolean detectFormatChanges) {
            this.detectFormatChanges = detectFormatChanges;
        }

        public double getParagraphSimilarityThreshold() {
            return paragraphSimilarityThreshold;
        }

        public void setParagraphSimilarityThreshold(double paragraphSimilarityThreshold) {
            this.paragraphSimilarityThreshold = paragraphSimilarityThreshold;
        }

        public double getDiffmatchSimilarityThreshold() {
            return diffmatchSimilarityThreshold;
        }

        public void setDiffmatchSimilarityThreshold(double diffmatchSimilarityThreshold) {
            this.diffmatchSimilarityThreshold = diffmatchSimilarityThreshold;
        }

        public LcsAlgorithmType getLcsAlgorithm() {
            return lcsAlgorithm;
        }

        public void setLcsAlgorithm(LcsAlgorithmType lcsAlgorithm) {
            this.lcsAlgorithm = lcsAlgorithm;
        }

        public boolean isVerifyRebuild() {
            return verifyRebuild;
        }

        public void setVerifyRebuild(boolean verifyRebuild) {
            this.verifyRebuild = verifyRebuild;
        }

        public boolean isPremergeRuns() {
            return premergeRuns;
        }

        public void setPremergeRuns(boolean premergeRuns) {
            this.premergeRuns = premergeRuns;
        }
    }
}
