package guraa.docxcompare.core;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Normalization switches for atomization.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AtomizerOptions {

    /**
     * Store clones of leaf elements instead of the live elements.
     */
    @Builder.Default
    private boolean cloneLeafNodes = false;

    /**
     * Merge text of adjacent runs whose run properties are structurally equal.
     */
    @Builder.Default
    private boolean mergeAcrossRuns = true;

    @Builder.Default
    private boolean mergePunctuationAcrossRuns = true;

    @Builder.Default
    private boolean splitTextIntoWords = true;

    public static AtomizerOptions defaults() {
        return AtomizerOptions.builder().build();
    }

    /**
     * First in-place attempt: atoms stay anchored to real runs but text is split into words.
     */
    public static AtomizerOptions inPlaceWordSplit() {
        return AtomizerOptions.builder()
                .cloneLeafNodes(true)
                .mergeAcrossRuns(false)
                .mergePunctuationAcrossRuns(false)
                .splitTextIntoWords(true)
                .build();
    }

    /**
     * Second in-place attempt: run-level atoms only.
     */
    public static AtomizerOptions inPlaceRunLevel() {
        return AtomizerOptions.builder()
                .cloneLeafNodes(true)
                .mergeAcrossRuns(false)
                .mergePunctuationAcrossRuns(false)
                .splitTextIntoWords(false)
                .build();
    }
}
