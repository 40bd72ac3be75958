package guraa.docxcompare.core;

/**
 * How move detection picks between candidate block pairs of equal similarity.
 */
public enum MoveTieBreak {
    /**
     * Deleted blocks claim partners in document order; among equally similar
     * inserted blocks the first one wins.
     */
    FIRST_ENCOUNTERED,
    /**
     * All candidate pairs are ranked by similarity, then by smaller length
     * difference, and claimed best first.
     */
    HIGHEST_SCORE
}
