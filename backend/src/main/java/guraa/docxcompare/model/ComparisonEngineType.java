package guraa.docxcompare.model;

public enum ComparisonEngineType {
    /**
     * Atom-level comparison with move and format-change detection.
     */
    ATOMIZER,
    /**
     * Paragraph alignment with a word diff inside modified paragraphs. Rebuild only.
     */
    DIFFMATCH
}
