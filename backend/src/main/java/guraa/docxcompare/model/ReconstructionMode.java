package guraa.docxcompare.model;

/**
 * How the output document is produced from the merged atoms.
 */
public enum ReconstructionMode {
    /**
     * Synthesize a new body on top of a copy of the original document.
     */
    REBUILD,
    /**
     * Add markup to the revised document tree, falling back to {@link #REBUILD}
     * when the result does not survive the accept/reject round trip.
     */
    INPLACE
}
