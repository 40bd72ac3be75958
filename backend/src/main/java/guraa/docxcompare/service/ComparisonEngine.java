package guraa.docxcompare.service;

import guraa.docxcompare.model.CompareOptions;
import guraa.docxcompare.model.CompareResult;
import guraa.docxcompare.model.ComparisonEngineType;

import java.io.IOException;

/**
 * Produces a track-changes document from two versions of a DOCX package.
 */
public interface ComparisonEngine {

    ComparisonEngineType getType();

    /**
     * @param original original package bytes
     * @param revised  revised package bytes
     * @param options  fully resolved options
     * @return result holding the output package
     * @throws IOException if a package cannot be read or written
     */
    CompareResult compare(byte[] original, byte[] revised, CompareOptions options) throws IOException;
}
