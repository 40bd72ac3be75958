package guraa.docxcompare.service;

import guraa.docxcompare.exception.MalformedDocumentException;
import guraa.docxcompare.exception.UnsupportedComparisonException;
import guraa.docxcompare.model.CompareOptions;
import guraa.docxcompare.model.CompareResult;
import guraa.docxcompare.model.ComparisonEngineType;
import guraa.docxcompare.model.ReconstructionMode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Entry point for document comparisons: validates the request and dispatches to the engine.
 */
@Slf4j
@Service
public class DocxComparisonService {

    private final Map<ComparisonEngineType, ComparisonEngine> engines = new EnumMap<>(ComparisonEngineType.class);
    private final CompareOptions defaultOptions;

    public DocxComparisonService(List<ComparisonEngine> engines, CompareOptions defaultCompareOptions) {
        for (ComparisonEngine engine : engines) {
            this.engines.put(engine.getType(), engine);
        }
        this.defaultOptions = defaultCompareOptions;
        log.info("Comparison engines available: {}", this.engines.keySet());
    }

    /**
     * Copy of the configured defaults, for callers that override some values.
     */
    public CompareOptions.CompareOptionsBuilder optionsBuilder() {
        return defaultOptions.toBuilder();
    }

    public CompareResult compareDocuments(byte[] original, byte[] revised) throws IOException {
        return compareDocuments(original, revised, defaultOptions);
    }

    /**
     * Compare two DOCX packages and produce a package with track changes.
     *
     * @param original original package bytes
     * @param revised  revised package bytes
     * @param options  comparison options
     * @return the comparison result
     * @throws IOException if a package cannot be read or written
     */
    public CompareResult compareDocuments(byte[] original, byte[] revised, CompareOptions options) throws IOException {
        requireContent(original, "original");
        requireContent(revised, "revised");
        CompareOptions effective = options != null ? options : defaultOptions;
        ComparisonEngine engine = engines.get(effective.getEngine());
        if (engine == null) {
            throw new UnsupportedComparisonException("Comparison engine not available: " + effective.getEngine());
        }
        if (effective.getEngine() == ComparisonEngineType.DIFFMATCH
                && effective.getReconstructionMode() == ReconstructionMode.INPLACE) {
            throw new UnsupportedComparisonException("The DIFFMATCH engine only supports REBUILD reconstruction");
        }

        long start = System.currentTimeMillis();
        log.info("Comparing documents: engine={}, mode={}, original={} bytes, revised={} bytes",
                effective.getEngine(), effective.getReconstructionMode(), original.length, revised.length);
        try {
            CompareResult result = engine.compare(original, revised, effective);
            result.setDurationMillis(System.currentTimeMillis() - start);
            log.info("Comparison finished in {} ms: mode used={}, stats={}{}",
                    result.getDurationMillis(), result.getReconstructionModeUsed(), result.getStats(),
                    result.getFallbackReason() != null ? ", fallback=" + result.getFallbackReason() : "");
            return result;
        } catch (IOException | RuntimeException e) {
            log.error("Comparison failed after {} ms: {}", System.currentTimeMillis() - start, e.getMessage(), e);
            throw e;
        }
    }

    private static void requireContent(byte[] docx, String label) {
        if (docx == null || docx.length == 0) {
            throw new MalformedDocumentException("The " + label + " document is empty");
        }
    }
}
