package guraa.docxcompare.service;

import guraa.docxcompare.core.AtomizationResult;
import guraa.docxcompare.core.Atomizer;
import guraa.docxcompare.core.AtomizerOptions;
import guraa.docxcompare.core.ComparisonUnitAtom;
import guraa.docxcompare.core.CorrelationResult;
import guraa.docxcompare.core.FormatChangeDetector;
import guraa.docxcompare.core.HierarchicalCorrelator;
import guraa.docxcompare.core.MoveDetector;
import guraa.docxcompare.core.RunPreMerger;
import guraa.docxcompare.exception.MalformedDocumentException;
import guraa.docxcompare.model.AttemptDiagnostics;
import guraa.docxcompare.model.CompareOptions;
import guraa.docxcompare.model.CompareResult;
import guraa.docxcompare.model.CompareStats;
import guraa.docxcompare.model.ComparisonEngineType;
import guraa.docxcompare.model.FallbackDiagnostics;
import guraa.docxcompare.model.InPlacePass;
import guraa.docxcompare.model.ReconstructionMode;
import guraa.docxcompare.reconstruction.DocumentReconstructor;
import guraa.docxcompare.reconstruction.InPlaceModifier;
import guraa.docxcompare.reconstruction.RoundTripSafetyChecker;
import guraa.docxcompare.reconstruction.SafetyCheckResult;
import guraa.docxcompare.util.DocxPackage;
import guraa.docxcompare.util.WmlNodes;
import guraa.docxcompare.util.WmlXml;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Atom-level comparison: atomize, correlate, detect moves and format changes,
 * then reconstruct. In-place output is only returned when it survives the
 * accept/reject round trip; otherwise the rebuild output is returned with the
 * failed attempts attached.
 */
@Slf4j
@Service
public class AtomizerComparisonEngine implements ComparisonEngine {

    private static final String PART_NAME = "word/document.xml";

    private final RoundTripSafetyChecker safetyChecker;

    public AtomizerComparisonEngine(RoundTripSafetyChecker safetyChecker) {
        this.safetyChecker = safetyChecker;
    }

    public AtomizerComparisonEngine() {
        this(new RoundTripSafetyChecker());
    }

    @Override
    public ComparisonEngineType getType() {
        return ComparisonEngineType.ATOMIZER;
    }

    @Override
    public CompareResult compare(byte[] original, byte[] revised, CompareOptions options) throws IOException {
        Document originalXml = DocxPackage.readMainDocument(original);
        Document revisedXml = DocxPackage.readMainDocument(revised);
        requireBody(originalXml, "original");
        requireBody(revisedXml, "revised");
        Instant date = options.effectiveDate();

        RoundTripSafetyChecker.Baseline baseline = safetyChecker.baseline(originalXml, revisedXml);
        PassResult selected = null;
        FallbackDiagnostics diagnostics = null;

        if (options.getReconstructionMode() == ReconstructionMode.INPLACE) {
            List<AttemptDiagnostics> failedAttempts = new ArrayList<>();
            for (InPlacePass pass : InPlacePass.values()) {
                PassResult candidate = runPass(originalXml, revisedXml, pass.atomizerOptions(),
                        ReconstructionMode.INPLACE, options, date);
                SafetyCheckResult safety = safetyChecker.check(baseline, candidate.document);
                if (safety.isSafe()) {
                    selected = candidate;
                    break;
                }
                log.warn("In-place pass {} failed round-trip checks {}", pass.getValue(), safety.getFailedChecks());
                failedAttempts.add(AttemptDiagnostics.of(pass, safety));
            }
            if (selected == null) {
                log.warn("All in-place passes failed, falling back to rebuild");
                diagnostics = new FallbackDiagnostics(failedAttempts);
            }
        }
        if (selected == null) {
            selected = runPass(originalXml, revisedXml, AtomizerOptions.defaults(),
                    ReconstructionMode.REBUILD, options, date);
            if (options.isVerifyRebuild()) {
                SafetyCheckResult safety = safetyChecker.check(baseline, selected.document);
                if (safety.isSafe()) {
                    log.debug("Rebuild output passed round-trip checks");
                } else {
                    log.warn("Rebuild output failed round-trip checks {}: {}",
                            safety.getFailedChecks(), safety.getFailureSummary());
                }
            }
        }

        byte[] basePackage = selected.mode == ReconstructionMode.INPLACE ? revised : original;
        byte[] output = DocxPackage.replaceMainDocument(basePackage, selected.document);
        return CompareResult.builder()
                .document(output)
                .stats(CompareStats.fromAtoms(selected.mergedAtoms))
                .engine(ComparisonEngineType.ATOMIZER)
                .reconstructionModeRequested(options.getReconstructionMode())
                .reconstructionModeUsed(selected.mode)
                .fallbackReason(diagnostics != null ? CompareResult.FALLBACK_ROUND_TRIP_FAILED : null)
                .fallbackDiagnostics(diagnostics)
                .build();
    }

    /**
     * One full pipeline run on fresh copies of both trees, since in-place
     * reconstruction mutates the revised tree.
     */
    PassResult runPass(Document originalSource, Document revisedSource, AtomizerOptions atomizerOptions,
                       ReconstructionMode mode, CompareOptions options, Instant date) {
        Document originalXml = WmlXml.copy(originalSource);
        Document revisedXml = WmlXml.copy(revisedSource);
        Element originalBody = WmlNodes.findBody(originalXml);
        Element revisedBody = WmlNodes.findBody(revisedXml);

        if (options.isPremergeRuns()) {
            RunPreMerger preMerger = new RunPreMerger();
            int merged = preMerger.premerge(originalBody) + preMerger.premerge(revisedBody);
            log.debug("Pre-merged {} runs", merged);
        }

        Atomizer atomizer = new Atomizer();
        AtomizationResult originalAtomization = atomizer.atomize(originalBody, PART_NAME, atomizerOptions);
        AtomizationResult revisedAtomization = atomizer.atomize(revisedBody, PART_NAME, atomizerOptions);
        List<ComparisonUnitAtom> originalAtoms = originalAtomization.getAtoms();
        List<ComparisonUnitAtom> revisedAtoms = revisedAtomization.getAtoms();

        HierarchicalCorrelator correlator = new HierarchicalCorrelator(
                options.getLcsAlgorithm().create(), options.getParagraphSimilarityThreshold());
        CorrelationResult correlation = correlator.correlate(originalAtoms, revisedAtoms);
        correlator.markCorrelationStatus(originalAtoms, revisedAtoms, correlation);

        List<ComparisonUnitAtom> allAtoms = new ArrayList<>(originalAtoms);
        allAtoms.addAll(revisedAtoms);
        int moves = new MoveDetector(options.getMoveDetection()).detectMoves(allAtoms);

        int formatChanges = 0;
        if (options.isDetectFormatChanges() && !options.isIgnoreFormatting()) {
            formatChanges = new FormatChangeDetector().detectFormatChanges(revisedAtoms);
        }

        List<ComparisonUnitAtom> mergedAtoms = correlator.createMergedAtomList(originalAtoms, revisedAtoms, correlation);
        correlator.assignOutputParagraphIndices(originalAtoms, revisedAtoms, mergedAtoms, correlation);
        log.debug("{} pass: {} original atoms, {} revised atoms, {} merged, {} moves, {} format changes",
                mode, originalAtoms.size(), revisedAtoms.size(), mergedAtoms.size(), moves, formatChanges);

        Document output;
        if (mode == ReconstructionMode.INPLACE) {
            new InPlaceModifier().modify(revisedXml, originalAtoms, revisedAtoms, mergedAtoms,
                    options.getAuthor(), date);
            output = revisedXml;
        } else {
            output = new DocumentReconstructor(!options.isIgnoreFormatting())
                    .reconstruct(mergedAtoms, originalXml, options.getAuthor(), date);
        }
        return new PassResult(output, mergedAtoms, mode);
    }

    private static void requireBody(Document document, String label) {
        if (WmlNodes.findBody(document) == null) {
            throw new MalformedDocumentException("The " + label + " document has no w:body");
        }
    }

    static class PassResult {
        final Document document;
        final List<ComparisonUnitAtom> mergedAtoms;
        final ReconstructionMode mode;

        PassResult(Document document, List<ComparisonUnitAtom> mergedAtoms, ReconstructionMode mode) {
            this.document = document;
            this.mergedAtoms = mergedAtoms;
            this.mode = mode;
        }
    }
}
