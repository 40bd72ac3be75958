package guraa.docxcompare.reconstruction;

import guraa.docxcompare.core.Atomizer;
import guraa.docxcompare.core.AtomizerOptions;
import guraa.docxcompare.core.ComparisonUnitAtom;
import guraa.docxcompare.core.CorrelationResult;
import guraa.docxcompare.core.FormatChangeDetector;
import guraa.docxcompare.core.HierarchicalCorrelator;
import guraa.docxcompare.core.MoveDetectionSettings;
import guraa.docxcompare.core.MoveDetector;
import guraa.docxcompare.core.lcs.HuntSzymanskiLcs;
import guraa.docxcompare.util.WmlNodes;
import guraa.docxcompare.util.WmlXml;
import lombok.Getter;
import org.w3c.dom.Document;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs the comparison stages up to the merged atom list on two body fragments.
 */
@Getter
class ReconstructionFixture {

    private final Document originalDocument;
    private final Document revisedDocument;
    private final List<ComparisonUnitAtom> original;
    private final List<ComparisonUnitAtom> revised;
    private final List<ComparisonUnitAtom> merged;

    ReconstructionFixture(String originalBody, String revisedBody, AtomizerOptions options) {
        this.originalDocument = WmlXml.fromBodyXml(originalBody);
        this.revisedDocument = WmlXml.fromBodyXml(revisedBody);
        Atomizer atomizer = new Atomizer();
        this.original = atomizer.atomize(WmlNodes.findBody(originalDocument), "word/document.xml", options).getAtoms();
        this.revised = atomizer.atomize(WmlNodes.findBody(revisedDocument), "word/document.xml", options).getAtoms();

        HierarchicalCorrelator correlator = new HierarchicalCorrelator(new HuntSzymanskiLcs());
        CorrelationResult result = correlator.correlate(original, revised);
        correlator.markCorrelationStatus(original, revised, result);
        List<ComparisonUnitAtom> all = new ArrayList<>(original);
        all.addAll(revised);
        new MoveDetector(MoveDetectionSettings.builder().build()).detectMoves(all);
        new FormatChangeDetector().detectFormatChanges(revised);
        this.merged = correlator.createMergedAtomList(original, revised, result);
        correlator.assignOutputParagraphIndices(original, revised, merged, result);
    }

    ReconstructionFixture(String originalBody, String revisedBody) {
        this(originalBody, revisedBody, AtomizerOptions.defaults());
    }

    static String paragraph(String text) {
        return "<w:p><w:r><w:t xml:space=\"preserve\">" + text + "</w:t></w:r></w:p>";
    }
}
