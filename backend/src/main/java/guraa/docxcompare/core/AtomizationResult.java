package guraa.docxcompare.core;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

@Getter
@AllArgsConstructor
public class AtomizationResult {

    private final List<ComparisonUnitAtom> atoms;
    private final int emptyParagraphCount;
}
