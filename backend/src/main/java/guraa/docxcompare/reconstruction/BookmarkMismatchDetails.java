package guraa.docxcompare.reconstruction;

import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class BookmarkMismatchDetails {
    private BookmarkDiagnostics.IdDelta startNames;
    private BookmarkDiagnostics.IdDelta referencedBookmarkNames;
    private BookmarkDiagnostics.IdDelta unresolvedReferenceNames;
    private BookmarkDiagnostics.IdDelta startIds;
    private BookmarkDiagnostics.IdDelta endIds;
    private List<String> expectedDuplicateStartNames;
    private List<String> actualDuplicateStartNames;
    private List<String> expectedDuplicateStartIds;
    private List<String> actualDuplicateStartIds;
    private List<String> expectedDuplicateEndIds;
    private List<String> actualDuplicateEndIds;
    private List<String> expectedUnmatchedStartIds;
    private List<String> actualUnmatchedStartIds;
    private List<String> expectedUnmatchedEndIds;
    private List<String> actualUnmatchedEndIds;
}
