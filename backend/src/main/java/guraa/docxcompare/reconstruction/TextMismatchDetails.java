package guraa.docxcompare.reconstruction;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Where a simulated accept or reject stops matching the expected text.
 */
@Data
@Builder
public class TextMismatchDetails {
    private int expectedLength;
    private int actualLength;
    private int firstDifferingParagraphIndex;
    private String expectedParagraph;
    private String actualParagraph;
    private List<String> differenceSample;
}
