package guraa.docxcompare.service;

import guraa.docxcompare.exception.MalformedDocumentException;
import guraa.docxcompare.exception.UnsupportedComparisonException;
import guraa.docxcompare.model.CompareOptions;
import guraa.docxcompare.model.CompareResult;
import guraa.docxcompare.model.CompareStats;
import guraa.docxcompare.model.ComparisonEngineType;
import guraa.docxcompare.model.ReconstructionMode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("DOCX Comparison Service Tests")
class DocxComparisonServiceTest {

    private static final byte[] ORIGINAL = {1, 2, 3};
    private static final byte[] REVISED = {4, 5, 6};

    @Mock
    private ComparisonEngine atomizerEngine;

    @Mock
    private ComparisonEngine paragraphEngine;

    private CompareOptions defaults;
    private DocxComparisonService service;

    @BeforeEach
    void setUp() {
        when(atomizerEngine.getType()).thenReturn(ComparisonEngineType.ATOMIZER);
        when(paragraphEngine.getType()).thenReturn(ComparisonEngineType.DIFFMATCH);
        defaults = CompareOptions.builder().author("Configured").build();
        service = new DocxComparisonService(List.of(atomizerEngine, paragraphEngine), defaults);
    }

    private static CompareResult result(ComparisonEngineType engine) {
        return CompareResult.builder()
                .engine(engine)
                .stats(CompareStats.builder().insertions(1).build())
                .document(new byte[]{9})
                .build();
    }

    @Test
    @DisplayName("Should use the atomizer engine with default options")
    void shouldDispatchToAtomizer_whenUsingDefaults() throws IOException {
        when(atomizerEngine.compare(ORIGINAL, REVISED, defaults)).thenReturn(result(ComparisonEngineType.ATOMIZER));

        CompareResult result = service.compareDocuments(ORIGINAL, REVISED);

        assertThat(result.getEngine()).isEqualTo(ComparisonEngineType.ATOMIZER);
        assertThat(result.getDurationMillis()).isGreaterThanOrEqualTo(0);
        verify(paragraphEngine, never()).compare(any(), any(), any());
    }

    @Test
    @DisplayName("Should dispatch to the engine named in the options")
    void shouldDispatchToParagraphEngine_whenRequested() throws IOException {
        CompareOptions options = service.optionsBuilder().engine(ComparisonEngineType.DIFFMATCH).build();
        when(paragraphEngine.compare(eq(ORIGINAL), eq(REVISED), eq(options)))
                .thenReturn(result(ComparisonEngineType.DIFFMATCH));

        CompareResult result = service.compareDocuments(ORIGINAL, REVISED, options);

        assertThat(result.getEngine()).isEqualTo(ComparisonEngineType.DIFFMATCH);
        assertThat(options.getAuthor()).isEqualTo("Configured");
    }

    @Test
    @DisplayName("Should reject in-place reconstruction for the paragraph engine")
    void shouldThrow_whenParagraphEngineIsAskedForInPlace() throws IOException {
        CompareOptions options = service.optionsBuilder()
                .engine(ComparisonEngineType.DIFFMATCH)
                .reconstructionMode(ReconstructionMode.INPLACE)
                .build();

        assertThatThrownBy(() -> service.compareDocuments(ORIGINAL, REVISED, options))
                .isInstanceOf(UnsupportedComparisonException.class);
        verify(paragraphEngine, never()).compare(any(), any(), any());
    }

    @Test
    @DisplayName("Should reject empty input")
    void shouldThrow_whenInputIsEmpty() {
        assertThatThrownBy(() -> service.compareDocuments(new byte[0], REVISED))
                .isInstanceOf(MalformedDocumentException.class)
                .hasMessageContaining("original");
        assertThatThrownBy(() -> service.compareDocuments(ORIGINAL, null))
                .isInstanceOf(MalformedDocumentException.class)
                .hasMessageContaining("revised");
    }

    @Test
    @DisplayName("Should propagate engine failures")
    void shouldRethrow_whenEngineFails() throws IOException {
        when(atomizerEngine.compare(any(), any(), any())).thenThrow(new MalformedDocumentException("broken"));

        assertThatThrownBy(() -> service.compareDocuments(ORIGINAL, REVISED))
                .isInstanceOf(MalformedDocumentException.class)
                .hasMessage("broken");
    }

    @Test
    @DisplayName("Should hand out independent option builders")
    void shouldNotShareState_whenBuildingOptions() {
        CompareOptions changed = service.optionsBuilder().author("Someone else").build();

        assertThat(changed.getAuthor()).isEqualTo("Someone else");
        assertThat(service.optionsBuilder().build().getAuthor()).isEqualTo("Configured");
    }
}
