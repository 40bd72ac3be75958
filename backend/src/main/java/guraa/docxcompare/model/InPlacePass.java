package guraa.docxcompare.model;

import com.fasterxml.jackson.annotation.JsonValue;
import guraa.docxcompare.core.AtomizerOptions;

/**
 * In-place attempts, tried in declaration order.
 */
public enum InPlacePass {
    INPLACE_WORD_SPLIT("inplace_word_split"),
    INPLACE_RUN_LEVEL("inplace_run_level");

    private final String value;

    InPlacePass(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public AtomizerOptions atomizerOptions() {
        switch (this) {
            case INPLACE_WORD_SPLIT:
                return AtomizerOptions.inPlaceWordSplit();
            case INPLACE_RUN_LEVEL:
            default:
                return AtomizerOptions.inPlaceRunLevel();
        }
    }
}
