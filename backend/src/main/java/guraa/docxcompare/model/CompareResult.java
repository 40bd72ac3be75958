package guraa.docxcompare.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Output of a comparison: the marked-up package and what it took to produce it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CompareResult {

    public static final String FALLBACK_ROUND_TRIP_FAILED = "round_trip_safety_check_failed";

    @JsonIgnore
    private byte[] document;

    private CompareStats stats;
    private ComparisonEngineType engine;

    /**
     * Requested and actual reconstruction mode; set for atomizer results only.
     */
    private ReconstructionMode reconstructionModeRequested;
    private ReconstructionMode reconstructionModeUsed;

    /**
     * Set only when the requested mode could not be used.
     */
    private String fallbackReason;
    private FallbackDiagnostics fallbackDiagnostics;

    private long durationMillis;
}
