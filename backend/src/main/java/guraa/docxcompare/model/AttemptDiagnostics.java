package guraa.docxcompare.model;

import guraa.docxcompare.reconstruction.SafetyCheckResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Why one in-place attempt was rejected.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AttemptDiagnostics {

    private InPlacePass pass;
    private Map<String, Boolean> checks;
    private List<String> failedChecks;
    private Map<String, Object> failureDetails;
    private Map<String, Object> firstDiffSummary;

    public static AttemptDiagnostics of(InPlacePass pass, SafetyCheckResult safety) {
        return AttemptDiagnostics.builder()
                .pass(pass)
                .checks(safety.getChecks())
                .failedChecks(safety.getFailedChecks())
                .failureDetails(safety.getFailureDetails())
                .firstDiffSummary(safety.getFailureSummary())
                .build();
    }
}
