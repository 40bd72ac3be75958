package guraa.docxcompare.reconstruction;

import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * Outcome of the accept/reject round trip on one candidate output.
 */
@Data
@Builder
public class SafetyCheckResult {

    public static final String ACCEPT_TEXT = "acceptText";
    public static final String REJECT_TEXT = "rejectText";
    public static final String ACCEPT_BOOKMARKS = "acceptBookmarks";
    public static final String REJECT_BOOKMARKS = "rejectBookmarks";

    private boolean safe;

    /**
     * Check name to pass/fail, in the order the checks run.
     */
    private Map<String, Boolean> checks;

    private List<String> failedChecks;

    /**
     * Per failed check, a {@link TextMismatchDetails} or {@link BookmarkMismatchDetails}.
     */
    private Map<String, Object> failureDetails;

    /**
     * Short, truncated view of {@link #failureDetails} for logs and API responses.
     */
    private Map<String, Object> failureSummary;
}
