package guraa.pdfbaseline.model;

import java.util.Collection;

/**
 * Terminal classification of a compared page. Higher severity wins when aggregating.
 */
public enum PageStatus {

    PASS(0),
    FAIL(1),
    /**
     * Baseline present but not comparable (shape mismatch, unreadable raster, render failure).
     */
    ERROR(2),
    MISSING_BASELINE(3),
    PAGE_COUNT_MISMATCH(4);

    private final int severity;

    PageStatus(int severity) {
        this.severity = severity;
    }

    public int getSeverity() {
        return severity;
    }

    /**
     * Statuses for which no similarity score is ever reported.
     */
    public boolean precludesScore() {
        return this == MISSING_BASELINE || this == PAGE_COUNT_MISMATCH || this == ERROR;
    }

    public static PageStatus worst(PageStatus a, PageStatus b) {
        return a.severity >= b.severity ? a : b;
    }

    /**
     * Most severe status of the collection, PASS when empty.
     */
    public static PageStatus worstOf(Collection<PageStatus> statuses) {
        PageStatus result = PASS;
        for (PageStatus status : statuses) {
            result = worst(result, status);
        }
        return result;
    }
}
