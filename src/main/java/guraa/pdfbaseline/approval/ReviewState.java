package guraa.pdfbaseline.approval;

/**
 * Review state of a page. PENDING never survives into an {@link ApprovalOutcome}.
 */
public enum ReviewState {
    PENDING,
    ACCEPTED,
    REJECTED,
    SKIPPED
}
