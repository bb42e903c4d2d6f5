package guraa.pdfbaseline.approval;

/**
 * Operator answer for one page under review.
 */
public enum ReviewDecision {
    ACCEPT,
    REJECT,
    SKIP,
    /**
     * Stop reviewing; every page not yet decided stays as it is.
     */
    ABORT
}
