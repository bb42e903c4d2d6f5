package guraa.pdfbaseline.approval;

import guraa.pdfbaseline.store.StoreWriteException;

/**
 * Where review decisions come from: the console for people, a script in tests.
 * {@link #decide(ReviewItem)} is the one place the review loop waits.
 */
public interface DecisionSource {

    ReviewDecision decide(ReviewItem item);

    /**
     * Called when an accepted page could not be written to the baseline store.
     */
    default void writeFailed(ReviewItem item, StoreWriteException error) {
    }

    /**
     * Called after a page was accepted and re-compared.
     */
    default void accepted(ReviewItem item) {
    }
}
