package guraa.pdfbaseline.approval;

import guraa.pdfbaseline.model.PageKey;
import guraa.pdfbaseline.model.PageResult;
import lombok.Value;

/**
 * A page presented to the operator.
 */
@Value
public class ReviewItem {

    /**
     * 1-based position in the review queue.
     */
    int position;

    int queueSize;

    PageResult result;

    public PageKey getKey() {
        return result.getKey();
    }
}
