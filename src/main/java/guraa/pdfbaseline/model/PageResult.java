package guraa.pdfbaseline.model;

import lombok.Builder;
import lombok.Value;

/**
 * Outcome of comparing one page against its baseline.
 * <p>
 * {@code status == PASS} exactly when a score was computed and {@code score * 100 >= thresholdUsed}.
 * Statuses that preclude scoring never carry a score.
 */
@Value
@Builder(toBuilder = true)
public class PageResult {

    PageKey key;

    PageStatus status;

    /**
     * SSIM in [0, 1], null when the status precludes scoring.
     */
    Double similarityScore;

    /**
     * Threshold as a percentage in [0, 100].
     */
    double thresholdUsed;

    /**
     * Visual diff overlay, best-effort and advisory only.
     */
    PixelGrid diffImage;

    /**
     * Human-readable detail for ERROR, MISSING_BASELINE and PAGE_COUNT_MISMATCH pages.
     */
    String message;

    public int getPageNumber() {
        return key.getPageNumber();
    }

    public boolean isPassed() {
        return status == PageStatus.PASS;
    }

    public boolean hasScore() {
        return similarityScore != null;
    }

    public boolean hasDiffImage() {
        return diffImage != null;
    }

    /**
     * Similarity as a 0-100 percentage, or null when unscored.
     */
    public Double getSimilarityPercent() {
        return similarityScore == null ? null : similarityScore * 100.0;
    }

    public static PageResult unscored(PageKey key, PageStatus status, double threshold, String message) {
        if (!status.precludesScore()) {
            throw new IllegalArgumentException(status + " pages must carry a score");
        }
        return PageResult.builder()
                .key(key)
                .status(status)
                .thresholdUsed(threshold)
                .message(message)
                .build();
    }
}
