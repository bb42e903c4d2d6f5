package guraa.pdfbaseline.service;

import guraa.pdfbaseline.model.PageStatus;

/**
 * Pass/fail rule for a scored page. The comparison happens in percentage space so that
 * human-chosen thresholds such as 95 or 99 behave as written.
 */
public final class ThresholdClassifier {

    private ThresholdClassifier() {
    }

    /**
     * @param similarity SSIM in [0, 1]
     * @param threshold  Percentage in [0, 100]
     */
    public static boolean passes(double similarity, double threshold) {
        return similarity * 100.0 >= threshold;
    }

    public static PageStatus classify(double similarity, double threshold) {
        return passes(similarity, threshold) ? PageStatus.PASS : PageStatus.FAIL;
    }
}
