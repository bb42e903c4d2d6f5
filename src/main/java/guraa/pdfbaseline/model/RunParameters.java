package guraa.pdfbaseline.model;

import guraa.pdfbaseline.config.ConfigException;
import lombok.Builder;
import lombok.Value;

/**
 * Per-run parameters handed in by the command line layer.
 */
@Value
@Builder
public class RunParameters {

    public static final double DEFAULT_THRESHOLD = 95.0;
    public static final int DEFAULT_DPI = 150;

    @Builder.Default
    double threshold = DEFAULT_THRESHOLD;

    @Builder.Default
    int dpi = DEFAULT_DPI;

    boolean interactive;

    /**
     * @return this, for chaining
     * @throws ConfigException if the threshold is outside [0, 100] or the DPI is not positive
     */
    public RunParameters validate() {
        if (Double.isNaN(threshold) || threshold < 0.0 || threshold > 100.0) {
            throw new ConfigException("Threshold must be a percentage in [0, 100], got " + threshold);
        }
        if (dpi <= 0) {
            throw new ConfigException("DPI must be a positive integer, got " + dpi);
        }
        return this;
    }

    public static RunParameters defaults() {
        return RunParameters.builder().build();
    }
}
