package guraa.pdfbaseline.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for the application. Command line flags override the
 * comparison and storage values for a single run.
 */
@Component
@ConfigurationProperties(prefix = "app")
public class AppProperties {

    private final Comparison comparison = new Comparison();
    private final Overlay overlay = new Overlay();
    private final Storage storage = new Storage();
    private final Concurrency concurrency = new Concurrency();

    public Comparison getComparison() {
        return comparison;
    }

    public Overlay getOverlay() {
        return overlay;
    }

    public Storage getStorage() {
        return storage;
    }

    public Concurrency getConcurrency() {
        return concurrency;
    }

    /**
     * Comparison configuration properties
     */
    public static class Comparison {
        private double threshold = 95.0;
        private int dpi = 150;
        private int windowSize = 7;
        private String channelMode = "PER_CHANNEL";

        public double getThreshold() {
            return threshold;
        }

        public void setThreshold(double threshold) {
            this.threshold = threshold;
        }

        public int getDpi() {
            return dpi;
        }

        public void setDpi(int dpi) {
            this.dpi = dpi;
        }

        public int getWindowSize() {
            return windowSize;
        }

        public void setWindowSize(int windowSize) {
            this.windowSize = windowSize;
        }

        public String getChannelMode() {
            return channelMode;
        }

        public void setChannelMode(String channelMode) {
            this.channelMode = channelMode;
        }
    }

    /**
     * Diff overlay configuration properties
     */
    public static class Overlay {
        private String highlightColor = "#FF0000";
        private double alpha = 0.4;

        public String getHighlightColor() {
            return highlightColor;
        }

        public void setHighlightColor(String highlightColor) {
            this.highlightColor = highlightColor;
        }

        public double getAlpha() {
            return alpha;
        }

        public void setAlpha(double alpha) {
            this.alpha = alpha;
        }
    }

    /**
     * Storage configuration properties
     */
    public static class Storage {
        private String baselineDir = "baselines";
        private String outputDir = "results";

        public String getBaselineDir() {
            return baselineDir;
        }

        public void setBaselineDir(String baselineDir) {
            this.baselineDir = baselineDir;
        }

        public String getOutputDir() {
            return outputDir;
        }

        public void setOutputDir(String outputDir) {
            this.outputDir = outputDir;
        }
    }

    public static class Concurrency {
        private int comparisonThreads = Math.min(4, Runtime.getRuntime().availableProcessors());

        public int getComparisonThreads() {
            return comparisonThreads;
        }

        public void setComparisonThreads(int comparisonThreads) {
            this.comparisonThreads = comparisonThreads;
        }
    }
}
