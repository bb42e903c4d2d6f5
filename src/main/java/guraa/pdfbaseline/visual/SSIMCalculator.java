package guraa.pdfbaseline.visual;

import guraa.pdfbaseline.config.ConfigException;
import guraa.pdfbaseline.model.PixelGrid;
import lombok.extern.slf4j.Slf4j;

/**
 * Windowed Structural Similarity Index (SSIM) between two rasters.
 * SSIM is a perception-based model that considers image degradation as perceived change
 * in structural information, so anti-aliasing and font hinting noise score close to 1
 * while real layout changes do not.
 * <p>
 * Local means, variances and covariance are taken over a square uniform window centred on
 * every pixel, with edge replication at the borders. The page score is the mean of the
 * local index over all pixels, clamped to [0, 1]. The calculator holds no mutable state.
 */
@Slf4j
public class SSIMCalculator implements SimilarityScorer {

    // Constants for SSIM calculation
    private static final double K1 = 0.01;
    private static final double K2 = 0.03;
    private static final double DYNAMIC_RANGE = 255.0;
    private static final double C1 = Math.pow(DYNAMIC_RANGE * K1, 2);
    private static final double C2 = Math.pow(DYNAMIC_RANGE * K2, 2);

    public static final int DEFAULT_WINDOW_SIZE = 7;

    private final int windowSize;
    private final ChannelMode channelMode;

    public SSIMCalculator() {
        this(DEFAULT_WINDOW_SIZE, ChannelMode.PER_CHANNEL);
    }

    /**
     * @param windowSize  Odd window edge length, at least 3
     * @param channelMode How RGB rasters are reduced
     */
    public SSIMCalculator(int windowSize, ChannelMode channelMode) {
        if (windowSize < 3 || windowSize % 2 == 0) {
            throw new ConfigException("SSIM window size must be odd and at least 3, got " + windowSize);
        }
        this.windowSize = windowSize;
        this.channelMode = channelMode == null ? ChannelMode.PER_CHANNEL : channelMode;
    }

    public int getWindowSize() {
        return windowSize;
    }

    public ChannelMode getChannelMode() {
        return channelMode;
    }

    @Override
    public ScoreResult score(PixelGrid candidate, PixelGrid baseline) {
        if (!candidate.isComparableTo(baseline)) {
            throw new ShapeMismatchException(candidate, baseline);
        }

        int height = candidate.getHeight();
        int width = candidate.getWidth();
        double[] ssimMap;

        if (candidate.getChannels() == PixelGrid.GRAY || channelMode == ChannelMode.LUMINANCE) {
            ssimMap = calculateSSIMMap(toLuminanceArray(candidate), toLuminanceArray(baseline), height, width);
        } else {
            int channels = candidate.getChannels();
            ssimMap = new double[height * width];
            for (int c = 0; c < channels; c++) {
                double[] channelMap = calculateSSIMMap(
                        channelArray(candidate, c), channelArray(baseline, c), height, width);
                for (int i = 0; i < ssimMap.length; i++) {
                    ssimMap[i] += channelMap[i];
                }
            }
            for (int i = 0; i < ssimMap.length; i++) {
                ssimMap[i] /= channels;
            }
        }

        double sum = 0.0;
        for (double v : ssimMap) {
            sum += v;
        }
        double mean = sum / ssimMap.length;
        double similarity = Math.max(0.0, Math.min(1.0, mean));

        // Reuse the buffer for the dissimilarity map
        for (int i = 0; i < ssimMap.length; i++) {
            ssimMap[i] = 1.0 - ssimMap[i];
        }

        log.debug("SSIM {} over {}x{} (window {}, {})", similarity, width, height, windowSize, channelMode);
        return new ScoreResult(similarity, new DissimilarityMap(height, width, ssimMap));
    }

    /**
     * Local SSIM index for every pixel of two equally sized planes.
     */
    private double[] calculateSSIMMap(double[] x, double[] y, int height, int width) {
        int n = x.length;
        double[] product = new double[n];
        double[] scratch = new double[n];

        double[] meanX = boxMean(x, height, width, scratch, new double[n]);
        double[] meanY = boxMean(y, height, width, scratch, new double[n]);

        for (int i = 0; i < n; i++) product[i] = x[i] * x[i];
        double[] meanXX = boxMean(product, height, width, scratch, new double[n]);

        for (int i = 0; i < n; i++) product[i] = y[i] * y[i];
        double[] meanYY = boxMean(product, height, width, scratch, new double[n]);

        for (int i = 0; i < n; i++) product[i] = x[i] * y[i];
        double[] meanXY = boxMean(product, height, width, scratch, new double[n]);

        // Sample (unbiased) covariance over the window
        int windowPixels = windowSize * windowSize;
        double covNorm = windowPixels / (double) (windowPixels - 1);

        double[] result = product;
        for (int i = 0; i < n; i++) {
            double ux = meanX[i];
            double uy = meanY[i];
            double vx = covNorm * (meanXX[i] - ux * ux);
            double vy = covNorm * (meanYY[i] - uy * uy);
            double vxy = covNorm * (meanXY[i] - ux * uy);

            double numerator = (2 * ux * uy + C1) * (2 * vxy + C2);
            double denominator = (ux * ux + uy * uy + C1) * (vx + vy + C2);
            result[i] = numerator / denominator;
        }
        return result;
    }

    /**
     * Separable uniform filter with edge replication.
     *
     * @param plane   Input values
     * @param scratch Buffer for the horizontal pass, overwritten
     * @param out     Output buffer
     * @return out
     */
    private double[] boxMean(double[] plane, int height, int width, double[] scratch, double[] out) {
        int radius = windowSize / 2;

        for (int yy = 0; yy < height; yy++) {
            int row = yy * width;
            for (int xx = 0; xx < width; xx++) {
                double sum = 0.0;
                for (int d = -radius; d <= radius; d++) {
                    sum += plane[row + clamp(xx + d, width)];
                }
                scratch[row + xx] = sum;
            }
        }

        double area = windowSize * (double) windowSize;
        for (int yy = 0; yy < height; yy++) {
            for (int xx = 0; xx < width; xx++) {
                double sum = 0.0;
                for (int d = -radius; d <= radius; d++) {
                    sum += scratch[clamp(yy + d, height) * width + xx];
                }
                out[yy * width + xx] = sum / area;
            }
        }
        return out;
    }

    private static int clamp(int index, int size) {
        if (index < 0) return 0;
        if (index >= size) return size - 1;
        return index;
    }

    /**
     * Convert a raster to a luminance plane. Gray rasters map directly.
     */
    private double[] toLuminanceArray(PixelGrid grid) {
        if (grid.getChannels() == PixelGrid.GRAY) {
            return channelArray(grid, 0);
        }

        int height = grid.getHeight();
        int width = grid.getWidth();
        double[] result = new double[height * width];

        for (int yy = 0; yy < height; yy++) {
            for (int xx = 0; xx < width; xx++) {
                int r = grid.get(yy, xx, 0);
                int g = grid.get(yy, xx, 1);
                int b = grid.get(yy, xx, 2);
                result[yy * width + xx] = 0.299 * r + 0.587 * g + 0.114 * b;
            }
        }
        return result;
    }

    private double[] channelArray(PixelGrid grid, int channel) {
        int height = grid.getHeight();
        int width = grid.getWidth();
        double[] result = new double[height * width];
        for (int yy = 0; yy < height; yy++) {
            for (int xx = 0; xx < width; xx++) {
                result[yy * width + xx] = grid.get(yy, xx, channel);
            }
        }
        return result;
    }
}
