package guraa.pdfbaseline.visual;

import guraa.pdfbaseline.model.PixelGrid;

import java.util.Arrays;

/**
 * Per-pixel structural dissimilarity ({@code 1 - local SSIM}) at full page resolution.
 * Only the overlay builder reads it; it never takes part in scoring.
 */
public final class DissimilarityMap {

    private final int height;
    private final int width;
    private final double[] values;

    DissimilarityMap(int height, int width, double[] values) {
        if (values.length != height * width) {
            throw new IllegalArgumentException("Map buffer does not match " + height + "x" + width);
        }
        this.height = height;
        this.width = width;
        this.values = values;
    }

    public static DissimilarityMap uniform(int height, int width, double value) {
        double[] values = new double[height * width];
        Arrays.fill(values, value);
        return new DissimilarityMap(height, width, values);
    }

    public int getHeight() {
        return height;
    }

    public int getWidth() {
        return width;
    }

    public double get(int y, int x) {
        return values[y * width + x];
    }

    public double max() {
        double max = Double.NEGATIVE_INFINITY;
        for (double v : values) {
            max = Math.max(max, v);
        }
        return max;
    }

    public boolean isAllZero() {
        for (double v : values) {
            if (v != 0.0) {
                return false;
            }
        }
        return true;
    }

    /**
     * Number of pixels whose dissimilarity is strictly above the floor.
     */
    public long countAbove(double floor) {
        long count = 0;
        for (double v : values) {
            if (v > floor) {
                count++;
            }
        }
        return count;
    }

    /**
     * Gray raster of the map, dissimilarity clamped to [0, 1] and scaled to 0-255.
     */
    public PixelGrid toPixelGrid() {
        PixelGrid.Builder builder = PixelGrid.builder(height, width, PixelGrid.GRAY);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                double v = Math.max(0.0, Math.min(1.0, get(y, x)));
                builder.set(y, x, 0, (int) Math.round(v * 255.0));
            }
        }
        return builder.build();
    }
}
