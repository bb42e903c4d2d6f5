package guraa.pdfbaseline.model;

import lombok.Getter;

import java.util.Arrays;

/**
 * Immutable raster of unsigned 8-bit samples with shape (height, width, channels).
 * Samples are stored row-major, channels interleaved, as in a packed RGB buffer.
 */
@Getter
public final class PixelGrid {

    public static final int GRAY = 1;
    public static final int RGB = 3;

    private final int height;
    private final int width;
    private final int channels;

    @Getter(lombok.AccessLevel.NONE)
    private final byte[] samples;

    private PixelGrid(int height, int width, int channels, byte[] samples) {
        this.height = height;
        this.width = width;
        this.channels = channels;
        this.samples = samples;
    }

    /**
     * Create a grid from packed samples. The array is copied.
     *
     * @param height   Number of rows
     * @param width    Number of columns
     * @param channels 1 (gray) or 3 (RGB)
     * @param samples  Row-major interleaved samples, length height * width * channels
     * @return The new grid
     */
    public static PixelGrid of(int height, int width, int channels, byte[] samples) {
        validateShape(height, width, channels);
        if (samples == null || samples.length != height * width * channels) {
            throw new IllegalArgumentException("Sample buffer does not match shape "
                    + height + "x" + width + "x" + channels);
        }
        return new PixelGrid(height, width, channels, samples.clone());
    }

    /**
     * Create a grid where every pixel has the same value in every channel.
     */
    public static PixelGrid filled(int height, int width, int channels, int value) {
        validateShape(height, width, channels);
        byte[] samples = new byte[height * width * channels];
        Arrays.fill(samples, (byte) value);
        return new PixelGrid(height, width, channels, samples);
    }

    private static void validateShape(int height, int width, int channels) {
        if (height <= 0 || width <= 0) {
            throw new IllegalArgumentException("Grid dimensions must be positive: " + height + "x" + width);
        }
        if (channels != GRAY && channels != RGB) {
            throw new IllegalArgumentException("Unsupported channel count: " + channels);
        }
    }

    /**
     * Sample value in the range 0-255.
     */
    public int get(int y, int x, int channel) {
        return samples[(y * width + x) * channels + channel] & 0xFF;
    }

    /**
     * Two grids are comparable only when height, width and channel count all match.
     */
    public boolean isComparableTo(PixelGrid other) {
        return other != null
                && height == other.height
                && width == other.width
                && channels == other.channels;
    }

    public String shapeDescription() {
        return height + "x" + width + "x" + channels;
    }

    /**
     * @return A copy of the packed samples
     */
    public byte[] toByteArray() {
        return samples.clone();
    }

    /**
     * Start a mutable copy of this grid, used to derive new rasters.
     */
    public Builder toBuilder() {
        return new Builder(height, width, channels, samples.clone());
    }

    public static Builder builder(int height, int width, int channels) {
        validateShape(height, width, channels);
        return new Builder(height, width, channels, new byte[height * width * channels]);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PixelGrid)) return false;
        PixelGrid other = (PixelGrid) o;
        return isComparableTo(other) && Arrays.equals(samples, other.samples);
    }

    @Override
    public int hashCode() {
        int result = height;
        result = 31 * result + width;
        result = 31 * result + channels;
        result = 31 * result + Arrays.hashCode(samples);
        return result;
    }

    @Override
    public String toString() {
        return "PixelGrid[" + shapeDescription() + "]";
    }

    /**
     * Write-once builder; the buffer is handed to the grid on {@link #build()}.
     */
    public static final class Builder {
        private final int height;
        private final int width;
        private final int channels;
        private byte[] samples;

        private Builder(int height, int width, int channels, byte[] samples) {
            this.height = height;
            this.width = width;
            this.channels = channels;
            this.samples = samples;
        }

        public Builder set(int y, int x, int channel, int value) {
            samples[(y * width + x) * channels + channel] = (byte) Math.max(0, Math.min(255, value));
            return this;
        }

        /**
         * Set every channel of a pixel to the same value.
         */
        public Builder setAll(int y, int x, int value) {
            for (int c = 0; c < channels; c++) {
                set(y, x, c, value);
            }
            return this;
        }

        public PixelGrid build() {
            if (samples == null) {
                throw new IllegalStateException("Builder already used");
            }
            PixelGrid grid = new PixelGrid(height, width, channels, samples);
            samples = null;
            return grid;
        }
    }
}
