package guraa.pdfbaseline;

import guraa.pdfbaseline.model.PixelGrid;

import java.util.Random;

/**
 * Raster fixtures shared by the tests.
 */
public final class TestRasters {

    public static final int WHITE = 255;
    public static final int BLACK = 0;

    private TestRasters() {
    }

    public static PixelGrid white(int height, int width) {
        return PixelGrid.filled(height, width, PixelGrid.RGB, WHITE);
    }

    public static PixelGrid black(int height, int width) {
        return PixelGrid.filled(height, width, PixelGrid.RGB, BLACK);
    }

    /**
     * White page with a black square whose top-left corner is at (top, left).
     */
    public static PixelGrid withBlock(PixelGrid page, int top, int left, int size) {
        PixelGrid.Builder builder = page.toBuilder();
        for (int y = top; y < top + size; y++) {
            for (int x = left; x < left + size; x++) {
                builder.setAll(y, x, BLACK);
            }
        }
        return builder.build();
    }

    /**
     * Mid-gray page with seeded random texture, something like scanned text.
     */
    public static PixelGrid textured(int height, int width, long seed) {
        Random random = new Random(seed);
        PixelGrid.Builder builder = PixelGrid.builder(height, width, PixelGrid.RGB);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                builder.setAll(y, x, 64 + random.nextInt(128));
            }
        }
        return builder.build();
    }

    /**
     * Copy of a page with every sample shifted by up to {@code amplitude} levels.
     */
    public static PixelGrid withNoise(PixelGrid page, int amplitude, long seed) {
        Random random = new Random(seed);
        PixelGrid.Builder builder = page.toBuilder();
        for (int y = 0; y < page.getHeight(); y++) {
            for (int x = 0; x < page.getWidth(); x++) {
                for (int c = 0; c < page.getChannels(); c++) {
                    int delta = random.nextInt(2 * amplitude + 1) - amplitude;
                    builder.set(y, x, c, page.get(y, x, c) + delta);
                }
            }
        }
        return builder.build();
    }
}
