package guraa.pdfbaseline.util;

import guraa.pdfbaseline.model.PixelGrid;
import lombok.extern.slf4j.Slf4j;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.awt.image.Raster;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;

/**
 * Utility class for converting between {@link PixelGrid}, {@link BufferedImage} and PNG bytes.
 */
@Slf4j
public final class ImageConverter {

    public static final String PNG = "png";

    private ImageConverter() {
        // Utility class, no instances allowed
    }

    /**
     * Convert a BufferedImage to a grid. Gray images keep one channel, everything else
     * becomes RGB (alpha is dropped).
     *
     * @param image The image to convert
     * @return The grid
     */
    public static PixelGrid toPixelGrid(BufferedImage image) {
        int width = image.getWidth();
        int height = image.getHeight();

        if (image.getType() == BufferedImage.TYPE_BYTE_GRAY) {
            Raster raster = image.getRaster();
            PixelGrid.Builder builder = PixelGrid.builder(height, width, PixelGrid.GRAY);
            for (int y = 0; y < height; y++) {
                for (int x = 0; x < width; x++) {
                    builder.set(y, x, 0, raster.getSample(x, y, 0));
                }
            }
            return builder.build();
        }

        // RGB image - use direct pixel access
        int[] pixels = image.getRGB(0, 0, width, height, null, 0, width);
        byte[] samples = new byte[width * height * 3];
        int pixel = 0;
        int index = 0;
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int rgb = pixels[pixel++];
                samples[index++] = (byte) ((rgb >> 16) & 0xFF);
                samples[index++] = (byte) ((rgb >> 8) & 0xFF);
                samples[index++] = (byte) (rgb & 0xFF);
            }
        }
        return PixelGrid.of(height, width, PixelGrid.RGB, samples);
    }

    /**
     * Convert a grid to a BufferedImage of type {@code TYPE_BYTE_GRAY} or {@code TYPE_INT_RGB}.
     *
     * @param grid The grid to convert
     * @return The image
     */
    public static BufferedImage toBufferedImage(PixelGrid grid) {
        int width = grid.getWidth();
        int height = grid.getHeight();

        if (grid.getChannels() == PixelGrid.GRAY) {
            BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_BYTE_GRAY);
            for (int y = 0; y < height; y++) {
                for (int x = 0; x < width; x++) {
                    image.getRaster().setSample(x, y, 0, grid.get(y, x, 0));
                }
            }
            return image;
        }

        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        int[] pixels = new int[width * height];
        int pixel = 0;
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                pixels[pixel++] = (grid.get(y, x, 0) << 16) | (grid.get(y, x, 1) << 8) | grid.get(y, x, 2);
            }
        }
        image.setRGB(0, 0, width, height, pixels, 0, width);
        return image;
    }

    /**
     * Encode a grid as PNG.
     *
     * @param grid The grid to encode
     * @return PNG bytes
     * @throws IOException If no PNG writer is available or encoding fails
     */
    public static byte[] toPngBytes(PixelGrid grid) throws IOException {
        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        if (!ImageIO.write(toBufferedImage(grid), PNG, baos)) {
            throw new IOException("No ImageIO writer for " + PNG);
        }
        return baos.toByteArray();
    }

    /**
     * Decode image bytes in any ImageIO-supported format.
     *
     * @param bytes Encoded image
     * @return The decoded grid
     * @throws IOException If the bytes are not a readable image
     */
    public static PixelGrid fromImageBytes(byte[] bytes) throws IOException {
        BufferedImage image = ImageIO.read(new ByteArrayInputStream(bytes));
        if (image == null) {
            throw new IOException("Unrecognised image data (" + bytes.length + " bytes)");
        }
        return toPixelGrid(image);
    }
}
