package guraa.pdfbaseline.visual;

import guraa.pdfbaseline.config.ConfigException;
import guraa.pdfbaseline.model.PixelGrid;
import lombok.extern.slf4j.Slf4j;

import java.awt.Color;

/**
 * Renders the candidate page with structurally changed regions tinted in a highlight colour.
 * The overlay is for people only; classification never reads it.
 */
@Slf4j
public class DiffOverlayBuilder {

    /**
     * Local dissimilarity above which a pixel counts as changed.
     */
    public static final double SIGNIFICANCE_FLOOR = 0.1;

    public static final Color DEFAULT_HIGHLIGHT = Color.RED;
    public static final double DEFAULT_ALPHA = 0.4;

    private final double alpha;

    public DiffOverlayBuilder() {
        this(DEFAULT_ALPHA);
    }

    /**
     * @param alpha Weight of the highlight colour in changed pixels, in (0, 1]
     */
    public DiffOverlayBuilder(double alpha) {
        if (Double.isNaN(alpha) || alpha <= 0.0 || alpha > 1.0) {
            throw new ConfigException("Overlay alpha must be in (0, 1], got " + alpha);
        }
        this.alpha = alpha;
    }

    public double getAlpha() {
        return alpha;
    }

    /**
     * Build the overlay.
     *
     * @param candidate      Base image of the overlay
     * @param baseline       Reference page, only checked for shape
     * @param structuralDiff Dissimilarity map from the scorer
     * @param highlightColor Tint for changed regions
     * @return A raster with the candidate's shape; identical to the candidate when nothing
     *         exceeds {@link #SIGNIFICANCE_FLOOR}
     */
    public PixelGrid buildOverlay(PixelGrid candidate, PixelGrid baseline,
                                  DissimilarityMap structuralDiff, Color highlightColor) {
        if (!candidate.isComparableTo(baseline)) {
            throw new ShapeMismatchException(candidate, baseline);
        }
        if (structuralDiff.getHeight() != candidate.getHeight() || structuralDiff.getWidth() != candidate.getWidth()) {
            throw new ShapeMismatchException("Dissimilarity map " + structuralDiff.getHeight() + "x"
                    + structuralDiff.getWidth() + " does not cover candidate " + candidate.shapeDescription());
        }

        Color color = highlightColor != null ? highlightColor : DEFAULT_HIGHLIGHT;
        int[] tint = tintFor(color, candidate.getChannels());

        PixelGrid.Builder overlay = candidate.toBuilder();
        long highlighted = 0;

        for (int y = 0; y < candidate.getHeight(); y++) {
            for (int x = 0; x < candidate.getWidth(); x++) {
                if (structuralDiff.get(y, x) <= SIGNIFICANCE_FLOOR) {
                    continue;
                }
                highlighted++;
                for (int c = 0; c < candidate.getChannels(); c++) {
                    double blended = (1.0 - alpha) * candidate.get(y, x, c) + alpha * tint[c];
                    overlay.set(y, x, c, (int) Math.round(blended));
                }
            }
        }

        log.debug("Overlay highlights {} of {} pixels", highlighted,
                (long) candidate.getHeight() * candidate.getWidth());
        return overlay.build();
    }

    /**
     * Highlight colour as channel samples; gray rasters get its luminance.
     */
    private int[] tintFor(Color color, int channels) {
        if (channels == PixelGrid.GRAY) {
            int luminance = (int) Math.round(0.299 * color.getRed() + 0.587 * color.getGreen() + 0.114 * color.getBlue());
            return new int[]{luminance};
        }
        return new int[]{color.getRed(), color.getGreen(), color.getBlue()};
    }

    /**
     * Parse a {@code #RRGGBB} colour.
     *
     * @throws ConfigException if the value is not a hex colour
     */
    public static Color parseColor(String value) {
        try {
            return Color.decode(value.trim());
        } catch (NumberFormatException | NullPointerException e) {
            throw new ConfigException("Invalid highlight colour: " + value, e);
        }
    }
}
