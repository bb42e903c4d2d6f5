package guraa.pdfbaseline.visual;

import guraa.pdfbaseline.model.PixelGrid;

/**
 * Two rasters were handed to the scorer or overlay builder with different shapes.
 */
public class ShapeMismatchException extends IllegalArgumentException {

    public ShapeMismatchException(PixelGrid candidate, PixelGrid baseline) {
        super("Cannot compare candidate " + candidate.shapeDescription()
                + " with baseline " + baseline.shapeDescription());
    }

    public ShapeMismatchException(String message) {
        super(message);
    }
}
