package guraa.pdfbaseline.visual;

import guraa.pdfbaseline.model.PixelGrid;

/**
 * Perceptual similarity between two rasters of identical shape.
 * Implementations must be pure and safe to call concurrently.
 */
public interface SimilarityScorer {

    /**
     * @param candidate Newly rendered page
     * @param baseline  Accepted reference page
     * @return Similarity in [0, 1] and the per-pixel dissimilarity map
     * @throws ShapeMismatchException if the shapes differ
     */
    ScoreResult score(PixelGrid candidate, PixelGrid baseline);
}
