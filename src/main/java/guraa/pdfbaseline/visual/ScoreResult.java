package guraa.pdfbaseline.visual;

import lombok.Value;

/**
 * Scorer output. The similarity is a primitive double in [0, 1] so it serialises and
 * compares as a plain number.
 */
@Value
public class ScoreResult {

    double similarity;

    DissimilarityMap structuralDiff;
}
