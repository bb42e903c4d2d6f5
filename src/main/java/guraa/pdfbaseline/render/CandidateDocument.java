package guraa.pdfbaseline.render;

import guraa.pdfbaseline.model.PixelGrid;

import java.util.List;

/**
 * A newly produced document awaiting comparison, addressed by its file stem.
 */
public interface CandidateDocument {

    String getStem();

    /**
     * Rasterised pages in page order.
     *
     * @throws RenderException if the document cannot be rendered
     */
    List<PixelGrid> getPages() throws RenderException;
}
