package guraa.pdfbaseline.render;

import guraa.pdfbaseline.model.PixelGrid;

import java.util.List;

/**
 * Candidate whose pages are already rasterised.
 */
public class InMemoryCandidateDocument implements CandidateDocument {

    private final String stem;
    private final List<PixelGrid> pages;

    public InMemoryCandidateDocument(String stem, List<PixelGrid> pages) {
        this.stem = stem;
        this.pages = List.copyOf(pages);
    }

    @Override
    public String getStem() {
        return stem;
    }

    @Override
    public List<PixelGrid> getPages() {
        return pages;
    }
}
