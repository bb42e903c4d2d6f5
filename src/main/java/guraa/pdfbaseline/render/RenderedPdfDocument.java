package guraa.pdfbaseline.render;

import guraa.pdfbaseline.model.PixelGrid;
import guraa.pdfbaseline.util.FileUtils;

import java.nio.file.Path;
import java.util.List;

/**
 * PDF file rendered on first access and cached, so the approval step reuses the rasters
 * the comparison saw.
 */
public class RenderedPdfDocument implements CandidateDocument {

    private final Path path;
    private final int dpi;
    private final PdfRenderingService renderingService;

    private List<PixelGrid> pages;
    private RenderException failure;

    public RenderedPdfDocument(Path path, int dpi, PdfRenderingService renderingService) {
        this.path = path;
        this.dpi = dpi;
        this.renderingService = renderingService;
    }

    public Path getPath() {
        return path;
    }

    @Override
    public String getStem() {
        return FileUtils.stem(path);
    }

    @Override
    public synchronized List<PixelGrid> getPages() throws RenderException {
        if (pages == null && failure == null) {
            try {
                pages = renderingService.render(path, dpi);
            } catch (RenderException e) {
                failure = e;
            }
        }
        if (failure != null) {
            throw failure;
        }
        return pages;
    }
}
