package guraa.pdfbaseline.render;

import guraa.pdfbaseline.model.PixelGrid;
import guraa.pdfbaseline.util.ImageConverter;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;
import org.springframework.stereotype.Service;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * PDF rendering with consistent settings: every page of a document is rendered at the
 * requested DPI as RGB so rasters from different runs are comparable.
 */
@Slf4j
@Service
public class PdfRenderingService {

    private static final ImageType RENDERING_IMAGE_TYPE = ImageType.RGB;
    private static final int MAX_RETRIES = 2;

    /**
     * Render every page of a PDF.
     *
     * @param pdf Path to the PDF file
     * @param dpi Rendering resolution
     * @return One RGB grid per page, in page order
     * @throws RenderException If the file is missing, unreadable, or has no pages
     */
    public List<PixelGrid> render(Path pdf, int dpi) throws RenderException {
        if (!Files.isRegularFile(pdf)) {
            throw new RenderException(pdf, "PDF not found: " + pdf);
        }

        List<PixelGrid> pages = new ArrayList<>();
        try (PDDocument document = loadDocument(pdf)) {
            PDFRenderer renderer = new PDFRenderer(document);
            int pageCount = document.getNumberOfPages();

            for (int i = 0; i < pageCount; i++) {
                BufferedImage image = renderPageWithRetry(renderer, pdf, i, dpi);
                pages.add(ImageConverter.toPixelGrid(image));
                log.debug("Rendered page {} of {} ({}x{})", i + 1, pdf.getFileName(), image.getWidth(), image.getHeight());
            }
        } catch (RenderException e) {
            throw e;
        } catch (IOException e) {
            throw new RenderException(pdf, "Failed to render PDF " + pdf + ": " + e.getMessage(), e);
        }

        if (pages.isEmpty()) {
            throw new RenderException(pdf, "PDF has no pages: " + pdf);
        }

        log.info("Rendered {} page(s) from {} at {} DPI", pages.size(), pdf.getFileName(), dpi);
        return pages;
    }

    private PDDocument loadDocument(Path pdf) throws RenderException {
        try {
            return PDDocument.load(pdf.toFile());
        } catch (IOException e) {
            log.error("Failed to load document {}: {}", pdf, e.getMessage());
            throw new RenderException(pdf, "Failed to open PDF " + pdf + ": " + e.getMessage(), e);
        }
    }

    /**
     * Render one page, retrying transient failures. No fallback settings are tried: a page
     * rendered at another resolution would not be comparable with its baseline.
     */
    private BufferedImage renderPageWithRetry(PDFRenderer renderer, Path pdf, int pageIndex, int dpi)
            throws RenderException {
        IOException lastException = null;

        for (int attempt = 1; attempt <= MAX_RETRIES; attempt++) {
            try {
                return renderer.renderImageWithDPI(pageIndex, dpi, RENDERING_IMAGE_TYPE);
            } catch (IOException e) {
                lastException = e;
                log.warn("Rendering attempt {} failed for page {} of {}: {}",
                        attempt, pageIndex + 1, pdf.getFileName(), e.getMessage());
            }
        }

        throw new RenderException(pdf, "Failed to render page " + (pageIndex + 1) + " of " + pdf, lastException);
    }
}
