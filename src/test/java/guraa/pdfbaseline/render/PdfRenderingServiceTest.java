package guraa.pdfbaseline.render;

import guraa.pdfbaseline.TestPdfs;
import guraa.pdfbaseline.model.PageKey;
import guraa.pdfbaseline.model.PixelGrid;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class PdfRenderingServiceTest {

    @TempDir
    Path directory;

    private final PdfRenderingService renderingService = new PdfRenderingService();

    @Test
    void rendersEveryPageAsRgbAtTheRequestedResolution() throws Exception {
        Path pdf = TestPdfs.withBoxes(directory.resolve("boxes.pdf"), new float[]{20, 20, 50, 50}, null);

        List<PixelGrid> pages = renderingService.render(pdf, TestPdfs.TEST_DPI);

        assertThat(pages).hasSize(2);
        // A6 is 297.6 x 419.5 points, half a pixel per point at 36 DPI
        assertThat(pages.get(0).getWidth()).isBetween(148, 150);
        assertThat(pages.get(0).getHeight()).isBetween(209, 211);
        assertThat(pages.get(0).getChannels()).isEqualTo(PixelGrid.RGB);
        assertThat(pages.get(0)).isNotEqualTo(pages.get(1));
        assertThat(pages.get(1).get(0, 0, 0)).isEqualTo(255);
    }

    @Test
    void renderingIsDeterministic() throws Exception {
        Path pdf = TestPdfs.withBoxes(directory.resolve("boxes.pdf"), new float[]{10, 30, 80, 20});

        assertThat(renderingService.render(pdf, TestPdfs.TEST_DPI))
                .isEqualTo(renderingService.render(pdf, TestPdfs.TEST_DPI));
    }

    @Test
    void higherResolutionGivesLargerRasters() throws Exception {
        Path pdf = TestPdfs.blank(directory.resolve("blank.pdf"), 1);

        PixelGrid low = renderingService.render(pdf, 36).get(0);
        PixelGrid high = renderingService.render(pdf, 72).get(0);

        assertThat(high.getWidth()).isGreaterThan(low.getWidth());
        assertThat(high.isComparableTo(low)).isFalse();
    }

    @Test
    void missingFileIsARenderError() {
        Path missing = directory.resolve("missing.pdf");

        assertThatThrownBy(() -> renderingService.render(missing, TestPdfs.TEST_DPI))
                .isInstanceOfSatisfying(RenderException.class,
                        e -> assertThat(e.getDocument()).isEqualTo(missing))
                .hasMessageContaining("not found");
    }

    @Test
    void corruptFileIsARenderError() throws Exception {
        Path corrupt = TestPdfs.corrupt(directory.resolve("corrupt.pdf"));

        assertThatThrownBy(() -> renderingService.render(corrupt, TestPdfs.TEST_DPI))
                .isInstanceOf(RenderException.class);
    }

    @Test
    void renderedDocumentRendersOnceAndCachesFailures() throws Exception {
        Path pdf = TestPdfs.blank(directory.resolve("report.pdf"), 2);
        PdfRenderingService service = spy(new PdfRenderingService());
        RenderedPdfDocument document = new RenderedPdfDocument(pdf, TestPdfs.TEST_DPI, service);

        assertThat(document.getStem()).isEqualTo("report");
        assertThat(document.getPages()).hasSize(2);
        assertThat(document.getPages()).hasSize(2);
        verify(service, times(1)).render(pdf, TestPdfs.TEST_DPI);

        Files.delete(pdf);
        RenderedPdfDocument missing = new RenderedPdfDocument(pdf, TestPdfs.TEST_DPI, service);
        assertThatThrownBy(missing::getPages).isInstanceOf(RenderException.class);
        assertThatThrownBy(missing::getPages).isInstanceOf(RenderException.class);
        verify(service, times(2)).render(pdf, TestPdfs.TEST_DPI);
    }

    @Test
    void pageIndexSkipsDocumentsThatFailToRender() throws Exception {
        Path good = TestPdfs.blank(directory.resolve("good.pdf"), 2);
        Path bad = TestPdfs.corrupt(directory.resolve("bad.pdf"));

        CandidatePageIndex index = CandidatePageIndex.of(List.of(
                new RenderedPdfDocument(good, TestPdfs.TEST_DPI, renderingService),
                new RenderedPdfDocument(bad, TestPdfs.TEST_DPI, renderingService)));

        assertThat(index.size()).isEqualTo(2);
        assertThat(index.contains(PageKey.of("good", 2))).isTrue();
        assertThat(index.contains(PageKey.of("bad", 1))).isFalse();
    }
}
