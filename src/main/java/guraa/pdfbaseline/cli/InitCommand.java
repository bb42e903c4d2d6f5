package guraa.pdfbaseline.cli;

import guraa.pdfbaseline.config.AppProperties;
import guraa.pdfbaseline.config.ConfigException;
import guraa.pdfbaseline.model.PageKey;
import guraa.pdfbaseline.model.PixelGrid;
import guraa.pdfbaseline.render.PdfRenderingService;
import guraa.pdfbaseline.render.RenderException;
import guraa.pdfbaseline.service.DocumentScanner;
import guraa.pdfbaseline.store.BaselineNaming;
import guraa.pdfbaseline.store.BaselineWriteHandle;
import guraa.pdfbaseline.store.FileSystemBaselineStore;
import guraa.pdfbaseline.store.StoreWriteException;
import guraa.pdfbaseline.util.FileUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Renders a directory of PDFs and stores every page as a baseline.
 */
@Slf4j
@Component
@Command(
        name = "init",
        description = "Initialise baseline images from a directory of PDFs",
        mixinStandardHelpOptions = true
)
public class InitCommand implements Callable<Integer> {

    private final PdfRenderingService renderingService;
    private final DocumentScanner documentScanner;
    private final AppProperties properties;

    @Spec
    private CommandSpec spec;

    @Mixin
    private VerboseOption verboseOption;

    @Option(names = {"-p", "--pdf-dir"}, description = "Directory containing source PDFs", required = true)
    private Path pdfDir;

    @Option(names = {"-r", "--ref-dir"}, description = "Directory to store baseline PNGs (default: app.storage.baseline-dir)")
    private Path refDir;

    @Option(names = {"--dpi"}, description = "Render DPI (default: app.comparison.dpi)")
    private Integer dpi;

    public InitCommand(PdfRenderingService renderingService, DocumentScanner documentScanner,
                       AppProperties properties) {
        this.renderingService = renderingService;
        this.documentScanner = documentScanner;
        this.properties = properties;
    }

    @Override
    public Integer call() throws IOException {
        verboseOption.apply();
        PrintWriter out = spec.commandLine().getOut();

        int resolution = dpi != null ? dpi : properties.getComparison().getDpi();
        if (resolution <= 0) {
            throw new ConfigException("DPI must be a positive integer, got " + resolution);
        }
        if (!Files.isDirectory(pdfDir)) {
            throw new ConfigException("PDF directory does not exist: " + pdfDir);
        }

        List<Path> pdfs = documentScanner.findPdfs(pdfDir);
        if (pdfs.isEmpty()) {
            out.println("No PDFs found in " + pdfDir);
            return ExitCodes.PASSED;
        }

        Path refDir = this.refDir != null ? this.refDir : Path.of(properties.getStorage().getBaselineDir());
        FileUtils.createDirectories(refDir);
        FileSystemBaselineStore store = new FileSystemBaselineStore(refDir);
        int failed = 0;

        for (Path pdf : pdfs) {
            out.println("Rendering: " + pdf.getFileName());
            try {
                storeDocument(pdf, resolution, store, out);
            } catch (RenderException | StoreWriteException e) {
                log.error("Skipping {}: {}", pdf.getFileName(), e.getMessage());
                out.println("  Skipped: " + e.getMessage());
                failed++;
            }
        }

        out.println();
        out.println("Initialised " + (pdfs.size() - failed) + " of " + pdfs.size() + " PDF(s) -> " + refDir);
        return failed == 0 ? ExitCodes.PASSED : ExitCodes.NOT_PASSED;
    }

    private void storeDocument(Path pdf, int resolution, FileSystemBaselineStore store, PrintWriter out)
            throws RenderException, StoreWriteException {
        String stem = FileUtils.stem(pdf);
        List<PixelGrid> pages = renderingService.render(pdf, resolution);

        try (BaselineWriteHandle handle = store.openForWrite()) {
            for (int i = 0; i < pages.size(); i++) {
                PageKey key = PageKey.of(stem, i + 1);
                handle.write(key, pages.get(i));
                out.println("  Saved: " + BaselineNaming.fileName(key));
            }
        }
    }
}
