package guraa.pdfbaseline.report;

import guraa.pdfbaseline.model.PageKey;
import guraa.pdfbaseline.model.PageResult;
import guraa.pdfbaseline.model.RunResult;
import guraa.pdfbaseline.store.BaselineNaming;
import guraa.pdfbaseline.util.FileUtils;
import guraa.pdfbaseline.util.ImageConverter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Writes the diff overlays of a run as {@code {stem}_page_{n}_diff.png} files.
 */
@Slf4j
@Component
public class DiffImageWriter {

    /**
     * Write every overlay the run carries. A page whose overlay cannot be written is logged
     * and left out of the returned set; the overlay is advisory so this never fails the run.
     *
     * @param run       Comparison results
     * @param outputDir Target directory, created if needed
     * @return Keys of the pages whose overlay was written
     */
    public Set<PageKey> writeAll(RunResult run, Path outputDir) throws IOException {
        FileUtils.createDirectories(outputDir);
        Set<PageKey> written = new LinkedHashSet<>();

        for (PageResult page : run.allPages()) {
            if (!page.hasDiffImage()) {
                continue;
            }
            Path target = outputDir.resolve(BaselineNaming.diffFileName(page.getKey()));
            try {
                FileUtils.writeAtomically(target, ImageConverter.toPngBytes(page.getDiffImage()));
                written.add(page.getKey());
                log.debug("Wrote diff image {}", target);
            } catch (IOException e) {
                log.warn("Could not write diff image {}: {}", target, e.getMessage());
            }
        }

        if (!written.isEmpty()) {
            log.info("Wrote {} diff image(s) to {}", written.size(), outputDir);
        }
        return written;
    }
}
