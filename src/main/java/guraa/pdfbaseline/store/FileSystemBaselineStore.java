package guraa.pdfbaseline.store;

import guraa.pdfbaseline.model.PageKey;
import guraa.pdfbaseline.model.PixelGrid;
import guraa.pdfbaseline.util.FileUtils;
import guraa.pdfbaseline.util.ImageConverter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.Stream;

/**
 * Baselines stored as PNG files named {@code {stem}_page_{n}.png} in one directory.
 */
@Slf4j
public class FileSystemBaselineStore extends AbstractBaselineStore {

    private final Path directory;

    public FileSystemBaselineStore(Path directory) {
        this.directory = directory;
    }

    public Path getDirectory() {
        return directory;
    }

    public Path pathFor(PageKey key) {
        return directory.resolve(BaselineNaming.fileName(key));
    }

    @Override
    protected Optional<PixelGrid> doLoad(PageKey key) throws BaselineReadException {
        Path file = pathFor(key);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            PixelGrid grid = ImageConverter.fromImageBytes(Files.readAllBytes(file));
            log.debug("Loaded baseline {} ({})", file.getFileName(), grid.shapeDescription());
            return Optional.of(grid);
        } catch (IOException e) {
            throw new BaselineReadException(key, "Unreadable baseline " + file + ": " + e.getMessage(), e);
        }
    }

    @Override
    protected SortedSet<Integer> doPageNumbers(String documentStem) {
        SortedSet<Integer> pages = new TreeSet<>();
        if (!Files.isDirectory(directory)) {
            return pages;
        }
        try (Stream<Path> files = Files.list(directory)) {
            files.filter(Files::isRegularFile)
                    .map(path -> BaselineNaming.parse(path.getFileName().toString()))
                    .flatMap(Optional::stream)
                    .filter(key -> key.getDocumentStem().equals(documentStem))
                    .forEach(key -> pages.add(key.getPageNumber()));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot list baseline directory " + directory, e);
        }
        return pages;
    }

    @Override
    protected void doWrite(PageKey key, PixelGrid grid) throws StoreWriteException {
        Path target = pathFor(key);
        try {
            FileUtils.writeAtomically(target, ImageConverter.toPngBytes(grid));
        } catch (IOException e) {
            throw new StoreWriteException(key, "Failed to write baseline " + target + ": " + e.getMessage(), e);
        }
    }
}
