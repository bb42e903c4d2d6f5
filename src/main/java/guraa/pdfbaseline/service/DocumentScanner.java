package guraa.pdfbaseline.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Finds the PDF files of a directory, sorted by file name so runs are reproducible.
 */
@Slf4j
@Component
public class DocumentScanner {

    public List<Path> findPdfs(Path directory) throws IOException {
        try (Stream<Path> files = Files.list(directory)) {
            List<Path> pdfs = files
                    .filter(Files::isRegularFile)
                    .filter(path -> path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".pdf"))
                    .sorted((a, b) -> a.getFileName().toString().compareTo(b.getFileName().toString()))
                    .collect(Collectors.toList());
            log.debug("Found {} PDF(s) in {}", pdfs.size(), directory);
            return pdfs;
        }
    }
}
