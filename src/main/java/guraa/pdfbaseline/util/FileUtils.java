package guraa.pdfbaseline.util;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Utility class for file operations that must never leave a partially written target.
 */
@Slf4j
public final class FileUtils {

    private static final int DEFAULT_RETRY_COUNT = 3;
    private static final int DEFAULT_RETRY_DELAY_MS = 100;

    private FileUtils() {
        // Utility class, no instances allowed
    }

    /**
     * Write bytes to a file atomically: the content goes to a temporary file in the target's
     * directory, which then replaces the target in a single move.
     *
     * @param target  The file to create or replace
     * @param content The bytes to write
     * @throws IOException If the write fails after all retries; the target is then unchanged
     */
    public static void writeAtomically(Path target, byte[] content) throws IOException {
        writeAtomically(target, content, DEFAULT_RETRY_COUNT, DEFAULT_RETRY_DELAY_MS);
    }

    /**
     * Write bytes to a file atomically with retries.
     *
     * @param target       The file to create or replace
     * @param content      The bytes to write
     * @param retryCount   Number of attempts
     * @param retryDelayMs Delay between attempts in milliseconds, multiplied by the attempt number
     * @throws IOException If every attempt fails
     */
    public static void writeAtomically(Path target, byte[] content, int retryCount, int retryDelayMs) throws IOException {
        Path directory = target.toAbsolutePath().getParent();
        createDirectories(directory);

        IOException lastException = null;

        for (int attempt = 0; attempt < retryCount; attempt++) {
            Path tempFile = null;
            try {
                tempFile = Files.createTempFile(directory, ".write_", ".tmp");
                Files.write(tempFile, content);

                if (Files.size(tempFile) != content.length) {
                    throw new IOException("Written file size differs from content size");
                }

                moveIntoPlace(tempFile, target);
                return; // Success!
            } catch (IOException e) {
                lastException = e;
                log.warn("Attempt {} failed to write {}: {}", attempt + 1, target, e.getMessage());

                if (attempt < retryCount - 1) {
                    try {
                        Thread.sleep((long) retryDelayMs * (attempt + 1));
                    } catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        throw new IOException("Thread interrupted during retry delay", ie);
                    }
                }
            } finally {
                // Clean up temp file if it still exists
                if (tempFile != null) {
                    try {
                        Files.deleteIfExists(tempFile);
                    } catch (IOException e) {
                        log.warn("Failed to delete temporary file {}: {}", tempFile, e.getMessage());
                    }
                }
            }
        }

        throw new IOException("Failed to write " + target + " after " + retryCount + " attempts", lastException);
    }

    private static void moveIntoPlace(Path tempFile, Path target) throws IOException {
        try {
            Files.move(tempFile, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move not supported for {}, falling back to replace", target);
            Files.move(tempFile, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    /**
     * Create a directory and its parents if they do not exist.
     *
     * @param directory The directory to create
     * @throws IOException If the directory cannot be created
     */
    public static void createDirectories(Path directory) throws IOException {
        if (directory != null && !Files.isDirectory(directory)) {
            Files.createDirectories(directory);
            log.debug("Created directory: {}", directory);
        }
    }

    /**
     * File name without its last extension, e.g. {@code invoice} for {@code invoice.pdf}.
     */
    public static String stem(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
