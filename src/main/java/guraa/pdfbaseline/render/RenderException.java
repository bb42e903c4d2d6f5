package guraa.pdfbaseline.render;

import java.io.IOException;
import java.nio.file.Path;

/**
 * A candidate document could not be rendered. Fails that document only.
 */
public class RenderException extends IOException {

    private final Path document;

    public RenderException(Path document, String message) {
        super(message);
        this.document = document;
    }

    public RenderException(Path document, String message, Throwable cause) {
        super(message, cause);
        this.document = document;
    }

    public Path getDocument() {
        return document;
    }
}
