package guraa.pdfbaseline.store;

import guraa.pdfbaseline.model.PageKey;

import java.io.IOException;

/**
 * A stored baseline exists but cannot be decoded.
 */
public class BaselineReadException extends IOException {

    private final PageKey key;

    public BaselineReadException(PageKey key, String message, Throwable cause) {
        super(message, cause);
        this.key = key;
    }

    public PageKey getKey() {
        return key;
    }
}
