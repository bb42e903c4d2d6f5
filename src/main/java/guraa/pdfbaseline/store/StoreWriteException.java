package guraa.pdfbaseline.store;

import guraa.pdfbaseline.model.PageKey;

import java.io.IOException;

/**
 * A baseline could not be written. The previous entry, if any, is left untouched.
 */
public class StoreWriteException extends IOException {

    private final PageKey key;

    public StoreWriteException(PageKey key, String message, Throwable cause) {
        super(message, cause);
        this.key = key;
    }

    public PageKey getKey() {
        return key;
    }
}
