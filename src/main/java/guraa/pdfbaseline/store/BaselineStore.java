package guraa.pdfbaseline.store;

import guraa.pdfbaseline.model.PageKey;
import guraa.pdfbaseline.model.PixelGrid;

import java.util.Optional;
import java.util.SortedSet;

/**
 * Accepted reference rasters keyed by page. The store is owned by the caller and passed in
 * explicitly; entries are only ever overwritten through {@link #openForWrite()}, never deleted.
 */
public interface BaselineStore {

    /**
     * @return The baseline, or empty when the page has none
     * @throws BaselineReadException if an entry exists but cannot be read
     */
    Optional<PixelGrid> load(PageKey key) throws BaselineReadException;

    /**
     * Page numbers stored for a document, ascending.
     */
    SortedSet<Integer> pageNumbers(String documentStem);

    default int pageCount(String documentStem) {
        return pageNumbers(documentStem).size();
    }

    /**
     * Acquire exclusive write access. Readers never observe a half-written entry.
     */
    BaselineWriteHandle openForWrite();
}
