package guraa.pdfbaseline.store;

import guraa.pdfbaseline.model.PageKey;
import guraa.pdfbaseline.model.PixelGrid;

/**
 * Exclusive write access to a {@link BaselineStore}. Obtain it with try-with-resources;
 * closing releases the exclusive lock on every exit path.
 */
public interface BaselineWriteHandle extends AutoCloseable {

    /**
     * Create or overwrite the baseline of one page. Either the new raster is fully stored or
     * the previous entry remains.
     *
     * @throws StoreWriteException if the write fails
     */
    void write(PageKey key, PixelGrid grid) throws StoreWriteException;

    @Override
    void close();
}
