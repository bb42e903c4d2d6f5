package guraa.pdfbaseline.store;

import guraa.pdfbaseline.model.PageKey;
import guraa.pdfbaseline.model.PixelGrid;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;
import java.util.SortedSet;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Lock discipline shared by the store implementations: many concurrent readers, one writer,
 * and no reader while a write handle is open.
 */
@Slf4j
public abstract class AbstractBaselineStore implements BaselineStore {

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    @Override
    public final Optional<PixelGrid> load(PageKey key) throws BaselineReadException {
        lock.readLock().lock();
        try {
            return doLoad(key);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public final SortedSet<Integer> pageNumbers(String documentStem) {
        lock.readLock().lock();
        try {
            return doPageNumbers(documentStem);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public final BaselineWriteHandle openForWrite() {
        lock.writeLock().lock();
        return new LockedWriteHandle();
    }

    protected abstract Optional<PixelGrid> doLoad(PageKey key) throws BaselineReadException;

    protected abstract SortedSet<Integer> doPageNumbers(String documentStem);

    /**
     * Store one entry; must leave the previous entry intact on failure.
     */
    protected abstract void doWrite(PageKey key, PixelGrid grid) throws StoreWriteException;

    private final class LockedWriteHandle implements BaselineWriteHandle {

        private boolean open = true;

        @Override
        public void write(PageKey key, PixelGrid grid) throws StoreWriteException {
            if (!open) {
                throw new IllegalStateException("Write handle already closed");
            }
            doWrite(key, grid);
            log.debug("Baseline written: {}", key);
        }

        @Override
        public void close() {
            if (open) {
                open = false;
                lock.writeLock().unlock();
            }
        }
    }
}
