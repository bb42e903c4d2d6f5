package guraa.pdfbaseline.store;

import guraa.pdfbaseline.model.PageKey;
import guraa.pdfbaseline.model.PixelGrid;

import java.util.Map;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Baseline store held in memory, for embedding the engine without a file system.
 */
public class InMemoryBaselineStore extends AbstractBaselineStore {

    private final Map<PageKey, PixelGrid> entries = new ConcurrentHashMap<>();

    public InMemoryBaselineStore() {
    }

    public InMemoryBaselineStore(Map<PageKey, PixelGrid> initial) {
        entries.putAll(initial);
    }

    @Override
    protected Optional<PixelGrid> doLoad(PageKey key) {
        return Optional.ofNullable(entries.get(key));
    }

    @Override
    protected SortedSet<Integer> doPageNumbers(String documentStem) {
        SortedSet<Integer> pages = new TreeSet<>();
        for (PageKey key : entries.keySet()) {
            if (key.getDocumentStem().equals(documentStem)) {
                pages.add(key.getPageNumber());
            }
        }
        return pages;
    }

    @Override
    protected void doWrite(PageKey key, PixelGrid grid) {
        // PixelGrid is immutable, a single put is atomic
        entries.put(key, grid);
    }

    /**
     * Copy of all entries.
     */
    public Map<PageKey, PixelGrid> snapshot() {
        return Map.copyOf(entries);
    }
}
